package com.pressroom.api.hook;

import com.pressroom.core.domain.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Announces new account registrations.
 */
@Component
public class AccountRegistrationHook implements AfterCreateHook<Account> {

    private static final Logger log = LoggerFactory.getLogger(AccountRegistrationHook.class);

    @Override
    public Class<Account> entityType() {
        return Account.class;
    }

    @Override
    public void afterCreate(Account account) {
        log.info("New account registered: {} <{}>", account.getFullName(), account.getEmail());
    }
}
