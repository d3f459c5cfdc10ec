package com.pressroom.api.hook;

import com.pressroom.core.domain.Content;
import com.pressroom.core.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Announces new content together with its author.
 */
@Component
public class ContentCreationHook implements AfterCreateHook<Content> {

    private static final Logger log = LoggerFactory.getLogger(ContentCreationHook.class);

    private final AccountRepository accountRepository;

    public ContentCreationHook(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    public Class<Content> entityType() {
        return Content.class;
    }

    @Override
    public void afterCreate(Content content) {
        accountRepository.findById(content.getAccountId()).ifPresentOrElse(
                author -> log.info("New content by {}: \"{}\" ({})",
                        author.getFullName(), content.getTitle(), content.getStatus().getValue()),
                () -> log.warn("Content {} created for account {} which no longer exists",
                        content.getId(), content.getAccountId()));
    }
}
