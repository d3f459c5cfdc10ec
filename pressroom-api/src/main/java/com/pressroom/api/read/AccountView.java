package com.pressroom.api.read;

import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.Profile;

import java.util.List;

/**
 * Account with its profile, if any, and its content, newest first.
 */
public record AccountView(Account account, Profile profile, List<Content> contents) {}
