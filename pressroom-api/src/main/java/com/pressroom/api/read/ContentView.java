package com.pressroom.api.read;

import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.Tag;

import java.util.List;

/**
 * Content with its author and tags loaded.
 *
 * @param account author, null only if the account row has vanished
 */
public record ContentView(Content content, Account account, List<Tag> tags) {}
