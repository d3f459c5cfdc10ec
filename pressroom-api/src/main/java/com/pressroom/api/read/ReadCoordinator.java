package com.pressroom.api.read;

import com.pressroom.api.relation.RelationshipGraph;
import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.Profile;
import com.pressroom.core.domain.Tag;
import com.pressroom.core.exception.EntityKind;
import com.pressroom.core.exception.EntityNotFoundException;
import com.pressroom.core.exception.ValidationException;
import com.pressroom.core.query.ContentScope;
import com.pressroom.core.relation.Relation;
import com.pressroom.core.repository.AccountRepository;
import com.pressroom.core.repository.ContentRepository;
import com.pressroom.core.repository.ProfileRepository;
import com.pressroom.core.repository.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read Coordinator - scoped, paginated queries with relations loaded in batches.
 * 
 * Every read runs in its own read-only transaction. Nothing is cached between calls.
 */
@Service
@Transactional(readOnly = true)
public class ReadCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ReadCoordinator.class);

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 10;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final AccountRepository accountRepository;
    private final ProfileRepository profileRepository;
    private final ContentRepository contentRepository;
    private final TagRepository tagRepository;
    private final RelationshipGraph relationshipGraph;

    public ReadCoordinator(
            AccountRepository accountRepository,
            ProfileRepository profileRepository,
            ContentRepository contentRepository,
            TagRepository tagRepository,
            RelationshipGraph relationshipGraph) {
        this.accountRepository = accountRepository;
        this.profileRepository = profileRepository;
        this.contentRepository = contentRepository;
        this.tagRepository = tagRepository;
        this.relationshipGraph = relationshipGraph;
    }

    /**
     * Lists content by scope name.
     *
     * @param scopeName {@code active}, {@code draft} or {@code archived}; null lists everything
     * @throws com.pressroom.core.exception.InvalidScopeException for any other name
     */
    public ContentPage listContent(String scopeName, int page, int pageSize) {
        return listContent(scopeName == null ? null : ContentScope.fromName(scopeName), page, pageSize);
    }

    /**
     * Lists one page of content, newest first, with author and tags loaded.
     *
     * @param scope    filter, null for none
     * @param page     1-based page number
     * @param pageSize rows per page, at least 1
     */
    public ContentPage listContent(ContentScope scope, int page, int pageSize) {
        if (page < 1) {
            throw new ValidationException("page", "must be at least 1");
        }
        if (pageSize < 1) {
            throw new ValidationException("pageSize", "must be at least 1");
        }

        if ((long) (page - 1) * pageSize > Integer.MAX_VALUE) {
            // beyond any row JPA can address; report the real total with no items
            long total = contentRepository.count(ContentScope.filter(scope));
            return ContentPage.of(List.of(), total, page, pageSize);
        }

        Page<Content> slice = contentRepository.findAll(
                ContentScope.filter(scope), PageRequest.of(page - 1, pageSize, NEWEST_FIRST));
        log.debug("Listed {} of {} content rows (scope={}, page={}, size={})",
                slice.getNumberOfElements(), slice.getTotalElements(), scope, page, pageSize);
        return ContentPage.of(toViews(slice.getContent()), slice.getTotalElements(), page, pageSize);
    }

    public ContentView getContentById(Long id) {
        Content content = Optional.ofNullable(id).flatMap(contentRepository::findById)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.CONTENT));
        return toViews(List.of(content)).get(0);
    }

    /**
     * Loads an account with its profile and content. An account without either is
     * returned with a null profile and an empty content list.
     */
    public AccountView getAccountById(Long id) {
        Account account = Optional.ofNullable(id).flatMap(accountRepository::findById)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.ACCOUNT));
        Profile profile = relationshipGraph.resolveOne(account, Relation.ACCOUNT_PROFILE).orElse(null);
        List<Content> contents = relationshipGraph.resolve(account, Relation.ACCOUNT_CONTENTS);
        return new AccountView(account, profile, contents);
    }

    public ProfileView getProfileByAccountId(Long accountId) {
        Profile profile = Optional.ofNullable(accountId).flatMap(profileRepository::findByAccountId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.PROFILE));
        Account account = relationshipGraph.resolveOne(profile, Relation.PROFILE_ACCOUNT).orElse(null);
        return new ProfileView(profile, account);
    }

    public List<Account> listAccounts() {
        return accountRepository.findAllByOrderByIdAsc();
    }

    public List<Tag> listTags() {
        return tagRepository.findAllByOrderByIdAsc();
    }

    private List<ContentView> toViews(List<Content> contents) {
        Map<Long, List<Account>> authors = relationshipGraph.resolveAll(contents, Relation.CONTENT_ACCOUNT);
        Map<Long, List<Tag>> tags = relationshipGraph.resolveAll(contents, Relation.CONTENT_TAGS);
        return contents.stream()
                .map(content -> new ContentView(
                        content,
                        authors.getOrDefault(content.getId(), List.of()).stream().findFirst().orElse(null),
                        tags.getOrDefault(content.getId(), List.of())))
                .toList();
    }
}
