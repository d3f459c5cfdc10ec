package com.pressroom.api.write;

import com.pressroom.api.config.WriteProperties;
import com.pressroom.api.hook.LifecycleHookDispatcher;
import com.pressroom.api.relation.RelationshipGraph;
import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.ContentStatus;
import com.pressroom.core.domain.Profile;
import com.pressroom.core.domain.Tag;
import com.pressroom.core.exception.EntityKind;
import com.pressroom.core.exception.EntityNotFoundException;
import com.pressroom.core.exception.PressroomException;
import com.pressroom.core.exception.TransactionFailureException;
import com.pressroom.core.exception.ValidationException;
import com.pressroom.core.repository.AccountRepository;
import com.pressroom.core.repository.ContentRepository;
import com.pressroom.core.repository.ContentTagRepository;
import com.pressroom.core.repository.ProfileRepository;
import com.pressroom.core.repository.TagRepository;
import com.pressroom.core.schema.EntityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Write Coordinator - every mutation of the publishing model goes through here.
 * 
 * Multi-step writes run inside one {@link TransactionTemplate} scope: either every
 * statement commits or none does. Validation and not-found errors leave the scope
 * unchanged after rollback; storage failures come out as
 * {@link TransactionFailureException}. After-create hooks run only once the insert has
 * committed.
 */
@Service
public class WriteCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WriteCoordinator.class);

    private final AccountRepository accountRepository;
    private final ProfileRepository profileRepository;
    private final ContentRepository contentRepository;
    private final TagRepository tagRepository;
    private final ContentTagRepository contentTagRepository;
    private final RelationshipGraph relationshipGraph;
    private final LifecycleHookDispatcher hookDispatcher;
    private final EntityValidator entityValidator;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;
    private final int tagConflictRetries;
    private final Duration retryBackoff;

    public WriteCoordinator(
            AccountRepository accountRepository,
            ProfileRepository profileRepository,
            ContentRepository contentRepository,
            TagRepository tagRepository,
            ContentTagRepository contentTagRepository,
            RelationshipGraph relationshipGraph,
            LifecycleHookDispatcher hookDispatcher,
            EntityValidator entityValidator,
            PlatformTransactionManager transactionManager,
            WriteProperties properties) {
        this.accountRepository = accountRepository;
        this.profileRepository = profileRepository;
        this.contentRepository = contentRepository;
        this.tagRepository = tagRepository;
        this.contentTagRepository = contentTagRepository;
        this.relationshipGraph = relationshipGraph;
        this.hookDispatcher = hookDispatcher;
        this.entityValidator = entityValidator;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.writeTransaction.setTimeout((int) Math.max(1, properties.transactionTimeout().toSeconds()));
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.tagConflictRetries = Math.max(1, properties.tagConflictRetries());
        this.retryBackoff = properties.retryBackoff();
    }

    // ==================== Composite writes ====================

    /**
     * Creates a content item and attaches the named tags, creating missing tags on the
     * way, as one atomic unit.
     *
     * @param status   initial status, {@code draft} when null
     * @param tagNames tag names; trimmed, duplicates ignored
     * @return the committed content
     * @throws EntityNotFoundException     if the account does not exist
     * @throws ValidationException         if the content or any tag is invalid; nothing is kept
     * @throws TransactionFailureException if storage fails; nothing is kept
     */
    public Content createContentWithTags(
            Long accountId, String title, String body, ContentStatus status, List<String> tagNames) {
        if (accountId == null || !accountRepository.existsById(accountId)) {
            throw new EntityNotFoundException(EntityKind.ACCOUNT);
        }
        List<String> names = normalizeTagNames(tagNames);

        Content created = null;
        for (int attempt = 1; created == null; attempt++) {
            try {
                created = inTransaction("create content",
                        () -> insertContentWithTags(accountId, title, body, status, names));
            } catch (TagNameConflictException e) {
                if (attempt >= tagConflictRetries) {
                    throw new TransactionFailureException(
                            "Tag '" + e.tagName + "' kept conflicting after " + attempt + " attempts", e.getCause());
                }
                log.info("Tag '{}' was created concurrently, retrying content creation (attempt {})",
                        e.tagName, attempt + 1);
                pauseBeforeRetry(attempt);
            }
        }

        log.info("Created content {} for account {} with {} tag(s)", created.getId(), accountId, names.size());
        hookDispatcher.afterCreate(created);
        return created;
    }

    private void pauseBeforeRetry(int attempt) {
        long millis = retryBackoff.toMillis() << Math.min(attempt - 1, 10);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionFailureException("Interrupted while retrying content creation", e);
        }
    }

    private Content insertContentWithTags(
            Long accountId, String title, String body, ContentStatus status, List<String> names) {
        Content content = contentRepository.save(
                entityValidator.validate(Content.create(accountId, title, body, status)));
        for (String name : names) {
            Tag tag = findOrCreateTag(name);
            relationshipGraph.link(content.getId(), tag.getId());
        }
        return content;
    }

    private Tag findOrCreateTag(String name) {
        return tagRepository.findByName(name).orElseGet(() -> {
            Tag tag = entityValidator.validate(Tag.create(name));
            try {
                return tagRepository.saveAndFlush(tag);
            } catch (DataIntegrityViolationException | CannotAcquireLockException e) {
                throw new TagNameConflictException(name, e);
            }
        });
    }

    private static List<String> normalizeTagNames(List<String> tagNames) {
        if (tagNames == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : tagNames) {
            names.add(name == null ? null : name.trim());
        }
        return new ArrayList<>(names);
    }

    /**
     * Tags existing content.
     *
     * @return true if the pairing was new, false if it already existed
     * @throws EntityNotFoundException if the content or the tag does not exist
     */
    public boolean addTagToContent(Long contentId, Long tagId) {
        requireContentAndTag(contentId, tagId);
        try {
            boolean linked = relationshipGraph.link(contentId, tagId);
            log.debug("Tag {} {} content {}", tagId, linked ? "added to" : "already on", contentId);
            return linked;
        } catch (DataIntegrityViolationException e) {
            // content or tag deleted between the check and the insert
            throw new EntityNotFoundException(EntityKind.CONTENT, EntityKind.TAG);
        } catch (DataAccessException e) {
            throw new TransactionFailureException("Adding tag " + tagId + " to content " + contentId + " failed", e);
        }
    }

    /**
     * Removes a tag from content. Removing a tag that is not attached does nothing.
     *
     * @return true if a pairing was removed
     * @throws EntityNotFoundException if the content or the tag does not exist
     */
    public boolean removeTagFromContent(Long contentId, Long tagId) {
        requireContentAndTag(contentId, tagId);
        try {
            int removed = relationshipGraph.unlink(contentId, tagId);
            log.debug("Removed {} pairing(s) of content {} and tag {}", removed, contentId, tagId);
            return removed > 0;
        } catch (DataAccessException e) {
            throw new TransactionFailureException("Removing tag " + tagId + " from content " + contentId + " failed", e);
        }
    }

    private void requireContentAndTag(Long contentId, Long tagId) {
        boolean bothExist = contentId != null && tagId != null && Boolean.TRUE.equals(readTransaction.execute(
                status -> contentRepository.existsById(contentId) && tagRepository.existsById(tagId)));
        if (!bothExist) {
            throw new EntityNotFoundException(EntityKind.CONTENT, EntityKind.TAG);
        }
    }

    // ==================== Accounts ====================

    public Account createAccount(String firstName, String lastName, String email) {
        Account account = entityValidator.validate(Account.create(firstName, lastName, email));
        Account saved = inTransaction("create account", () -> {
            if (accountRepository.existsByEmail(account.getEmail())) {
                throw duplicateEmail();
            }
            try {
                return accountRepository.saveAndFlush(account);
            } catch (DataIntegrityViolationException e) {
                throw duplicateEmail();
            }
        });
        log.info("Created account {}", saved.getId());
        hookDispatcher.afterCreate(saved);
        return saved;
    }

    /**
     * Applies the non-null fields to an existing account.
     */
    public Account updateAccount(Long id, String firstName, String lastName, String email) {
        return inTransaction("update account", () -> {
            Account account = findAccount(id);
            // checked before any mutation so no dirty state is flushed by the query
            if (email != null && accountRepository.existsByEmailAndIdNot(email, id)) {
                throw duplicateEmail();
            }
            if (firstName != null) {
                account.setFirstName(firstName);
            }
            if (lastName != null) {
                account.setLastName(lastName);
            }
            if (email != null) {
                account.setEmail(email);
            }
            entityValidator.validate(account);
            try {
                return accountRepository.saveAndFlush(account);
            } catch (DataIntegrityViolationException e) {
                throw duplicateEmail();
            }
        });
    }

    /**
     * Deletes an account that no longer owns a profile or content.
     *
     * @throws ValidationException if dependents still reference the account
     */
    public void deleteAccount(Long id) {
        inTransaction("delete account", () -> {
            Account account = findAccount(id);
            if (profileRepository.existsByAccountId(id) || contentRepository.existsByAccountId(id)) {
                throw new ValidationException("id", "account still has a profile or content");
            }
            accountRepository.delete(account);
            return null;
        });
        log.info("Deleted account {}", id);
    }

    private Account findAccount(Long id) {
        if (id == null) {
            throw new EntityNotFoundException(EntityKind.ACCOUNT);
        }
        return accountRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.ACCOUNT));
    }

    private static ValidationException duplicateEmail() {
        return new ValidationException("email", "already registered");
    }

    // ==================== Profiles ====================

    public Profile createProfile(Long accountId, String description) {
        Profile profile = entityValidator.validate(Profile.create(accountId, description));
        Profile saved = inTransaction("create profile", () -> {
            findAccount(accountId);
            if (profileRepository.existsByAccountId(accountId)) {
                throw duplicateProfile();
            }
            try {
                return profileRepository.saveAndFlush(profile);
            } catch (DataIntegrityViolationException e) {
                throw duplicateProfile();
            }
        });
        log.info("Created profile {} for account {}", saved.getId(), accountId);
        hookDispatcher.afterCreate(saved);
        return saved;
    }

    public Profile updateProfile(Long accountId, String description) {
        return inTransaction("update profile", () -> {
            Profile profile = findProfile(accountId);
            profile.setDescription(description);
            return profileRepository.saveAndFlush(entityValidator.validate(profile));
        });
    }

    public void deleteProfile(Long accountId) {
        inTransaction("delete profile", () -> {
            profileRepository.delete(findProfile(accountId));
            return null;
        });
        log.info("Deleted profile of account {}", accountId);
    }

    private Profile findProfile(Long accountId) {
        if (accountId == null) {
            throw new EntityNotFoundException(EntityKind.PROFILE);
        }
        return profileRepository.findByAccountId(accountId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.PROFILE));
    }

    private static ValidationException duplicateProfile() {
        return new ValidationException("accountId", "account already has a profile");
    }

    // ==================== Content ====================

    /**
     * Applies the non-null fields to existing content.
     *
     * @throws ValidationException if a new title is shorter than
     *                             {@link Content#MIN_UPDATED_TITLE_LENGTH} characters
     */
    public Content updateContent(Long id, String title, String body, ContentStatus status) {
        if (title != null && title.length() < Content.MIN_UPDATED_TITLE_LENGTH) {
            throw new ValidationException("title",
                    "must be at least " + Content.MIN_UPDATED_TITLE_LENGTH + " characters long");
        }
        return inTransaction("update content", () -> {
            Content content = findContent(id);
            if (title != null) {
                content.setTitle(title);
            }
            if (body != null) {
                content.setBody(body);
            }
            if (status != null) {
                content.setStatus(status);
            }
            return contentRepository.saveAndFlush(entityValidator.validate(content));
        });
    }

    /**
     * Deletes content together with its tag pairings. Tags themselves are kept.
     */
    public void deleteContent(Long id) {
        int pairings = inTransaction("delete content", () -> {
            Content content = findContent(id);
            int removed = contentTagRepository.deleteAllByContent(id);
            contentRepository.delete(content);
            return removed;
        });
        log.info("Deleted content {} and {} tag pairing(s)", id, pairings);
    }

    private Content findContent(Long id) {
        if (id == null) {
            throw new EntityNotFoundException(EntityKind.CONTENT);
        }
        return contentRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.CONTENT));
    }

    // ==================== Tags ====================

    public Tag createTag(String name) {
        Tag tag = entityValidator.validate(Tag.create(name));
        Tag saved = inTransaction("create tag", () -> {
            if (tagRepository.existsByName(tag.getName())) {
                throw duplicateTag();
            }
            try {
                return tagRepository.saveAndFlush(tag);
            } catch (DataIntegrityViolationException e) {
                throw duplicateTag();
            }
        });
        log.info("Created tag {} '{}'", saved.getId(), saved.getName());
        hookDispatcher.afterCreate(saved);
        return saved;
    }

    public Tag updateTag(Long id, String name) {
        return inTransaction("update tag", () -> {
            Tag tag = findTag(id);
            if (name != null && tagRepository.existsByNameAndIdNot(name, id)) {
                throw duplicateTag();
            }
            tag.setName(name);
            entityValidator.validate(tag);
            try {
                return tagRepository.saveAndFlush(tag);
            } catch (DataIntegrityViolationException e) {
                throw duplicateTag();
            }
        });
    }

    /**
     * Deletes a tag and removes it from all content.
     */
    public void deleteTag(Long id) {
        int pairings = inTransaction("delete tag", () -> {
            Tag tag = findTag(id);
            int removed = contentTagRepository.deleteAllByTag(id);
            tagRepository.delete(tag);
            return removed;
        });
        log.info("Deleted tag {} and {} pairing(s)", id, pairings);
    }

    private Tag findTag(Long id) {
        if (id == null) {
            throw new EntityNotFoundException(EntityKind.TAG);
        }
        return tagRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.TAG));
    }

    private static ValidationException duplicateTag() {
        return new ValidationException("name", "tag already exists");
    }

    // ==================== Transaction scope ====================

    /**
     * Runs the work in one write transaction. Any exception rolls the whole unit back;
     * domain errors pass through unchanged, storage errors are wrapped.
     */
    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return writeTransaction.execute(status -> work.get());
        } catch (PressroomException | TagNameConflictException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed and was rolled back", operation, e);
            throw new TransactionFailureException(operation + " failed and was rolled back", e);
        }
    }

    /**
     * A concurrent writer inserted the same tag name first. The current attempt is
     * rolled back and may be retried from scratch.
     */
    private static final class TagNameConflictException extends RuntimeException {

        private final String tagName;

        TagNameConflictException(String tagName, Throwable cause) {
            super("Tag name conflict: " + tagName, cause);
            this.tagName = tagName;
        }
    }
}
