package com.pressroom.api.write;

import com.pressroom.api.read.ContentView;
import com.pressroom.api.read.ReadCoordinator;
import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.ContentStatus;
import com.pressroom.core.domain.Profile;
import com.pressroom.core.domain.Tag;
import com.pressroom.core.exception.EntityKind;
import com.pressroom.core.exception.EntityNotFoundException;
import com.pressroom.core.exception.ValidationException;
import com.pressroom.core.repository.AccountRepository;
import com.pressroom.core.repository.ContentRepository;
import com.pressroom.core.repository.ContentTagRepository;
import com.pressroom.core.repository.ProfileRepository;
import com.pressroom.core.repository.TagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the Write Coordinator against the Flyway schema.
 * 
 * Not transactional on purpose: every write commits, so rollback behaviour is
 * observed exactly as a caller would see it.
 */
@SpringBootTest
@ActiveProfiles("test")
class WriteCoordinatorTest {

    @Autowired
    private WriteCoordinator writeCoordinator;

    @Autowired
    private ReadCoordinator readCoordinator;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private ProfileRepository profileRepository;

    @Autowired
    private ContentRepository contentRepository;

    @Autowired
    private TagRepository tagRepository;

    @Autowired
    private ContentTagRepository contentTagRepository;

    private Account author;

    @BeforeEach
    void setUp() {
        contentTagRepository.deleteAllInBatch();
        contentRepository.deleteAllInBatch();
        profileRepository.deleteAllInBatch();
        tagRepository.deleteAllInBatch();
        accountRepository.deleteAllInBatch();

        author = writeCoordinator.createAccount("Ada", "Lovelace", "ada@example.com");
    }

    // ==================== Accounts ====================

    @Test
    void createAccount_rejectsDuplicateEmail() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> writeCoordinator.createAccount("Other", "Person", "ada@example.com"));

        assertEquals("email", e.getField());
        assertEquals(1, accountRepository.count());
    }

    @Test
    void createAccount_rejectsMalformedEmailBeforeWriting() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> writeCoordinator.createAccount("Alan", "Turing", "not-an-email"));

        assertEquals("email", e.getField());
        assertEquals(1, accountRepository.count());
    }

    @Test
    void updateAccount_leavesNullFieldsUnchanged() {
        Account updated = writeCoordinator.updateAccount(author.getId(), "Augusta", null, null);

        assertEquals("Augusta", updated.getFirstName());
        assertEquals("Lovelace", updated.getLastName());
        assertEquals("ada@example.com", updated.getEmail());
        assertFalse(updated.getUpdatedAt().isBefore(updated.getCreatedAt()));
    }

    @Test
    void updateAccount_rejectsEmailOfAnotherAccount() {
        Account other = writeCoordinator.createAccount("Alan", "Turing", "alan@example.com");

        ValidationException e = assertThrows(ValidationException.class,
                () -> writeCoordinator.updateAccount(other.getId(), null, null, "ada@example.com"));

        assertEquals("email", e.getField());
        assertEquals("alan@example.com", accountRepository.findById(other.getId()).orElseThrow().getEmail());
    }

    @Test
    void deleteAccount_refusedWhileDependentsExist() {
        Content content = writeCoordinator.createContentWithTags(
                author.getId(), "First post", "Body", ContentStatus.ACTIVE, List.of());
        writeCoordinator.createProfile(author.getId(), "Mathematician");

        ValidationException e = assertThrows(ValidationException.class,
                () -> writeCoordinator.deleteAccount(author.getId()));
        assertEquals("id", e.getField());
        assertTrue(accountRepository.existsById(author.getId()));

        writeCoordinator.deleteContent(content.getId());
        writeCoordinator.deleteProfile(author.getId());
        writeCoordinator.deleteAccount(author.getId());

        assertFalse(accountRepository.existsById(author.getId()));
    }

    @Test
    void deleteAccount_missingAccountIsNotFound() {
        EntityNotFoundException e = assertThrows(EntityNotFoundException.class,
                () -> writeCoordinator.deleteAccount(author.getId() + 1000));

        assertEquals(Set.of(EntityKind.ACCOUNT), e.getKinds());
    }

    // ==================== Profiles ====================

    @Test
    void createProfile_atMostOnePerAccount() {
        Profile profile = writeCoordinator.createProfile(author.getId(), "First");

        assertEquals(author.getId(), profile.getAccountId());
        assertThrows(ValidationException.class, () -> writeCoordinator.createProfile(author.getId(), "Second"));
        assertEquals(1, profileRepository.count());
    }

    @Test
    void createProfile_requiresExistingAccount() {
        EntityNotFoundException e = assertThrows(EntityNotFoundException.class,
                () -> writeCoordinator.createProfile(author.getId() + 1000, "Orphan"));

        assertEquals(Set.of(EntityKind.ACCOUNT), e.getKinds());
        assertEquals(0, profileRepository.count());
    }

    @Test
    void updateProfile_acceptsNullDescription() {
        writeCoordinator.createProfile(author.getId(), "Before");

        Profile updated = writeCoordinator.updateProfile(author.getId(), null);

        assertNull(updated.getDescription());
    }

    // ==================== Composite content writes ====================

    @Test
    void createContentWithTags_attachesEachDistinctTagOnce() {
        Content content = writeCoordinator.createContentWithTags(
                author.getId(), "Hello World", "Body", null, List.of("b", "a", " b ", "a"));

        ContentView view = readCoordinator.getContentById(content.getId());
        assertEquals(ContentStatus.DRAFT, view.content().getStatus());
        assertEquals(author.getId(), view.account().getId());
        assertEquals(List.of("a", "b"), view.tags().stream().map(Tag::getName).toList());
        assertEquals(2, contentTagRepository.countByContentId(content.getId()));
    }

    @Test
    void createContentWithTags_reusesExistingTags() {
        Tag existing = writeCoordinator.createTag("java");

        Content content = writeCoordinator.createContentWithTags(
                author.getId(), "Streams", "Body", ContentStatus.ACTIVE, List.of("java", "spring"));

        assertEquals(2, tagRepository.count());
        assertEquals(1, tagRepository.countByName("java"));
        assertTrue(contentTagRepository.existsByContentIdAndTagId(content.getId(), existing.getId()));
    }

    @Test
    void createContentWithTags_missingAccountWritesNothing() {
        EntityNotFoundException e = assertThrows(EntityNotFoundException.class,
                () -> writeCoordinator.createContentWithTags(
                        author.getId() + 1000, "Nobody's post", "Body", null, List.of("lonely")));

        assertEquals(Set.of(EntityKind.ACCOUNT), e.getKinds());
        assertEquals(0, contentRepository.count());
        assertEquals(0, tagRepository.count());
    }

    @Test
    void createContentWithTags_invalidThirdTagRollsBackEverything() {
        writeCoordinator.createTag("kept");
        String overlong = "x".repeat(300);

        ValidationException e = assertThrows(ValidationException.class,
                () -> writeCoordinator.createContentWithTags(
                        author.getId(), "Doomed post", "Body", ContentStatus.ACTIVE,
                        List.of("kept", "fresh-one", overlong)));

        assertEquals("name", e.getField());
        assertEquals(0, contentRepository.count());
        assertEquals(0, contentTagRepository.count());
        assertFalse(tagRepository.existsByName("fresh-one"));
        assertTrue(tagRepository.existsByName("kept"));
        assertEquals(1, tagRepository.count());
    }

    @Test
    void createContentWithTags_invalidContentCreatesNoTags() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> writeCoordinator.createContentWithTags(
                        author.getId(), " ", "Body", null, List.of("never")));

        assertEquals("title", e.getField());
        assertEquals(0, tagRepository.count());
    }

    // ==================== Content updates and deletes ====================

    @Test
    void updateContent_shortTitleRejectedAndNothingStored() {
        Content content = writeCoordinator.createContentWithTags(
                author.getId(), "Original title", "Body", null, List.of());

        ValidationException e = assertThrows(ValidationException.class,
                () -> writeCoordinator.updateContent(content.getId(), "abc", "New body", null));

        assertEquals("title", e.getField());
        Content stored = contentRepository.findById(content.getId()).orElseThrow();
        assertEquals("Original title", stored.getTitle());
        assertEquals("Body", stored.getBody());
    }

    @Test
    void updateContent_changesOnlyGivenFields() {
        Content content = writeCoordinator.createContentWithTags(
                author.getId(), "Original title", "Body", ContentStatus.DRAFT, List.of());

        Content updated = writeCoordinator.updateContent(content.getId(), null, null, ContentStatus.ARCHIVED);

        assertEquals(ContentStatus.ARCHIVED, updated.getStatus());
        assertEquals("Original title", updated.getTitle());
        assertEquals(ContentStatus.ARCHIVED,
                contentRepository.findById(content.getId()).orElseThrow().getStatus());
    }

    @Test
    void updateContent_missingContentIsNotFound() {
        EntityNotFoundException e = assertThrows(EntityNotFoundException.class,
                () -> writeCoordinator.updateContent(999_999L, "Valid title", null, null));

        assertEquals(Set.of(EntityKind.CONTENT), e.getKinds());
    }

    @Test
    void deleteContent_removesPairingsButKeepsTags() {
        Content content = writeCoordinator.createContentWithTags(
                author.getId(), "Tagged post", "Body", null, List.of("one", "two"));

        writeCoordinator.deleteContent(content.getId());

        assertFalse(contentRepository.existsById(content.getId()));
        assertEquals(0, contentTagRepository.count());
        assertEquals(2, tagRepository.count());
    }

    // ==================== Tags ====================

    @Test
    void createTag_rejectsDuplicateName() {
        writeCoordinator.createTag("news");

        ValidationException e = assertThrows(ValidationException.class, () -> writeCoordinator.createTag("news"));

        assertEquals("name", e.getField());
        assertEquals(1, tagRepository.countByName("news"));
    }

    @Test
    void updateTag_rejectsNameOfAnotherTag() {
        writeCoordinator.createTag("news");
        Tag other = writeCoordinator.createTag("sports");

        assertThrows(ValidationException.class, () -> writeCoordinator.updateTag(other.getId(), "news"));
        assertEquals("sports", tagRepository.findById(other.getId()).orElseThrow().getName());
    }

    @Test
    void deleteTag_detachesItFromContent() {
        Content content = writeCoordinator.createContentWithTags(
                author.getId(), "Tagged post", "Body", null, List.of("gone", "stays"));
        Tag gone = tagRepository.findByName("gone").orElseThrow();

        writeCoordinator.deleteTag(gone.getId());

        assertFalse(tagRepository.existsById(gone.getId()));
        assertEquals(List.of("stays"),
                readCoordinator.getContentById(content.getId()).tags().stream().map(Tag::getName).toList());
    }
}
