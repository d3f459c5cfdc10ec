package com.pressroom.api.write;

import com.pressroom.api.hook.LifecycleHookDispatcher;
import com.pressroom.api.relation.RelationshipGraph;
import com.pressroom.core.domain.Account;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.ContentStatus;
import com.pressroom.core.domain.Tag;
import com.pressroom.core.exception.TransactionFailureException;
import com.pressroom.core.repository.AccountRepository;
import com.pressroom.core.repository.ContentRepository;
import com.pressroom.core.repository.ContentTagRepository;
import com.pressroom.core.repository.ProfileRepository;
import com.pressroom.core.repository.TagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Storage failures in the middle of a composite write: the whole unit rolls back,
 * the caller sees a {@link TransactionFailureException} and no after-create hook runs.
 */
@SpringBootTest
@ActiveProfiles("test")
class StorageFailureRollbackTest {

    @Autowired
    private WriteCoordinator writeCoordinator;

    @MockitoSpyBean
    private RelationshipGraph relationshipGraph;

    @MockitoSpyBean
    private TagRepository tagRepository;

    @MockitoSpyBean
    private LifecycleHookDispatcher hookDispatcher;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private ProfileRepository profileRepository;

    @Autowired
    private ContentRepository contentRepository;

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

        author = writeCoordinator.createAccount("Grace", "Hopper", "grace@example.com");
    }

    // ==================== Join row failures ====================

    /**
     * The third join insert fails at the storage layer after two tags and two join
     * rows were already written in the same transaction.
     */
    @Test
    void createContentWithTags_storageFailureOnThirdLinkRollsBackEverything() {
        AtomicInteger links = new AtomicInteger();
        doAnswer(invocation -> {
            if (links.incrementAndGet() == 3) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            return invocation.callRealMethod();
        }).when(relationshipGraph).link(anyLong(), anyLong());

        TransactionFailureException e = assertThrows(TransactionFailureException.class,
                () -> writeCoordinator.createContentWithTags(
                        author.getId(), "Lost post", "Body", ContentStatus.ACTIVE,
                        List.of("first", "second", "third")));

        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
        assertEquals(3, links.get());
        assertEquals(0, contentRepository.count());
        assertEquals(0, tagRepository.count());
        assertEquals(0, contentTagRepository.count());
        verify(hookDispatcher, never()).afterCreate(any(Content.class));
    }

    // ==================== Tag insert failures ====================

    /**
     * A timeout is not a tag-name race, so it fails the write on the first attempt.
     */
    @Test
    void createContentWithTags_tagInsertTimeoutIsNotRetried() {
        doThrow(new QueryTimeoutException("statement timed out"))
                .when(tagRepository).saveAndFlush(any(Tag.class));

        TransactionFailureException e = assertThrows(TransactionFailureException.class,
                () -> writeCoordinator.createContentWithTags(
                        author.getId(), "Slow post", "Body", null, List.of("slow")));

        assertInstanceOf(QueryTimeoutException.class, e.getCause());
        verify(tagRepository, times(1)).saveAndFlush(any(Tag.class));
        assertEquals(0, contentRepository.count());
        assertEquals(0, tagRepository.count());
        verify(hookDispatcher, never()).afterCreate(any(Content.class));
    }

    /**
     * Lock contention on the tag insert is treated as a race and retried until the
     * configured attempts run out.
     */
    @Test
    void createContentWithTags_tagLockContentionIsRetried() {
        doThrow(new CannotAcquireLockException("lock wait"))
                .when(tagRepository).saveAndFlush(any(Tag.class));

        assertThrows(TransactionFailureException.class,
                () -> writeCoordinator.createContentWithTags(
                        author.getId(), "Contended post", "Body", null, List.of("busy")));

        verify(tagRepository, times(5)).saveAndFlush(any(Tag.class));
        assertEquals(0, contentRepository.count());
        assertEquals(0, tagRepository.count());
        verify(hookDispatcher, never()).afterCreate(any(Content.class));
    }
}
