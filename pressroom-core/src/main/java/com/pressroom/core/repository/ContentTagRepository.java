package com.pressroom.core.repository;

import com.pressroom.core.domain.ContentTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Repository for content/tag join rows.
 */
@Repository
public interface ContentTagRepository extends JpaRepository<ContentTag, Long> {

    boolean existsByContentIdAndTagId(Long contentId, Long tagId);

    List<ContentTag> findByContentIdIn(Collection<Long> contentIds);

    List<ContentTag> findByTagIdIn(Collection<Long> tagIds);

    long countByContentId(Long contentId);

    long countByTagId(Long tagId);

    /**
     * Removes every join row for one pairing.
     *
     * @return number of rows removed, zero when the pair was not linked
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM ContentTag ct WHERE ct.contentId = :contentId AND ct.tagId = :tagId")
    int deletePairing(@Param("contentId") Long contentId, @Param("tagId") Long tagId);

    @Transactional
    @Modifying
    @Query("DELETE FROM ContentTag ct WHERE ct.contentId = :contentId")
    int deleteAllByContent(@Param("contentId") Long contentId);

    @Transactional
    @Modifying
    @Query("DELETE FROM ContentTag ct WHERE ct.tagId = :tagId")
    int deleteAllByTag(@Param("tagId") Long tagId);
}
