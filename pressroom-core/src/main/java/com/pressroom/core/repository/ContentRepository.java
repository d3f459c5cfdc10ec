package com.pressroom.core.repository;

import com.pressroom.core.domain.Content;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for Content entities. Scoped, paginated reads go through
 * {@link JpaSpecificationExecutor} with a {@code ContentScope} specification.
 */
@Repository
public interface ContentRepository extends JpaRepository<Content, Long>, JpaSpecificationExecutor<Content> {

    List<Content> findByAccountIdIn(Collection<Long> accountIds);

    boolean existsByAccountId(Long accountId);
}
