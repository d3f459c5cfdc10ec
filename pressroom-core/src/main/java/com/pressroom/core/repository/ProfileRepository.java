package com.pressroom.core.repository;

import com.pressroom.core.domain.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Profile entities, keyed from the outside by account id.
 */
@Repository
public interface ProfileRepository extends JpaRepository<Profile, Long> {

    Optional<Profile> findByAccountId(Long accountId);

    List<Profile> findByAccountIdIn(Collection<Long> accountIds);

    boolean existsByAccountId(Long accountId);
}
