package com.pressroom.core.repository;

import com.pressroom.core.domain.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Account entities.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    /**
     * Checks if an email is already registered.
     */
    boolean existsByEmail(String email);

    /**
     * Checks if an email is registered to an account other than the given one.
     */
    boolean existsByEmailAndIdNot(String email, Long id);

    List<Account> findAllByOrderByIdAsc();
}
