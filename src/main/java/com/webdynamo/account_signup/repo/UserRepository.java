package com.webdynamo.account_signup.repo;

import com.webdynamo.account_signup.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by exact (already normalized) username
     * Used for the duplicate check before registration
     *
     * @param username Lowercased, trimmed username
     * @return Optional containing user if found, empty otherwise
     */
    Optional<User> findByUsername(String username);
}
