package com.fitcycle.backend.users.repo;

import com.fitcycle.backend.users.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    Optional<User> findByTgId(Long tgId);

    @Query("select u.id from User u order by u.id asc")
    Page<Long> findAllIds(Pageable pageable);
}
