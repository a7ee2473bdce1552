package org.caureq.fleethub.repo;

import org.caureq.fleethub.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    @Query("select u from User u where lower(u.username) = lower(:username) and u.deletedAt is null")
    Optional<User> findLive(@Param("username") String username);

    @Query("select u from User u where u.id = :id and u.deletedAt is null")
    Optional<User> findLiveById(@Param("id") Long id);

    List<User> findByDeletedAtIsNullOrderByUsernameAsc();
}
