package org.caureq.fleethub.repo;

import org.caureq.fleethub.domain.UserAgentPermission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface UserAgentPermissionRepo extends JpaRepository<UserAgentPermission, Long> {

    @Query("select p from UserAgentPermission p where p.user.id = :userId and p.agentId = :agentId and p.deletedAt is null")
    Optional<UserAgentPermission> findLive(@Param("userId") Long userId, @Param("agentId") String agentId);

    @Query("select p from UserAgentPermission p where p.user.id = :userId and p.deletedAt is null")
    List<UserAgentPermission> findLiveByUser(@Param("userId") Long userId);
}
