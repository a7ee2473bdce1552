package org.caureq.fleethub.repo;

import org.caureq.fleethub.domain.GroupMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface GroupMembershipRepo extends JpaRepository<GroupMembership, Long> {

    @Query("select m from GroupMembership m where m.group.id = :groupId and m.user.id = :userId and m.deletedAt is null")
    Optional<GroupMembership> findLive(@Param("groupId") Long groupId, @Param("userId") Long userId);

    @Query("select m from GroupMembership m join fetch m.user where m.group.id = :groupId and m.deletedAt is null")
    List<GroupMembership> findLiveByGroup(@Param("groupId") Long groupId);

    @Query("select m from GroupMembership m where m.user.id = :userId and m.deletedAt is null")
    List<GroupMembership> findLiveByUser(@Param("userId") Long userId);
}
