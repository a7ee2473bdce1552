package org.caureq.fleethub.repo;

import org.caureq.fleethub.domain.AgentGroupBinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AgentGroupBindingRepo extends JpaRepository<AgentGroupBinding, Long> {

    @Query("select b from AgentGroupBinding b where b.group.id = :groupId and b.agentId = :agentId and b.deletedAt is null")
    Optional<AgentGroupBinding> findLive(@Param("groupId") Long groupId, @Param("agentId") String agentId);

    @Query("select b from AgentGroupBinding b where b.group.id = :groupId and b.deletedAt is null")
    List<AgentGroupBinding> findLiveByGroup(@Param("groupId") Long groupId);

    /** Highest ceiling among the live groups that contain the user and are bound to the agent. */
    @Query("""
            select max(b.level) from AgentGroupBinding b, GroupMembership m
            where m.group = b.group
              and m.user.id = :userId and b.agentId = :agentId
              and b.deletedAt is null and m.deletedAt is null and b.group.deletedAt is null
            """)
    Integer maxCeiling(@Param("userId") Long userId, @Param("agentId") String agentId);

    /** Per-agent ceilings reachable by the user: rows of [agentId, maxLevel]. */
    @Query("""
            select b.agentId, max(b.level) from AgentGroupBinding b, GroupMembership m
            where m.group = b.group and m.user.id = :userId
              and b.deletedAt is null and m.deletedAt is null and b.group.deletedAt is null
            group by b.agentId
            """)
    List<Object[]> ceilingsForUser(@Param("userId") Long userId);
}
