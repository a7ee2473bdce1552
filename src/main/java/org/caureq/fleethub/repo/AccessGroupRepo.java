package org.caureq.fleethub.repo;

import org.caureq.fleethub.domain.AccessGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AccessGroupRepo extends JpaRepository<AccessGroup, Long> {

    @Query("select g from AccessGroup g where g.id = :id and g.deletedAt is null")
    Optional<AccessGroup> findLiveById(@Param("id") Long id);

    @Query("select g from AccessGroup g where lower(g.name) = lower(:name) and g.deletedAt is null")
    Optional<AccessGroup> findLiveByName(@Param("name") String name);

    List<AccessGroup> findByDeletedAtIsNullOrderByNameAsc();
}
