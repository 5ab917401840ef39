package com.dubbi.screentrail.graph.domain;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NavigationEdgeRepository extends JpaRepository<NavigationEdgeEntity, UUID> {
    @Query("select e from NavigationEdgeEntity e where e.appId = :appId order by e.discoveredAt asc")
    List<NavigationEdgeEntity> findByAppId(@Param("appId") String appId);

    @Query("""
            select case when count(e) > 0 then true else false end from NavigationEdgeEntity e
            where e.appId = :appId and e.fromFingerprint = :from
              and e.triggerElementId = :trigger and e.toFingerprint = :to
            """)
    boolean existsTransition(
            @Param("appId") String appId,
            @Param("from") String fromFingerprint,
            @Param("trigger") String triggerElementId,
            @Param("to") String toFingerprint
    );
}
