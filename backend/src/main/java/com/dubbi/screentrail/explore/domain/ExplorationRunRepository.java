package com.dubbi.screentrail.explore.domain;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ExplorationRunRepository extends JpaRepository<ExplorationRunEntity, UUID> {
    @Query("select r from ExplorationRunEntity r where r.appId = :appId order by r.createdAt desc")
    List<ExplorationRunEntity> findByAppId(@Param("appId") String appId);

    @Query("select r from ExplorationRunEntity r order by r.createdAt desc")
    List<ExplorationRunEntity> findAllNewestFirst();
}
