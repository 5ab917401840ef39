package com.dubbi.screentrail.identity.domain;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ElementIdentityRepository extends JpaRepository<ElementIdentityEntity, String> {
    @Query("select i from ElementIdentityEntity i where i.appId = :appId order by i.id asc")
    List<ElementIdentityEntity> findByAppId(@Param("appId") String appId);
}
