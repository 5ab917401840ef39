package com.dubbi.screentrail.graph.domain;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScreenStateRepository extends JpaRepository<ScreenStateEntity, UUID> {
    @Query("select s from ScreenStateEntity s where s.appId = :appId order by s.discoveredAt asc")
    List<ScreenStateEntity> findByAppId(@Param("appId") String appId);

    @Query("select s from ScreenStateEntity s where s.appId = :appId and s.fingerprint = :fingerprint")
    Optional<ScreenStateEntity> findByAppIdAndFingerprint(@Param("appId") String appId, @Param("fingerprint") String fingerprint);

    @Query("select s.fingerprint from ScreenStateEntity s where s.appId = :appId and s.appVersion = :appVersion")
    List<String> findFingerprintsByAppIdAndAppVersion(@Param("appId") String appId, @Param("appVersion") String appVersion);
}
