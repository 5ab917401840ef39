package com.dubbi.screentrail.identity.domain;

import com.dubbi.screentrail.identity.service.AliasSource;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AliasRepository extends JpaRepository<AliasEntity, UUID> {
    @Query("select a from AliasEntity a where a.appId = :appId order by a.createdAt asc")
    List<AliasEntity> findByAppId(@Param("appId") String appId);

    @Query("""
            select case when count(a) > 0 then true else false end from AliasEntity a
            where a.appId = :appId and a.phrase = :phrase
              and a.identityId = :identityId and a.source = :source
            """)
    boolean existsTuple(
            @Param("appId") String appId,
            @Param("phrase") String phrase,
            @Param("identityId") String identityId,
            @Param("source") AliasSource source
    );
}
