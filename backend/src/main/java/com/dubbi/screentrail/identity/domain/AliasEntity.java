package com.dubbi.screentrail.identity.domain;

import com.dubbi.screentrail.identity.service.AliasSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "element_aliases",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_element_aliases_tuple",
                columnNames = {"app_id", "phrase", "identity_id", "alias_source"}
        )
)
public class AliasEntity {
    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "app_id", nullable = false)
    private String appId;

    @Column(nullable = false, length = 512)
    private String phrase;

    @Column(name = "identity_id", nullable = false, length = 32)
    private String identityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "alias_source", nullable = false, length = 16)
    private AliasSource source;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected AliasEntity() {}

    public AliasEntity(UUID id, String appId, String phrase, String identityId, AliasSource source) {
        this.id = id;
        this.appId = appId;
        this.phrase = phrase;
        this.identityId = identityId;
        this.source = source;
        this.createdAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getAppId() {
        return appId;
    }

    public String getPhrase() {
        return phrase;
    }

    public String getIdentityId() {
        return identityId;
    }

    public AliasSource getSource() {
        return source;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
