package com.dubbi.screentrail.identity.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "element_identities")
public class ElementIdentityEntity {
    @Id
    @Column(nullable = false, updatable = false, length = 32)
    private String id;

    @Column(name = "app_id", nullable = false)
    private String appId;

    @Column(name = "ancestor_path", nullable = false, columnDefinition = "text")
    private String ancestorPath;

    @Column(name = "type_tag", nullable = false)
    private String typeTag;

    @Column(name = "resource_tag")
    private String resourceTag;

    @Column(name = "element_text", columnDefinition = "text")
    private String elementText;

    @Column(name = "element_label", columnDefinition = "text")
    private String elementLabel;

    @Column(name = "parent_id", length = 32)
    private String parentId;

    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;

    protected ElementIdentityEntity() {}

    public ElementIdentityEntity(
            String id,
            String appId,
            String ancestorPath,
            String typeTag,
            String resourceTag,
            String elementText,
            String elementLabel,
            String parentId,
            Instant firstSeenAt
    ) {
        this.id = id;
        this.appId = appId;
        this.ancestorPath = ancestorPath;
        this.typeTag = typeTag;
        this.resourceTag = resourceTag;
        this.elementText = elementText;
        this.elementLabel = elementLabel;
        this.parentId = parentId;
        this.firstSeenAt = firstSeenAt;
    }

    public String getId() {
        return id;
    }

    public String getAppId() {
        return appId;
    }

    public String getAncestorPath() {
        return ancestorPath;
    }

    public String getTypeTag() {
        return typeTag;
    }

    public String getResourceTag() {
        return resourceTag;
    }

    public String getElementText() {
        return elementText;
    }

    public String getElementLabel() {
        return elementLabel;
    }

    public String getParentId() {
        return parentId;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setParentId(String parentId) {
        if (parentId == null) return;
        this.parentId = parentId;
    }
}
