package com.dubbi.screentrail.identity.service;

import com.dubbi.screentrail.common.util.Hashing;
import java.time.Instant;

public record ElementIdentity(
        String id,
        String appId,
        ElementSignature signature,
        String parentId,
        Instant firstSeenAt
) {
    private static final String SEPARATOR = "\u001f";

    /** id = SHA-256(appId + 서명)의 앞 32자 */
    public static String idFor(String appId, ElementSignature signature) {
        String input = String.join(SEPARATOR,
                appId == null ? "" : appId,
                signature.ancestorPath(),
                signature.typeTag(),
                signature.resourceTag(),
                signature.text(),
                signature.label());
        return Hashing.sha256Hex(input).substring(0, 32);
    }

    public ElementIdentity withParentId(String newParentId) {
        return new ElementIdentity(id, appId, signature, newParentId, firstSeenAt);
    }

    public String displayName() {
        if (!signature.text().isBlank()) return signature.text();
        if (!signature.label().isBlank()) return signature.label();
        if (!signature.resourceTag().isBlank()) return signature.resourceTag();
        return signature.typeTag();
    }
}
