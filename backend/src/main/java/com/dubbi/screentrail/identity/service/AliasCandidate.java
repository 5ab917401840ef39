package com.dubbi.screentrail.identity.service;

public record AliasCandidate(
        String identityId,
        String matchedPhrase,
        double score,
        boolean exact,
        AliasSource source
) {}
