package com.dubbi.screentrail.identity.service;

/**
 * 정규화된 문구 -> 요소 정체성. 네 필드가 모두 같으면 같은 별칭이다.
 */
public record Alias(String phrase, String identityId, String appId, AliasSource source) {}
