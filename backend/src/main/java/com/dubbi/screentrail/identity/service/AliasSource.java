package com.dubbi.screentrail.identity.service;

public enum AliasSource {
    AUTO,
    MANUAL
}
