package com.orgscope.backend.modules.access.domain;

public enum AccessLevel {
    DIRECT,
    INHERITED,
    SELF
}
