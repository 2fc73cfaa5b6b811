package com.orgscope.backend.modules.hierarchy.domain;

public enum IntegritySeverity {
    ERROR,
    WARNING
}
