package com.orgscope.backend.modules.member.infrastructure.persistence;

public enum AccessibleMemberSortField {
    NAME("m.full_name"),
    EMAIL("lower(m.email)"),
    PATH("n.path"),
    CREATED_AT("m.created_at");

    private final String column;

    AccessibleMemberSortField(String column) {
        this.column = column;
    }

    String column() {
        return column;
    }
}
