package com.orgscope.backend.modules.grant.domain;

/**
 * Roles ordered by privilege; a higher rank implies every capability of the lower ones.
 */
public enum GrantRole {
    READ(1),
    MANAGER(2),
    ADMIN(3);

    private final int rank;

    GrantRole(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean atLeast(GrantRole other) {
        return other == null || rank >= other.rank;
    }

    public static GrantRole max(GrantRole a, GrantRole b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.rank >= b.rank ? a : b;
    }
}
