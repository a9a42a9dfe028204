package com.yuzhi.studyhub.common.security;

import java.util.Locale;

/**
 * Study access roles and their hierarchy. A higher rank covers everything a lower rank covers
 * when a minimum role is checked.
 */
public enum StudyRole {
    STUDY_ADMIN(3),
    SAMPLE_ADMIN(2),
    VIEWER(1);

    private final int rank;

    StudyRole(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(StudyRole minimum) {
        return minimum == null || rank >= minimum.rank;
    }

    /**
     * Resolve a role name as it appears in identity claims. Returns {@code null} for blank or
     * unknown names so that callers decide how strict to be.
     */
    public static StudyRole fromClaim(String value) {
        if (value == null) {
            return null;
        }
        String canonical = value.trim().toUpperCase(Locale.ROOT);
        if (canonical.isEmpty()) {
            return null;
        }
        for (StudyRole role : values()) {
            if (role.name().equals(canonical)) {
                return role;
            }
        }
        return null;
    }
}
