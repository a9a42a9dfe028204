package com.yuzhi.studyhub.common.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One (study, role, optional sample scope) authorization record held by a caller.
 * <p>
 * {@code sampleIds} is kept only for {@link StudyRole#SAMPLE_ADMIN}; it is dropped for every
 * other role, and normalized to an empty set when a SAMPLE_ADMIN grant lists no samples.
 */
public record StudyGrant(String studyId, StudyRole role, Set<String> sampleIds) {
    public StudyGrant {
        Objects.requireNonNull(studyId, "studyId");
        Objects.requireNonNull(role, "role");
        if (role == StudyRole.SAMPLE_ADMIN) {
            sampleIds = sampleIds == null ? Set.of() : copyOrdered(sampleIds);
        } else {
            sampleIds = null;
        }
    }

    public static StudyGrant studyAdmin(String studyId) {
        return new StudyGrant(studyId, StudyRole.STUDY_ADMIN, null);
    }

    public static StudyGrant viewer(String studyId) {
        return new StudyGrant(studyId, StudyRole.VIEWER, null);
    }

    public static StudyGrant sampleAdmin(String studyId, Collection<String> sampleIds) {
        return new StudyGrant(studyId, StudyRole.SAMPLE_ADMIN, sampleIds == null ? null : new LinkedHashSet<>(sampleIds));
    }

    public boolean isSampleScoped() {
        return role == StudyRole.SAMPLE_ADMIN;
    }

    public boolean coversSample(String sampleId) {
        return switch (role) {
            case STUDY_ADMIN -> true;
            case SAMPLE_ADMIN -> sampleId != null && sampleIds.contains(sampleId);
            case VIEWER -> false;
        };
    }

    private static Set<String> copyOrdered(Collection<String> values) {
        Set<String> copy = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null) {
                copy.add(value);
            }
        }
        return Collections.unmodifiableSet(copy);
    }
}
