package com.yuzhi.studyhub.common.security;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The verified identity behind a single request. Built once from token claims and never
 * mutated or persisted.
 */
public record Caller(String id, List<StudyGrant> grants) {
    public Caller {
        Objects.requireNonNull(id, "id");
        grants = grants == null ? List.of() : List.copyOf(grants);
    }

    public boolean hasGrants() {
        return !grants.isEmpty();
    }

    /** Grants for one study, in the order they were issued. */
    public List<StudyGrant> grantsFor(String studyId) {
        return grants.stream().filter(grant -> grant.studyId().equals(studyId)).collect(Collectors.toList());
    }

    /** Distinct study ids reachable with at least {@code minimum}, in first-seen order. */
    public Set<String> studyIds(StudyRole minimum) {
        Set<String> ids = new LinkedHashSet<>();
        for (StudyGrant grant : grants) {
            if (grant.role().isAtLeast(minimum)) {
                ids.add(grant.studyId());
            }
        }
        return ids;
    }

    /** Same caller restricted to the grants of one study. */
    public Caller scopedTo(String studyId) {
        return new Caller(id, grantsFor(studyId));
    }
}
