package com.yuzhi.studyhub.common.security;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * How to treat several grants for the same study inside one caller's grant list.
 */
public enum GrantMergePolicy {
    /** Keep every grant; each one becomes its own OR clause. */
    INDEPENDENT,
    /**
     * Collapse grants per study into one: the highest-ranked role wins, and SAMPLE_ADMIN sample
     * lists are unioned when no higher role is present. The first occurrence fixes the position.
     */
    MERGE_MOST_PERMISSIVE;

    public List<StudyGrant> apply(List<StudyGrant> grants) {
        if (grants == null || grants.isEmpty()) {
            return List.of();
        }
        if (this == INDEPENDENT) {
            return List.copyOf(grants);
        }
        Map<String, StudyRole> roles = new LinkedHashMap<>();
        Map<String, Set<String>> samples = new LinkedHashMap<>();
        for (StudyGrant grant : grants) {
            StudyRole current = roles.get(grant.studyId());
            if (current == null || grant.role().rank() > current.rank()) {
                roles.put(grant.studyId(), grant.role());
            }
            if (grant.isSampleScoped()) {
                samples.computeIfAbsent(grant.studyId(), key -> new LinkedHashSet<>()).addAll(grant.sampleIds());
            }
        }
        List<StudyGrant> merged = new ArrayList<>(roles.size());
        roles.forEach((studyId, role) -> merged.add(new StudyGrant(studyId, role, samples.get(studyId))));
        return List.copyOf(merged);
    }
}
