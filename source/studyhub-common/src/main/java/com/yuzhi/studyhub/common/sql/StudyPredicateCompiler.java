package com.yuzhi.studyhub.common.sql;

import com.yuzhi.studyhub.common.error.EmptyGrantSetException;
import com.yuzhi.studyhub.common.security.StudyGrant;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a caller's grants into a parameterized study/sample predicate.
 * <p>
 * Placeholders are allocated in two passes. The first pass gives grant {@code i} the study
 * placeholder {@code firstParamIndex + i}. The second pass, which starts after the last study
 * placeholder, gives each sample-scoped grant its sample-array placeholder in grant order.
 * For grants {@code [A:STUDY_ADMIN, B:SAMPLE_ADMIN, C:SAMPLE_ADMIN]} starting at 1 this yields
 * {@code $1,$2,$3} for the studies and {@code $4,$5} for B's and C's samples.
 */
public final class StudyPredicateCompiler {

    private StudyPredicateCompiler() {}

    public static SqlPredicate compile(List<StudyGrant> grants, PredicateContext context, int firstParamIndex) {
        if (grants == null || grants.isEmpty()) {
            throw new EmptyGrantSetException();
        }
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        if (firstParamIndex < 1) {
            throw new IllegalArgumentException("Placeholder indexes are 1-based, got " + firstParamIndex);
        }

        List<Object> studyParams = new ArrayList<>(grants.size());
        for (StudyGrant grant : grants) {
            studyParams.add(grant.studyId());
        }

        int nextSampleIndex = firstParamIndex + grants.size();
        List<Object> sampleParams = new ArrayList<>();
        List<String> clauses = new ArrayList<>(grants.size());
        for (int i = 0; i < grants.size(); i++) {
            StudyGrant grant = grants.get(i);
            String studyClause = context.studyColumn() + " = $" + (firstParamIndex + i);
            if (grant.isSampleScoped() && context.scopesSamples()) {
                String samplePlaceholder = "$" + nextSampleIndex++;
                sampleParams.add(List.copyOf(grant.sampleIds()));
                clauses.add("(" + studyClause + " AND " + context.sampleCondition(samplePlaceholder) + ")");
            } else {
                clauses.add("(" + studyClause + ")");
            }
        }
        return new SqlPredicate(clauses, studyParams, sampleParams, firstParamIndex);
    }
}
