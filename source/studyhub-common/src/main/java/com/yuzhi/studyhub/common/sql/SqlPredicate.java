package com.yuzhi.studyhub.common.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled study-scope filter: one clause per grant plus the values its placeholders bind to.
 * <p>
 * Placeholders are 1-based and positional: {@code $N} binds {@code params().get(N - firstParamIndex)}
 * of this predicate, i.e. the overall statement parameter {@code N}. Study id parameters come first,
 * in grant order, followed by one sample-array parameter per sample-scoped grant.
 */
public final class SqlPredicate {

    private final List<String> clauses;
    private final List<Object> studyParams;
    private final List<Object> sampleParams;
    private final int firstParamIndex;

    SqlPredicate(List<String> clauses, List<Object> studyParams, List<Object> sampleParams, int firstParamIndex) {
        this.clauses = List.copyOf(clauses);
        this.studyParams = Collections.unmodifiableList(new ArrayList<>(studyParams));
        this.sampleParams = Collections.unmodifiableList(new ArrayList<>(sampleParams));
        this.firstParamIndex = firstParamIndex;
    }

    public List<String> clauses() {
        return clauses;
    }

    /** All clauses OR-ed together and wrapped, ready to be AND-ed into a WHERE clause. */
    public String clauseTemplate() {
        return "(" + String.join(" OR ", clauses) + ")";
    }

    public List<Object> studyParams() {
        return studyParams;
    }

    public List<Object> sampleParams() {
        return sampleParams;
    }

    /** Study params followed by sample-array params; this order is part of the contract. */
    public List<Object> params() {
        List<Object> all = new ArrayList<>(studyParams.size() + sampleParams.size());
        all.addAll(studyParams);
        all.addAll(sampleParams);
        return Collections.unmodifiableList(all);
    }

    /** Index of the first placeholder free for whatever the caller appends after this predicate. */
    public int nextParamIndex() {
        return firstParamIndex + studyParams.size() + sampleParams.size();
    }

    @Override
    public String toString() {
        return "SqlPredicate{" + clauseTemplate() + ", studyParams=" + studyParams.size() + ", sampleParams=" + sampleParams.size() + "}";
    }
}
