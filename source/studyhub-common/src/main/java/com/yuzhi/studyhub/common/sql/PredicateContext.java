package com.yuzhi.studyhub.common.sql;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Describes where study and sample membership live for one target table/alias.
 * <p>
 * Column expressions come from code, never from request input; they are still checked against a
 * plain identifier pattern so that a literal can never slip into clause text through a context.
 *
 * @param studyColumn      qualified study id column, e.g. {@code df.study_id}
 * @param sampleScope      how sample membership is expressed for this table
 * @param sampleExpression sample column for {@link SampleScope#COLUMN}, membership sub-query
 *                         template containing {@value #SAMPLES_TOKEN} for {@link SampleScope#BRIDGE}
 */
public record PredicateContext(String studyColumn, SampleScope sampleScope, String sampleExpression) {
    public static final String SAMPLES_TOKEN = "{samples}";

    private static final Pattern COLUMN_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    public enum SampleScope {
        /** Table has no sample dimension; SAMPLE_ADMIN grants scope to the whole study. */
        NONE,
        /** Table carries a nullable sample id column. */
        COLUMN,
        /** Sample membership is resolved through a bridge table. */
        BRIDGE,
    }

    public PredicateContext {
        requireColumn(studyColumn);
        Objects.requireNonNull(sampleScope, "sampleScope");
        switch (sampleScope) {
            case NONE -> sampleExpression = null;
            case COLUMN -> requireColumn(sampleExpression);
            case BRIDGE -> {
                if (sampleExpression == null || countTokens(sampleExpression) != 1) {
                    throw new IllegalArgumentException("Bridge template must reference " + SAMPLES_TOKEN + " exactly once");
                }
            }
        }
    }

    public static PredicateContext studyOnly(String studyColumn) {
        return new PredicateContext(studyColumn, SampleScope.NONE, null);
    }

    public static PredicateContext sampleColumn(String studyColumn, String sampleColumn) {
        return new PredicateContext(studyColumn, SampleScope.COLUMN, sampleColumn);
    }

    public static PredicateContext sampleBridge(String studyColumn, String membershipTemplate) {
        return new PredicateContext(studyColumn, SampleScope.BRIDGE, membershipTemplate);
    }

    public boolean scopesSamples() {
        return sampleScope != SampleScope.NONE;
    }

    /** Sample condition bound to the given array placeholder, e.g. {@code $4}. */
    String sampleCondition(String arrayPlaceholder) {
        return switch (sampleScope) {
            case NONE -> throw new IllegalStateException("Context has no sample dimension");
            case COLUMN -> "(" + sampleExpression + " IS NULL OR " + sampleExpression + "::text = ANY(" + arrayPlaceholder + "::text[]))";
            case BRIDGE -> sampleExpression.replace(SAMPLES_TOKEN, arrayPlaceholder);
        };
    }

    private static void requireColumn(String column) {
        if (column == null || !COLUMN_PATTERN.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid column expression: " + column);
        }
    }

    private static int countTokens(String template) {
        int count = 0;
        int from = 0;
        while ((from = template.indexOf(SAMPLES_TOKEN, from)) >= 0) {
            count++;
            from += SAMPLES_TOKEN.length();
        }
        return count;
    }
}
