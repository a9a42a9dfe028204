package com.yuzhi.studyhub.platform.service.security;

import com.yuzhi.studyhub.common.sql.PredicateContext;

/**
 * Where study and sample membership live for each table alias the platform queries.
 */
public final class StudyPredicateContexts {

    /** {@code fw_psy_user u}; sample membership through {@code fw_psy_sample_user}. */
    public static final PredicateContext PARTICIPANT = PredicateContext.sampleBridge(
        "u.study_id",
        "EXISTS (SELECT 1 FROM fw_psy_sample_user su WHERE su.user_id = u.user_id AND su.sample_id::text = ANY(" +
        PredicateContext.SAMPLES_TOKEN +
        "::text[]))"
    );

    /** {@code fw_psy_dataset_file df}; files without a sample are study-wide. */
    public static final PredicateContext DATASET_FILE = PredicateContext.sampleColumn("df.study_id", "df.sample_id");

    /**
     * {@code fw_psy_study s LEFT JOIN fw_psy_sample sm}. Study rows only; joined samples are
     * filtered per grant after the query so a study never disappears with its samples.
     */
    public static final PredicateContext STUDY_CATALOG = PredicateContext.studyOnly("s.study_id");

    private StudyPredicateContexts() {}
}
