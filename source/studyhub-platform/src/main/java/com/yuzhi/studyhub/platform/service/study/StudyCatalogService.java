package com.yuzhi.studyhub.platform.service.study;

import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.platform.repository.RowValues;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import com.yuzhi.studyhub.platform.service.security.StudyPredicateContexts;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class StudyCatalogService {

    static final String STUDIES_SQL =
        """
        SELECT s.study_id, s.terms, sm.sample_id, sm.sample_code, sm.sample_name
        FROM fw_psy_study s
        LEFT JOIN fw_psy_sample sm ON sm.study_id = s.study_id
        WHERE {scope}
        ORDER BY s.study_id, sm.sample_id
        """;

    public record SampleSummary(String sampleId, String sampleCode, String sampleName) {}

    public record StudySummary(String studyId, String terms, List<SampleSummary> samples) {}

    private final StudyDataStore store;
    private final AccessGate accessGate;

    public StudyCatalogService(StudyDataStore store, AccessGate accessGate) {
        this.store = store;
        this.accessGate = accessGate;
    }

    /**
     * Studies the caller holds a grant on, each with the samples it may see: every sample for
     * STUDY_ADMIN, the listed ones for SAMPLE_ADMIN, none for VIEWER. A study stays in the list
     * when none of its samples are visible.
     */
    public List<StudySummary> listStudies(Caller caller) {
        List<Map<String, Object>> rows = accessGate
            .scope(caller, StudyPredicateContexts.STUDY_CATALOG, 1)
            .map(predicate -> store.execute(STUDIES_SQL.replace("{scope}", predicate.clauseTemplate()), predicate.params()))
            .orElse(List.of());

        Map<String, StudySummary> studies = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            String studyId = RowValues.asString(row.get("study_id"));
            StudySummary study = studies.computeIfAbsent(studyId, id -> new StudySummary(id, RowValues.asString(row.get("terms")), new ArrayList<>()));
            String sampleId = RowValues.asString(row.get("sample_id"));
            if (sampleId != null && accessGate.authorizeSample(caller, studyId, sampleId)) {
                study
                    .samples()
                    .add(
                        new SampleSummary(
                            sampleId,
                            RowValues.asString(row.get("sample_code")),
                            RowValues.asString(row.get("sample_name"))
                        )
                    );
            }
        }
        return List.copyOf(studies.values());
    }
}
