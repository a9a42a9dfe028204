package com.yuzhi.studyhub.platform.service.study;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyGrant;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import com.yuzhi.studyhub.platform.service.study.StudyCatalogService.SampleSummary;
import com.yuzhi.studyhub.platform.service.study.StudyCatalogService.StudySummary;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StudyCatalogServiceTest {

    @Mock
    private StudyDataStore store;

    @Test
    void rowsAreGroupedIntoStudiesWithTheirSamples() {
        StudyCatalogService service = new StudyCatalogService(store, new AccessGate());
        when(store.execute(anyString(), anyList()))
            .thenReturn(
                List.of(
                    row("A", "terms-a", "s1", "S1", "Sample one"),
                    row("A", "terms-a", "s2", "S2", "Sample two"),
                    row("B", null, null, null, null)
                )
            );
        Caller caller = new Caller("u-1", List.of(StudyGrant.studyAdmin("A"), StudyGrant.viewer("B")));

        List<StudySummary> studies = service.listStudies(caller);

        assertThat(studies)
            .containsExactly(
                new StudySummary("A", "terms-a", List.of(new SampleSummary("s1", "S1", "Sample one"), new SampleSummary("s2", "S2", "Sample two"))),
                new StudySummary("B", null, List.of())
            );
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(store).execute(sql.capture(), anyList());
        assertThat(sql.getValue()).contains("(s.study_id = $1) OR (s.study_id = $2)");
    }

    @Test
    void sampleAdminKeepsStudyEvenWhenNoListedSampleMatches() {
        StudyCatalogService service = new StudyCatalogService(store, new AccessGate());
        when(store.execute(anyString(), anyList()))
            .thenReturn(List.of(row("A", "terms-a", "s1", "S1", "Sample one"), row("A", "terms-a", "s2", "S2", "Sample two")));

        List<StudySummary> unmatched = service.listStudies(new Caller("u-1", List.of(StudyGrant.sampleAdmin("A", List.of("s9")))));
        List<StudySummary> emptyList = service.listStudies(new Caller("u-2", List.of(StudyGrant.sampleAdmin("A", List.of()))));

        assertThat(unmatched).containsExactly(new StudySummary("A", "terms-a", List.of()));
        assertThat(emptyList).containsExactly(new StudySummary("A", "terms-a", List.of()));
    }

    @Test
    void sampleAdminSeesOnlyListedSamplesAndQueryIsStudyOnly() {
        StudyCatalogService service = new StudyCatalogService(store, new AccessGate());
        when(store.execute(anyString(), anyList()))
            .thenReturn(List.of(row("A", "terms-a", "s1", "S1", "Sample one"), row("A", "terms-a", "s2", "S2", "Sample two")));

        List<StudySummary> studies = service.listStudies(new Caller("u-1", List.of(StudyGrant.sampleAdmin("A", List.of("s2")))));

        assertThat(studies).containsExactly(new StudySummary("A", "terms-a", List.of(new SampleSummary("s2", "S2", "Sample two"))));
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(store).execute(sql.capture(), eq(List.of("A")));
        assertThat(sql.getValue()).contains("WHERE ((s.study_id = $1))").doesNotContain("ANY(");
    }

    @Test
    void viewerSeesStudyWithoutSamples() {
        StudyCatalogService service = new StudyCatalogService(store, new AccessGate());
        when(store.execute(anyString(), anyList()))
            .thenReturn(List.of(row("B", "terms-b", "s1", "S1", "Sample one"), row("B", "terms-b", "s2", "S2", "Sample two")));

        List<StudySummary> studies = service.listStudies(new Caller("u-1", List.of(StudyGrant.viewer("B"))));

        assertThat(studies).containsExactly(new StudySummary("B", "terms-b", List.of()));
    }

    @Test
    void callerWithoutGrantsSeesNoStudies() {
        StudyCatalogService service = new StudyCatalogService(store, new AccessGate());

        assertThat(service.listStudies(new Caller("u-1", List.of()))).isEmpty();
        verifyNoInteractions(store);
    }

    private static Map<String, Object> row(String studyId, String terms, String sampleId, String code, String name) {
        Map<String, Object> row = new HashMap<>();
        row.put("study_id", studyId);
        row.put("terms", terms);
        row.put("sample_id", sampleId);
        row.put("sample_code", code);
        row.put("sample_name", name);
        return row;
    }
}
