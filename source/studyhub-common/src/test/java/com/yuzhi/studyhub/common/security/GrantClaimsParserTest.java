package com.yuzhi.studyhub.common.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yuzhi.studyhub.common.error.InvalidGrantException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GrantClaimsParserTest {

    private final GrantClaimsParser parser = new GrantClaimsParser(new ObjectMapper(), GrantMergePolicy.INDEPENDENT);

    @Test
    void parsesGrantsInIssuedOrder() {
        Caller caller = parser.parse(
            Map.of(
                "userId", "u-7",
                "studyAccess", List.of(
                    Map.of("studyId", "A", "role", "STUDY_ADMIN"),
                    Map.of("studyId", "B", "role", "SAMPLE_ADMIN", "sampleIds", List.of("s1", 42)),
                    Map.of("studyId", "C", "role", "VIEWER", "sampleIds", List.of("ignored"))
                )
            )
        );

        assertThat(caller.id()).isEqualTo("u-7");
        assertThat(caller.grants()).extracting(StudyGrant::studyId).containsExactly("A", "B", "C");
        assertThat(caller.grants().get(1).sampleIds()).containsExactly("s1", "42");
        assertThat(caller.grants().get(2).sampleIds()).isNull();
    }

    @Test
    void acceptsJsonEncodedSampleList() {
        Caller caller = parser.parse(
            Map.of(
                "userId", 12,
                "studyAccess", List.of(Map.of("studyId", "B", "role", "SAMPLE_ADMIN", "sampleIds", "[\"s1\",\"s2\"]"))
            )
        );

        assertThat(caller.id()).isEqualTo("12");
        assertThat(caller.grants().get(0).sampleIds()).containsExactly("s1", "s2");
    }

    @Test
    void rejectsUnknownRole() {
        Map<String, Object> claims = Map.of("userId", "u", "studyAccess", List.of(Map.of("studyId", "A", "role", "OWNER")));

        assertThatThrownBy(() -> parser.parse(claims)).isInstanceOf(InvalidGrantException.class).hasMessageContaining("unknown role");
    }

    @Test
    void rejectsSampleAdminWithoutSamples() {
        Map<String, Object> claims = Map.of("userId", "u", "studyAccess", List.of(Map.of("studyId", "A", "role", "SAMPLE_ADMIN")));

        assertThatThrownBy(() -> parser.parse(claims)).isInstanceOf(InvalidGrantException.class).hasMessageContaining("sampleIds");
    }

    @Test
    void rejectsMissingClaims() {
        assertThatThrownBy(() -> parser.parse(Map.of("studyAccess", List.of()))).isInstanceOf(InvalidGrantException.class);
        assertThatThrownBy(() -> parser.parse(Map.of("userId", "u"))).isInstanceOf(InvalidGrantException.class);
        assertThatThrownBy(() -> parser.parse(Map.of("userId", "u", "studyAccess", List.of(Map.of("role", "VIEWER")))))
            .isInstanceOf(InvalidGrantException.class);
    }

    @Test
    void emptyStudyAccessYieldsCallerWithoutGrants() {
        Caller caller = parser.parse(Map.of("userId", "u", "studyAccess", List.of()));

        assertThat(caller.hasGrants()).isFalse();
    }

    @Test
    void mergePolicyCollapsesDuplicateStudies() {
        GrantClaimsParser merging = new GrantClaimsParser(new ObjectMapper(), GrantMergePolicy.MERGE_MOST_PERMISSIVE);

        Caller caller = merging.parse(
            Map.of(
                "userId", "u",
                "studyAccess", List.of(
                    Map.of("studyId", "A", "role", "SAMPLE_ADMIN", "sampleIds", List.of("s1")),
                    Map.of("studyId", "B", "role", "VIEWER"),
                    Map.of("studyId", "A", "role", "STUDY_ADMIN")
                )
            )
        );

        assertThat(caller.grants()).containsExactly(StudyGrant.studyAdmin("A"), StudyGrant.viewer("B"));
    }
}
