package com.yuzhi.studyhub.platform.service.study;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.yuzhi.studyhub.common.error.StudyErrorCodes;
import com.yuzhi.studyhub.common.error.StudyForbiddenException;
import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyGrant;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StudyRecordServiceTest {

    @Mock
    private StudyDataStore store;

    private StudyRecordService service;

    private final Caller sampleAdmin = new Caller("u-1", List.of(StudyGrant.sampleAdmin("A", List.of("s1", "s2"))));

    @BeforeEach
    void setUp() {
        service = new StudyRecordService(store, new AccessGate());
    }

    @Test
    void usersAreFilteredThroughSampleMembership() {
        when(store.execute(anyString(), anyList())).thenReturn(List.of(Map.of("user_id", 1)));

        assertThat(service.listUsers(sampleAdmin)).hasSize(1);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(store).execute(sql.capture(), eq(List.of("A", List.of("s1", "s2"))));
        assertThat(sql.getValue())
            .contains("FROM fw_psy_user u")
            .contains("u.study_id = $1")
            .contains("fw_psy_sample_user")
            .contains("ANY($2::text[])");
    }

    @Test
    void viewerCannotReadParticipantsOrLogs() {
        Caller viewer = new Caller("u-2", List.of(StudyGrant.viewer("A")));

        assertThatThrownBy(() -> service.listUsers(viewer))
            .isInstanceOf(StudyForbiddenException.class)
            .extracting("code")
            .isEqualTo(StudyErrorCodes.PERMISSION_DENIED);
        assertThatThrownBy(() -> service.listTaskLogs(viewer)).isInstanceOf(StudyForbiddenException.class);
        assertThatThrownBy(() -> service.listUserTasks(viewer, "5")).isInstanceOf(StudyForbiddenException.class);
        verifyNoInteractions(store);
    }

    @Test
    void taskLogsJoinThroughUserTasks() {
        when(store.execute(anyString(), anyList())).thenReturn(List.of());

        assertThat(service.listTaskLogs(new Caller("u-3", List.of(StudyGrant.studyAdmin("A"))))).isEmpty();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(store).execute(sql.capture(), eq(List.of("A")));
        assertThat(sql.getValue()).contains("fw_psy_user_task_log l").contains("((u.study_id = $1))");
    }

    @Test
    void userTasksBindUserIdFirst() {
        when(store.execute(anyString(), anyList())).thenReturn(List.of(Map.of("user_task_id", 3)));

        assertThat(service.listUserTasks(sampleAdmin, " 42 ")).hasSize(1);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(store).execute(sql.capture(), eq(List.of("42", "A", List.of("s1", "s2"))));
        assertThat(sql.getValue()).contains("ut.user_id::text = $1").contains("u.study_id = $2").contains("ANY($3::text[])");
    }

    @Test
    void blankUserIdIsRejected() {
        assertThatThrownBy(() -> service.listUserTasks(sampleAdmin, "")).isInstanceOf(StudyValidationException.class);
        verifyNoInteractions(store);
    }
}
