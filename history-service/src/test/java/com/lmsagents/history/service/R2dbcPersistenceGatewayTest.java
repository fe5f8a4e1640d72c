package com.lmsagents.history.service;

import com.lmsagents.common.model.AgentRole;
import com.lmsagents.common.model.AlertRecord;
import com.lmsagents.common.model.DecisionLogEntry;
import com.lmsagents.common.model.GeneratedBy;
import com.lmsagents.common.model.RecommendationRecord;
import com.lmsagents.common.model.Severity;
import com.lmsagents.common.model.Student;
import com.lmsagents.history.model.AdaptationLog;
import com.lmsagents.history.model.AgentReport;
import com.lmsagents.history.model.OrchestratorLog;
import com.lmsagents.history.model.UserAccount;
import com.lmsagents.history.repository.AdaptationLogRepository;
import com.lmsagents.history.repository.AgentReportRepository;
import com.lmsagents.history.repository.CourseTopicRepository;
import com.lmsagents.history.repository.OrchestratorLogRepository;
import com.lmsagents.history.repository.StudentAnswerRepository;
import com.lmsagents.history.repository.UserAccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class R2dbcPersistenceGatewayTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");
    private static final LocalDateTime T0_UTC = LocalDateTime.of(2026, 3, 2, 9, 0);

    @Mock private UserAccountRepository userRepository;
    @Mock private CourseTopicRepository topicRepository;
    @Mock private StudentAnswerRepository answerRepository;
    @Mock private AgentReportRepository reportRepository;
    @Mock private AdaptationLogRepository adaptationRepository;
    @Mock private OrchestratorLogRepository orchestratorLogRepository;

    private R2dbcPersistenceGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new R2dbcPersistenceGateway(userRepository, topicRepository, answerRepository,
                                              reportRepository, adaptationRepository, orchestratorLogRepository);
    }

    @Test
    @DisplayName("appendAlert stores wire names and a UTC timestamp, returns the saved id")
    void appendAlert() {
        when(reportRepository.save(any(AgentReport.class))).thenAnswer(inv -> {
            AgentReport row = inv.getArgument(0);
            row.setId(11L);
            return Mono.just(row);
        });

        AlertRecord saved = gateway.appendAlert(
            AlertRecord.unread(AgentRole.NOTIFICATION, 4L, "notice", Severity.DANGER, T0)).block();

        ArgumentCaptor<AgentReport> captor = ArgumentCaptor.forClass(AgentReport.class);
        verify(reportRepository).save(captor.capture());
        AgentReport row = captor.getValue();
        assertEquals("notification", row.getAgentType());
        assertEquals("danger", row.getSeverity());
        assertEquals(Boolean.FALSE, row.getRead());
        assertEquals(T0_UTC, row.getCreatedAt());

        assertEquals(11L, saved.id());
        assertEquals(T0, saved.createdAt());
        assertEquals(AgentRole.NOTIFICATION, saved.source());
    }

    @Test
    @DisplayName("whole-program lookup uses the topic-less query")
    void latestGeneralRecommendation() {
        AdaptationLog row = new AdaptationLog();
        row.setId(3L);
        row.setStudentId(4L);
        row.setRecommendation("general");
        row.setAiGenerated(true);
        row.setCreatedAt(T0_UTC);
        when(adaptationRepository.findLatestGeneral(4L)).thenReturn(Mono.just(row));

        RecommendationRecord record = gateway.findLatestRecommendation(4L, null).block();

        assertTrue(record.isGeneral());
        assertEquals(GeneratedBy.EXTERNAL, record.generatedBy());
        verify(adaptationRepository, never()).findLatestForTopic(any(), any());
    }

    @Test
    @DisplayName("appendRecommendation maps generated_by onto the ai flag")
    void appendRecommendation() {
        when(adaptationRepository.save(any(AdaptationLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        RecommendationRecord saved = gateway.appendRecommendation(
            RecommendationRecord.of(4L, 7L, "text", GeneratedBy.RULE, T0)).block();

        assertEquals(GeneratedBy.RULE, saved.generatedBy());
        assertEquals(7L, saved.topicId());
    }

    @Test
    @DisplayName("recent recommendations map the ai flag and a missing topic")
    void recentRecommendations() {
        AdaptationLog general = new AdaptationLog();
        general.setId(9L);
        general.setStudentId(4L);
        general.setRecommendation("Review the course from the start.");
        general.setAiGenerated(true);
        general.setCreatedAt(T0_UTC);
        when(adaptationRepository.findRecent(10)).thenReturn(Flux.just(general));

        List<RecommendationRecord> records = gateway.findRecentRecommendations(10).collectList().block();

        assertEquals(1, records.size());
        assertTrue(records.get(0).isGeneral());
        assertEquals(GeneratedBy.EXTERNAL, records.get(0).generatedBy());
        assertEquals(T0, records.get(0).createdAt());
    }

    @Test
    @DisplayName("decision entries round through the orchestrator log table")
    void appendDecision() {
        when(orchestratorLogRepository.save(any(OrchestratorLog.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

        DecisionLogEntry saved = gateway.appendDecision(
            DecisionLogEntry.decision("student_risk", "adaptation,notification", 4L, "Score=20.0%", T0)).block();

        assertEquals("orchestrator", saved.sourceAgent());
        assertEquals("adaptation,notification", saved.targetAgent());
        assertTrue(saved.isDecision());
    }

    @Test
    @DisplayName("students come from the users table filtered by role")
    void findStudents() {
        UserAccount user = new UserAccount();
        user.setId(4L);
        user.setUsername("anna");
        user.setRole(UserAccount.ROLE_STUDENT);
        when(userRepository.findByRoleOrderById("student")).thenReturn(Flux.just(user));

        List<Student> students = gateway.findStudents().collectList().block();

        assertEquals(1, students.size());
        assertEquals("anna", students.get(0).displayName());
    }

    @Test
    @DisplayName("markAllAlertsRead reports the number of rows changed")
    void markAllRead() {
        when(reportRepository.markAllRead()).thenReturn(Mono.just(3));
        assertEquals(3L, gateway.markAllAlertsRead().block());
    }
}
