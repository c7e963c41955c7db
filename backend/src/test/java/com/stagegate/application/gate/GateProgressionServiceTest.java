package com.stagegate.application.gate;

import com.stagegate.application.exception.DuplicateProjectException;
import com.stagegate.application.exception.InvalidProgressionException;
import com.stagegate.application.exception.ProjectNotFoundException;
import com.stagegate.application.exception.VersionConflictException;
import com.stagegate.domain.gate.model.EvidenceItem;
import com.stagegate.domain.gate.model.EvidenceRecord;
import com.stagegate.domain.gate.model.EvidenceStrength;
import com.stagegate.domain.gate.model.EvidenceType;
import com.stagegate.domain.gate.model.GateId;
import com.stagegate.domain.gate.model.GateStatus;
import com.stagegate.domain.gate.model.ProjectValidationState;
import com.stagegate.domain.gate.repository.EvidenceRecordRepository;
import com.stagegate.domain.gate.repository.GatePolicyOverrideRepository;
import com.stagegate.domain.gate.repository.ProjectValidationStateRepository;
import com.stagegate.domain.gate.service.DefaultGatePolicies;
import com.stagegate.domain.gate.service.EvidenceAggregator;
import com.stagegate.domain.gate.service.GateEvaluator;
import com.stagegate.domain.gate.service.PolicyResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GateProgressionServiceTest {

    private static final String TENANT = "t-1";
    private static final String PROJECT = "p-1";

    @Mock
    private ProjectValidationStateRepository stateRepository;

    @Mock
    private EvidenceRecordRepository evidenceRepository;

    @Mock
    private GatePolicyOverrideRepository overrideRepository;

    private GateProgressionService service;

    @BeforeEach
    void setUp() throws Exception {
        PolicyResolver policyResolver = new PolicyResolver(overrideRepository, new DefaultGatePolicies());
        service = new GateProgressionService(stateRepository, evidenceRepository, new EvidenceAggregator(),
                policyResolver, new GateEvaluator());

        Field field = GateProgressionService.class.getDeclaredField("readinessAlertThreshold");
        field.setAccessible(true);
        field.set(service, 0.9);
    }

    private ProjectValidationState givenProject() {
        ProjectValidationState state = ProjectValidationState.create(TENANT, PROJECT);
        when(stateRepository.findByTenantIdAndProjectId(TENANT, PROJECT)).thenReturn(Optional.of(state));
        return state;
    }

    private void givenEvidence(int experiments, int interviews, int analytics, double quality) {
        List<EvidenceRecord> records = new ArrayList<>();
        addRecords(records, EvidenceType.EXPERIMENT, EvidenceStrength.STRONG, experiments, quality);
        addRecords(records, EvidenceType.INTERVIEW, EvidenceStrength.MEDIUM, interviews, quality);
        addRecords(records, EvidenceType.ANALYTICS, EvidenceStrength.MEDIUM, analytics, quality);
        when(evidenceRepository.findByProjectIdOrderByRecordedAtAscIdAsc(PROJECT)).thenReturn(records);
    }

    private void addRecords(List<EvidenceRecord> records, EvidenceType type, EvidenceStrength strength,
                            int count, double quality) {
        for (int i = 0; i < count; i++) {
            records.add(EvidenceRecord.builder()
                    .projectId(PROJECT).type(type).strength(strength).qualityScore(quality).build());
        }
    }

    @Nested
    @DisplayName("createProject / recordEvidence")
    class Lifecycle {

        @Test
        @DisplayName("new project starts pending at desirability")
        void create() {
            when(stateRepository.existsByProjectId(PROJECT)).thenReturn(false);
            when(stateRepository.save(any(ProjectValidationState.class))).then(returnsFirstArg());

            ProjectValidationState state = service.createProject(TENANT, PROJECT);

            assertThat(state.getStage()).isEqualTo(GateId.DESIRABILITY);
            assertThat(state.getGateStatus()).isEqualTo(GateStatus.PENDING);
            assertThat(state.isUnmeasured()).isTrue();
        }

        @Test
        @DisplayName("duplicate project is rejected")
        void duplicate() {
            when(stateRepository.existsByProjectId(PROJECT)).thenReturn(true);

            assertThatThrownBy(() -> service.createProject(TENANT, PROJECT))
                    .isInstanceOf(DuplicateProjectException.class);
            verify(stateRepository, never()).save(any());
        }

        @Test
        @DisplayName("evidence is stored for an existing project")
        void recordEvidence() {
            givenProject();
            when(evidenceRepository.save(any(EvidenceRecord.class))).then(returnsFirstArg());

            service.recordEvidence(TENANT, PROJECT,
                    new EvidenceItem(EvidenceType.INTERVIEW, EvidenceStrength.STRONG, 0.9, false), "Ten calls");

            ArgumentCaptor<EvidenceRecord> captor = ArgumentCaptor.forClass(EvidenceRecord.class);
            verify(evidenceRepository).save(captor.capture());
            assertThat(captor.getValue().getType()).isEqualTo(EvidenceType.INTERVIEW);
            assertThat(captor.getValue().getSummary()).isEqualTo("Ten calls");
        }

        @Test
        @DisplayName("hypothesis count is stored and never negative")
        void hypotheses() {
            ProjectValidationState state = givenProject();

            service.updateHypotheses(TENANT, PROJECT, 4, null);
            assertThat(state.getHypothesesCount()).isEqualTo(4);

            service.updateHypotheses(TENANT, PROJECT, -2, null);
            assertThat(state.getHypothesesCount()).isZero();
        }

        @Test
        @DisplayName("unknown project → not found")
        void unknownProject() {
            when(stateRepository.findByTenantIdAndProjectId(TENANT, "nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getState(TENANT, "nope"))
                    .isInstanceOf(ProjectNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("meeting every threshold passes and stores metrics")
        void passes() {
            ProjectValidationState state = givenProject();
            givenEvidence(5, 3, 2, 0.8);

            GateCheckResult result = service.evaluate(TENANT, PROJECT, null);

            assertThat(result.evaluation().status()).isEqualTo(GateStatus.PASSED);
            assertThat(state.getGateStatus()).isEqualTo(GateStatus.PASSED);
            assertThat(state.getExperimentsCount()).isEqualTo(5);
            assertThat(state.getEvidenceCount()).isEqualTo(10);
            assertThat(state.getReadinessScore()).isEqualTo(1.0);
            assertThat(result.hasReadinessAlert()).isFalse();
        }

        @Test
        @DisplayName("no evidence stays pending")
        void pending() {
            givenProject();
            when(evidenceRepository.findByProjectIdOrderByRecordedAtAscIdAsc(PROJECT)).thenReturn(List.of());

            assertThat(service.evaluate(TENANT, PROJECT, null).evaluation().status()).isEqualTo(GateStatus.PENDING);
        }

        @Test
        @DisplayName("close to passing raises a readiness alert")
        void readinessAlert() {
            givenProject();
            // quality 1, experiments 4/5, evidence 10/10 → readiness 0.933
            givenEvidence(4, 4, 2, 0.8);

            GateCheckResult result = service.evaluate(TENANT, PROJECT, null);

            assertThat(result.evaluation().status()).isEqualTo(GateStatus.FAILED);
            assertThat(result.readinessAlert()).isEqualTo("Project p-1 is 93% ready for the DESIRABILITY gate");
        }

        @Test
        @DisplayName("far from passing raises no alert")
        void noAlert() {
            givenProject();
            givenEvidence(1, 1, 0, 0.5);

            assertThat(service.evaluate(TENANT, PROJECT, null).hasReadinessAlert()).isFalse();
        }

        @Test
        @DisplayName("stale expected version → conflict")
        void versionConflict() {
            givenProject();

            assertThatThrownBy(() -> service.evaluate(TENANT, PROJECT, 3L))
                    .isInstanceOf(VersionConflictException.class)
                    .satisfies(e -> {
                        VersionConflictException conflict = (VersionConflictException) e;
                        assertThat(conflict.getExpectedVersion()).isEqualTo(3L);
                        assertThat(conflict.getCurrentVersion()).isZero();
                    });
        }
    }

    @Nested
    @DisplayName("advance")
    class Advance {

        @Test
        @DisplayName("passed gate moves to the next gate, pending")
        void passedGate() {
            ProjectValidationState state = givenProject();
            givenEvidence(5, 3, 2, 0.8);
            service.evaluate(TENANT, PROJECT, null);

            service.advance(TENANT, PROJECT, null);

            assertThat(state.getStage()).isEqualTo(GateId.FEASIBILITY);
            assertThat(state.getGateStatus()).isEqualTo(GateStatus.PENDING);
            assertThat(state.getReadinessScore()).isZero();
        }

        @Test
        @DisplayName("unpassed gate cannot advance")
        void notPassed() {
            givenProject();

            assertThatThrownBy(() -> service.advance(TENANT, PROJECT, null))
                    .isInstanceOf(InvalidProgressionException.class)
                    .hasMessageContaining("has not passed");
        }
    }
}
