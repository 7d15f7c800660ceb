package com.rostermate.backend.modules.assignment;

import static com.rostermate.backend.support.TestEntities.exclusionGroup;
import static com.rostermate.backend.support.TestEntities.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rostermate.backend.modules.assignment.application.AssignmentProperties;
import com.rostermate.backend.modules.assignment.application.AssignmentStore;
import com.rostermate.backend.modules.assignment.application.RoleAssignmentEngine;
import com.rostermate.backend.modules.assignment.application.StoreUnavailableException;
import com.rostermate.backend.modules.assignment.application.UniqueConstraintViolationException;
import com.rostermate.backend.modules.assignment.domain.AssignmentDecision;
import com.rostermate.backend.modules.assignment.domain.DeclineReason;
import com.rostermate.backend.modules.assignment.domain.ReassignmentPolicy;
import com.rostermate.backend.modules.catalogue.domain.CatalogueRole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class RoleAssignmentEngineTest {

    private static final UUID EVENT_ID = UUID.fromString("00000000-0000-0000-0000-00000000e001");
    private static final long VOLUNTEER_ID = 1001L;

    @Mock
    private AssignmentStore assignmentStore;

    @Mock
    private PlatformTransactionManager transactionManager;

    private RoleAssignmentEngine engine;

    private CatalogueRole runDirector;
    private CatalogueRole tailWalker;
    private CatalogueRole timekeeper;
    private CatalogueRole barcodeScanner;
    private CatalogueRole photographer;

    @BeforeEach
    void setUp() {
        runDirector = role("RUN_DIRECTOR", "Run director", true, 10);
        tailWalker = role("TAIL_WALKER", "Tail walker", true, 60);
        timekeeper = role("TIMEKEEPER", "Timekeeper", false, 70);
        barcodeScanner = role("BARCODE_SCANNER", "Barcode scanner", false, 90);
        photographer = role("PHOTOGRAPHER", "Photographer", false, 100);
        exclusionGroup("LEAD_AND_TAIL", runDirector, tailWalker);
        exclusionGroup("FINISH_FUNNEL", timekeeper, barcodeScanner);

        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        engine = newEngine(ReassignmentPolicy.REQUIRE_UNASSIGN);
    }

    @Test
    @DisplayName("unknown role is declined before the event is locked")
    void unknownRoleIsDeclinedWithoutLocking() {
        when(assignmentStore.findRole("Juggler")).thenReturn(Optional.empty());

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "Juggler");

        assertThat(decision.ok()).isFalse();
        assertThat(decision.reason()).isEqualTo(DeclineReason.ROLE_NOT_FOUND);
        assertThat(decision.roleName()).isEqualTo("Juggler");
        verify(assignmentStore, never()).lockEvent(any());
        verify(assignmentStore, never()).insert(anyLong(), any(), any());
    }

    @Test
    @DisplayName("holding the same role again is declined as a duplicate")
    void duplicateAssignmentIsDeclined() {
        when(assignmentStore.findRole("TIMEKEEPER")).thenReturn(Optional.of(timekeeper));
        when(assignmentStore.hasAssignment(VOLUNTEER_ID, timekeeper, EVENT_ID)).thenReturn(true);

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "TIMEKEEPER");

        assertThat(decision.reason()).isEqualTo(DeclineReason.ALREADY_ASSIGNED_SAME_ROLE);
        assertThat(decision.roleCode()).isEqualTo("TIMEKEEPER");
        verify(assignmentStore, never()).insert(anyLong(), any(), any());
    }

    @Test
    @DisplayName("unique role held by someone else is declined as taken")
    void uniqueRoleHeldByOtherVolunteerIsTaken() {
        when(assignmentStore.findRole("RUN_DIRECTOR")).thenReturn(Optional.of(runDirector));
        when(assignmentStore.isRoleTaken(runDirector, EVENT_ID)).thenReturn(true);

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "RUN_DIRECTOR");

        assertThat(decision.reason()).isEqualTo(DeclineReason.ROLE_TAKEN);
        assertThat(decision.roleName()).isEqualTo("Run director");
        verify(assignmentStore, never()).rolesHeldBy(anyLong(), any());
        verify(assignmentStore, never()).insert(anyLong(), any(), any());
    }

    @Test
    @DisplayName("shared roles skip the taken check and commit")
    void sharedRoleCommitsWithoutTakenCheck() {
        when(assignmentStore.findRole("Photographer")).thenReturn(Optional.of(photographer));
        when(assignmentStore.rolesHeldBy(VOLUNTEER_ID, EVENT_ID)).thenReturn(List.of(timekeeper));

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "Photographer");

        assertThat(decision.ok()).isTrue();
        assertThat(decision.reason()).isNull();
        assertThat(decision.roleCode()).isEqualTo("PHOTOGRAPHER");
        verify(assignmentStore, never()).isRoleTaken(any(), any());
        verify(assignmentStore).insert(VOLUNTEER_ID, photographer, EVENT_ID);
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("role sharing an exclusion group with a held role is declined and names that role")
    void exclusionConflictNamesHeldRole() {
        when(assignmentStore.findRole("BARCODE_SCANNER")).thenReturn(Optional.of(barcodeScanner));
        when(assignmentStore.rolesHeldBy(VOLUNTEER_ID, EVENT_ID)).thenReturn(List.of(timekeeper, photographer));

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "BARCODE_SCANNER");

        assertThat(decision.ok()).isFalse();
        assertThat(decision.reason()).isEqualTo(DeclineReason.EXCLUSION_CONFLICT);
        assertThat(decision.roleCode()).isEqualTo("BARCODE_SCANNER");
        assertThat(decision.conflictingRoleCode()).isEqualTo("TIMEKEEPER");
        assertThat(decision.message()).contains("Barcode scanner", "Timekeeper");
        verify(assignmentStore, never()).insert(anyLong(), any(), any());
    }

    @Test
    @DisplayName("a role in several groups conflicts through each of them, and groups may have more than two members")
    void exclusionAppliesAcrossOverlappingGroups() {
        CatalogueRole leadMarshal = role("LEAD_MARSHAL", "Lead marshal", false, 15);
        CatalogueRole courseMarshal = role("COURSE_MARSHAL", "Course marshal", false, 25);
        CatalogueRole turnMarshal = role("TURN_MARSHAL", "Turn marshal", false, 35);
        CatalogueRole pacer = role("PACER", "Pacer", false, 45);
        exclusionGroup("MARSHALS", leadMarshal, courseMarshal, turnMarshal);
        exclusionGroup("ON_COURSE", leadMarshal, pacer);

        when(assignmentStore.findRole("LEAD_MARSHAL")).thenReturn(Optional.of(leadMarshal));
        when(assignmentStore.findRole("TURN_MARSHAL")).thenReturn(Optional.of(turnMarshal));
        when(assignmentStore.findRole("PACER")).thenReturn(Optional.of(pacer));
        when(assignmentStore.rolesHeldBy(VOLUNTEER_ID, EVENT_ID))
                .thenReturn(List.of(pacer), List.of(courseMarshal), List.of(courseMarshal));

        AssignmentDecision viaSecondGroup = engine.assign(VOLUNTEER_ID, EVENT_ID, "LEAD_MARSHAL");
        AssignmentDecision viaLargeGroup = engine.assign(VOLUNTEER_ID, EVENT_ID, "TURN_MARSHAL");
        AssignmentDecision unrelated = engine.assign(VOLUNTEER_ID, EVENT_ID, "PACER");

        assertThat(viaSecondGroup.reason()).isEqualTo(DeclineReason.EXCLUSION_CONFLICT);
        assertThat(viaSecondGroup.conflictingRoleCode()).isEqualTo("PACER");
        assertThat(viaLargeGroup.reason()).isEqualTo(DeclineReason.EXCLUSION_CONFLICT);
        assertThat(viaLargeGroup.conflictingRoleCode()).isEqualTo("COURSE_MARSHAL");
        assertThat(unrelated.ok()).isTrue();
        verify(assignmentStore).insert(VOLUNTEER_ID, pacer, EVENT_ID);
        verify(assignmentStore, never()).insert(VOLUNTEER_ID, leadMarshal, EVENT_ID);
        verify(assignmentStore, never()).insert(VOLUNTEER_ID, turnMarshal, EVENT_ID);
    }

    @Test
    @DisplayName("event is locked before any check that reads assignments")
    void locksEventBeforeChecks() {
        when(assignmentStore.findRole("RUN_DIRECTOR")).thenReturn(Optional.of(runDirector));
        when(assignmentStore.rolesHeldBy(VOLUNTEER_ID, EVENT_ID)).thenReturn(List.of());

        engine.assign(VOLUNTEER_ID, EVENT_ID, "RUN_DIRECTOR");

        InOrder order = inOrder(assignmentStore);
        order.verify(assignmentStore).lockEvent(EVENT_ID);
        order.verify(assignmentStore).hasAssignment(VOLUNTEER_ID, runDirector, EVENT_ID);
        order.verify(assignmentStore).isRoleTaken(runDirector, EVENT_ID);
        order.verify(assignmentStore).rolesHeldBy(VOLUNTEER_ID, EVENT_ID);
        order.verify(assignmentStore).insert(VOLUNTEER_ID, runDirector, EVENT_ID);
    }

    @Test
    @DisplayName("unique index rejection at insert is reported as taken and rolled back")
    void uniqueIndexBackstopMapsToRoleTaken() {
        when(assignmentStore.findRole("RUN_DIRECTOR")).thenReturn(Optional.of(runDirector));
        when(assignmentStore.rolesHeldBy(VOLUNTEER_ID, EVENT_ID)).thenReturn(List.of());
        doThrow(new UniqueConstraintViolationException(
                UniqueConstraintViolationException.Constraint.UNIQUE_ROLE_EVENT,
                "RUN_DIRECTOR", "Run director", null))
                .when(assignmentStore).insert(VOLUNTEER_ID, runDirector, EVENT_ID);

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "RUN_DIRECTOR");

        assertThat(decision.reason()).isEqualTo(DeclineReason.ROLE_TAKEN);
        assertThat(decision.roleCode()).isEqualTo("RUN_DIRECTOR");
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("triple constraint rejection at insert is reported as a duplicate")
    void tripleConstraintBackstopMapsToAlreadyAssigned() {
        when(assignmentStore.findRole("TIMEKEEPER")).thenReturn(Optional.of(timekeeper));
        when(assignmentStore.rolesHeldBy(VOLUNTEER_ID, EVENT_ID)).thenReturn(List.of());
        doThrow(new UniqueConstraintViolationException(
                UniqueConstraintViolationException.Constraint.VOLUNTEER_ROLE_EVENT,
                "TIMEKEEPER", "Timekeeper", null))
                .when(assignmentStore).insert(VOLUNTEER_ID, timekeeper, EVENT_ID);

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "TIMEKEEPER");

        assertThat(decision.reason()).isEqualTo(DeclineReason.ALREADY_ASSIGNED_SAME_ROLE);
    }

    @Test
    @DisplayName("lock wait timeout surfaces as a retryable store failure")
    void lockTimeoutSurfacesAsStoreUnavailable() {
        when(assignmentStore.findRole("RUN_DIRECTOR")).thenReturn(Optional.of(runDirector));
        doThrow(new QueryTimeoutException("canceling statement due to statement timeout"))
                .when(assignmentStore).lockEvent(EVENT_ID);

        assertThatThrownBy(() -> engine.assign(VOLUNTEER_ID, EVENT_ID, "RUN_DIRECTOR"))
                .isInstanceOfSatisfying(StoreUnavailableException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                    assertThat(ex.getCode()).isEqualTo("STORE_UNAVAILABLE");
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(1);
                    assertThat(ex.getCause()).isInstanceOf(QueryTimeoutException.class);
                });
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("failing to open a transaction surfaces as a retryable store failure")
    void connectionFailureSurfacesAsStoreUnavailable() {
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("Connection is not available"));

        assertThatThrownBy(() -> engine.assign(VOLUNTEER_ID, EVENT_ID, "RUN_DIRECTOR"))
                .isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> engine.unassign(VOLUNTEER_ID, EVENT_ID))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("unrecognised storage errors are rethrown unchanged")
    void unexpectedStorageErrorIsRethrown() {
        when(assignmentStore.findRole("TIMEKEEPER")).thenReturn(Optional.of(timekeeper));
        when(assignmentStore.rolesHeldBy(VOLUNTEER_ID, EVENT_ID)).thenReturn(List.of());
        doThrow(new DataIntegrityViolationException("check constraint violated"))
                .when(assignmentStore).insert(VOLUNTEER_ID, timekeeper, EVENT_ID);

        assertThatThrownBy(() -> engine.assign(VOLUNTEER_ID, EVENT_ID, "TIMEKEEPER"))
                .isInstanceOf(DataIntegrityViolationException.class)
                .hasMessage("check constraint violated");
    }

    @Test
    @DisplayName("replace policy drops held roles instead of checking exclusions")
    void replacePolicyDropsHeldRoles() {
        engine = newEngine(ReassignmentPolicy.REPLACE_EXISTING);
        when(assignmentStore.findRole("BARCODE_SCANNER")).thenReturn(Optional.of(barcodeScanner));
        when(assignmentStore.deleteAll(VOLUNTEER_ID, EVENT_ID)).thenReturn(1);

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "BARCODE_SCANNER");

        assertThat(decision.ok()).isTrue();
        verify(assignmentStore, never()).rolesHeldBy(anyLong(), any());
        InOrder order = inOrder(assignmentStore);
        order.verify(assignmentStore).deleteAll(VOLUNTEER_ID, EVENT_ID);
        order.verify(assignmentStore).insert(VOLUNTEER_ID, barcodeScanner, EVENT_ID);
    }

    @Test
    @DisplayName("replace policy still refuses a unique role held by someone else")
    void replacePolicyStillChecksUniqueness() {
        engine = newEngine(ReassignmentPolicy.REPLACE_EXISTING);
        when(assignmentStore.findRole("RUN_DIRECTOR")).thenReturn(Optional.of(runDirector));
        when(assignmentStore.isRoleTaken(runDirector, EVENT_ID)).thenReturn(true);

        AssignmentDecision decision = engine.assign(VOLUNTEER_ID, EVENT_ID, "RUN_DIRECTOR");

        assertThat(decision.reason()).isEqualTo(DeclineReason.ROLE_TAKEN);
        verify(assignmentStore, never()).deleteAll(anyLong(), any());
    }

    @Test
    @DisplayName("unassign reports whether anything was removed")
    void unassignReportsRemoval() {
        when(assignmentStore.deleteAll(VOLUNTEER_ID, EVENT_ID)).thenReturn(2, 0);

        assertThat(engine.unassign(VOLUNTEER_ID, EVENT_ID)).isTrue();
        assertThat(engine.unassign(VOLUNTEER_ID, EVENT_ID)).isFalse();
        verify(assignmentStore, times(2)).lockEvent(EVENT_ID);
    }

    private RoleAssignmentEngine newEngine(ReassignmentPolicy policy) {
        return new RoleAssignmentEngine(
                assignmentStore,
                transactionManager,
                new AssignmentProperties(Duration.ofSeconds(2), policy)
        );
    }
}
