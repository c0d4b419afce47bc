package com.assetdesk.backend.modules.license.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.assetdesk.backend.global.error.InsufficientAvailableSeatsError;
import com.assetdesk.backend.global.error.LicenseDeleteError;
import com.assetdesk.backend.global.error.LicenseHasAssignedSeatsError;
import com.assetdesk.backend.global.error.SeatReconcileError;
import com.assetdesk.backend.global.error.ValidationError;
import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.modules.asset.domain.Asset;
import com.assetdesk.backend.modules.asset.infrastructure.persistence.AssetRepository;
import com.assetdesk.backend.modules.assignment.application.TargetResolver;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.audit.application.AuditLogService;
import com.assetdesk.backend.modules.license.domain.License;
import com.assetdesk.backend.modules.license.domain.LicenseSeat;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseRepository;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseSeatRepository;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseCopyRequest;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseRequest;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseResponse;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseSeatResponse;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseSeatResponse.SeatState;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LicenseServiceTest {

    private static final long LICENSE_ID = 10L;
    private static final long ACTOR_ID = 1L;

    @Mock
    private LicenseRepository licenseRepository;

    @Mock
    private LicenseSeatRepository licenseSeatRepository;

    @Mock
    private AssetRepository assetRepository;

    @Mock
    private SeatPoolManager seatPoolManager;

    @Mock
    private TargetResolver targetResolver;

    @Mock
    private AuditLogService auditLogService;

    private LicenseService licenseService;
    private License license;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        licenseService = new LicenseService(
                licenseRepository,
                licenseSeatRepository,
                assetRepository,
                seatPoolManager,
                targetResolver,
                new AuditLedger(clock),
                auditLogService
        );

        license = new License();
        license.setName("Office Suite");
        license.setSeats(5);
        setField(license, "id", LICENSE_ID);
    }

    @Test
    @DisplayName("Saving with fewer seats than are free is rejected with the reconcile error")
    void update_propagatesReconcileFailure() {
        InsufficientAvailableSeatsError shortage = new InsufficientAvailableSeatsError(LICENSE_ID, 3, 1, 4);
        when(licenseRepository.findByIdForUpdate(LICENSE_ID)).thenReturn(Optional.of(license));
        when(licenseSeatRepository.countActive(LICENSE_ID)).thenReturn(5L);
        when(seatPoolManager.reconcile(LICENSE_ID, 5, 2, ACTOR_ID)).thenReturn(Result.err(shortage));

        Result<LicenseResponse, SeatReconcileError> result = licenseService.update(LICENSE_ID, request("Office Suite", 2), ACTOR_ID);

        assertThat(result.getError()).isEqualTo(shortage);
        verify(auditLogService, never()).record(eq("LICENSE_UPDATED"), any(), any(), anyLong(), any());
    }

    @Test
    @DisplayName("The previous seat count comes from the active seat rows")
    void update_usesActiveSeatRows() {
        when(licenseRepository.findByIdForUpdate(LICENSE_ID)).thenReturn(Optional.of(license));
        when(licenseSeatRepository.countActive(LICENSE_ID)).thenReturn(4L);
        when(seatPoolManager.reconcile(LICENSE_ID, 4, 6, ACTOR_ID)).thenReturn(Result.success());
        when(licenseSeatRepository.findByLicenseIdOrderByIdAsc(LICENSE_ID)).thenReturn(List.of());

        Result<LicenseResponse, SeatReconcileError> result = licenseService.update(LICENSE_ID, request("Office Suite 2025", 6), ACTOR_ID);

        assertThat(result.isOk()).isTrue();
        assertThat(result.get().name()).isEqualTo("Office Suite 2025");
        assertThat(license.getSeats()).isEqualTo(6);
        assertThat(license.getModifiedBy()).isEqualTo(ACTOR_ID);
    }

    @Test
    @DisplayName("A copy keeps the fields and seat count but not the serial, and gets its own seat pool")
    void copy_buildsFreshSeatPool() {
        license.setSerial("SN-OLD");
        license.setNotes("volume agreement");
        when(licenseRepository.findById(LICENSE_ID)).thenReturn(Optional.of(license));
        when(licenseRepository.save(any(License.class))).thenAnswer(invocation -> {
            License saved = invocation.getArgument(0);
            setField(saved, "id", 11L);
            return saved;
        });
        when(seatPoolManager.reconcile(11L, 0, 5, ACTOR_ID)).thenReturn(Result.success());

        Result<LicenseResponse, SeatReconcileError> result = licenseService.copy(LICENSE_ID, new LicenseCopyRequest(null), ACTOR_ID);

        assertThat(result.isOk()).isTrue();
        assertThat(result.get().id()).isEqualTo(11L);
        assertThat(result.get().name()).isEqualTo("Office Suite");
        assertThat(result.get().serial()).isNull();
        assertThat(result.get().seats()).isEqualTo(5);
        assertThat(result.get().notes()).isEqualTo("volume agreement");
        verify(seatPoolManager).reconcile(11L, 0, 5, ACTOR_ID);
    }

    @Test
    @DisplayName("An expiration date before the purchase date is rejected")
    void create_rejectsInvertedDates() {
        LicenseRequest request = new LicenseRequest("Office Suite", null, 3, true, null, null, null, null, null, null,
                null, null, java.time.LocalDate.parse("2025-03-01"), java.time.LocalDate.parse("2025-01-01"), null);

        Result<LicenseResponse, SeatReconcileError> result = licenseService.create(request, ACTOR_ID);

        assertThat(result.getError()).isInstanceOf(ValidationError.class);
        verify(licenseRepository, never()).save(any());
    }

    @Test
    @DisplayName("A license with assigned seats cannot be deleted")
    void delete_rejectedWhileSeatsAssigned() {
        when(licenseRepository.findByIdForUpdate(LICENSE_ID)).thenReturn(Optional.of(license));
        when(seatPoolManager.assignedSeats(LICENSE_ID)).thenReturn(2);

        Result<Void, LicenseDeleteError> result = licenseService.delete(LICENSE_ID, ACTOR_ID);

        assertThat(result.getError()).isEqualTo(new LicenseHasAssignedSeatsError(LICENSE_ID, 2));
        assertThat(license.isActive()).isTrue();
        verify(seatPoolManager, never()).retireAll(any(), anyLong());
    }

    @Test
    @DisplayName("Deleting a license retires its seats and soft-deletes it")
    void delete_softDeletes() {
        when(licenseRepository.findByIdForUpdate(LICENSE_ID)).thenReturn(Optional.of(license));
        when(seatPoolManager.assignedSeats(LICENSE_ID)).thenReturn(0);

        Result<Void, LicenseDeleteError> result = licenseService.delete(LICENSE_ID, ACTOR_ID);

        assertThat(result.isOk()).isTrue();
        assertThat(license.isActive()).isFalse();
        verify(seatPoolManager).retireAll(license, ACTOR_ID);
    }

    @Test
    @DisplayName("License detail numbers the seats and labels their holders")
    void getLicense_listsSeats() {
        LicenseSeat free = seat(100L);
        LicenseSeat toUser = seat(101L);
        toUser.assign(AssignmentTarget.user(9L), OffsetDateTime.parse("2025-02-01T00:00:00Z"), null, null);
        LicenseSeat toAsset = seat(102L);
        toAsset.assign(AssignmentTarget.asset(2L), OffsetDateTime.parse("2025-02-02T00:00:00Z"), null, 5L);
        Asset laptop = new Asset();
        laptop.setTag("LAP-002");
        laptop.setLocationId(3L);

        when(licenseRepository.findById(LICENSE_ID)).thenReturn(Optional.of(license));
        when(licenseSeatRepository.findByLicenseIdOrderByIdAsc(LICENSE_ID)).thenReturn(List.of(free, toUser, toAsset));
        when(assetRepository.findById(2L)).thenReturn(Optional.of(laptop));
        when(targetResolver.describe(AssignmentTarget.unassigned())).thenReturn(Optional.empty());
        when(targetResolver.describe(AssignmentTarget.user(9L))).thenReturn(Optional.of("Mina Park"));
        when(targetResolver.describe(AssignmentTarget.asset(2L))).thenReturn(Optional.of("LAP-002"));
        when(targetResolver.describe(AssignmentTarget.location(3L))).thenReturn(Optional.of("Seoul HQ"));

        LicenseResponse response = licenseService.getLicense(LICENSE_ID).orElseThrow();

        assertThat(response.availableSeats()).isEqualTo(1);
        assertThat(response.seatDetails()).extracting(LicenseSeatResponse::label)
                .containsExactly("Seat 1", "Seat 2", "Seat 3");
        assertThat(response.seatDetails()).extracting(LicenseSeatResponse::state)
                .containsExactly(SeatState.AVAILABLE, SeatState.ASSIGNED, SeatState.ASSIGNED);
        assertThat(response.seatDetails().get(1).assigneeLabel()).isEqualTo("Mina Park");
        assertThat(response.seatDetails().get(2).custodianUserId()).isEqualTo(5L);
        assertThat(response.seatDetails().get(2).locationLabel()).isEqualTo("Seoul HQ");
    }

    private LicenseRequest request(String name, int seats) {
        return new LicenseRequest(name, "SN-1", seats, true, null, null, null, null, null, null,
                null, null, null, null, null);
    }

    private LicenseSeat seat(long id) {
        LicenseSeat seat = new LicenseSeat(license);
        setField(seat, "id", id);
        return seat;
    }

    private void setField(Object target, String fieldName, Object value) {
        try {
            java.lang.reflect.Field field = target.getClass().getDeclaredField(fieldName);
            field.setAccessible(true);
            field.set(target, value);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
