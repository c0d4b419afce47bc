package com.assetdesk.backend.modules.asset.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.assetdesk.backend.global.error.AssetInUseError;
import com.assetdesk.backend.global.error.AssetSaveError;
import com.assetdesk.backend.global.error.DuplicateAssetTagError;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.modules.asset.domain.Asset;
import com.assetdesk.backend.modules.asset.infrastructure.persistence.AssetRepository;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetCopyRequest;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetRequest;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetResponse;
import com.assetdesk.backend.modules.assignment.application.TargetResolver;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;
import com.assetdesk.backend.modules.assignment.domain.LocationLookup;
import com.assetdesk.backend.modules.audit.application.AuditLogService;
import com.assetdesk.backend.modules.license.domain.License;
import com.assetdesk.backend.modules.license.domain.LicenseSeat;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseSeatRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AssetServiceTest {

    private static final long ACTOR_ID = 1L;

    @Mock
    private AssetRepository assetRepository;

    @Mock
    private LicenseSeatRepository licenseSeatRepository;

    @Mock
    private LocationLookup locationLookup;

    @Mock
    private TargetResolver targetResolver;

    @Mock
    private AuditLogService auditLogService;

    private AssetService assetService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        assetService = new AssetService(
                assetRepository,
                licenseSeatRepository,
                locationLookup,
                targetResolver,
                new AuditLedger(clock),
                auditLogService
        );
    }

    @Test
    @DisplayName("Tags are trimmed and upper-cased before they are stored")
    void create_normalizesTag() {
        when(assetRepository.existsByTag("LAP-001")).thenReturn(false);
        when(assetRepository.save(any(Asset.class))).thenAnswer(invocation -> {
            Asset saved = invocation.getArgument(0);
            setField(saved, "id", 1L);
            return saved;
        });

        Result<AssetResponse, AssetSaveError> result = assetService.create(request("  lap-001 ", null), ACTOR_ID);

        assertThat(result.isOk()).isTrue();
        assertThat(result.get().tag()).isEqualTo("LAP-001");
        assertThat(result.get().checkoutCounter()).isZero();
        assertThat(result.get().createdAt()).isEqualTo(OffsetDateTime.parse("2025-03-01T09:00:00Z"));
    }

    @Test
    @DisplayName("A tag already used by an active asset is rejected")
    void create_rejectsDuplicateTag() {
        when(assetRepository.existsByTag("LAP-001")).thenReturn(true);

        Result<AssetResponse, AssetSaveError> result = assetService.create(request("lap-001", null), ACTOR_ID);

        assertThat(result.getError()).isEqualTo(new DuplicateAssetTagError("LAP-001"));
        verify(assetRepository, never()).save(any());
    }

    @Test
    @DisplayName("An unknown location is rejected")
    void create_rejectsUnknownLocation() {
        when(assetRepository.existsByTag("LAP-001")).thenReturn(false);
        when(locationLookup.nameOf(42L)).thenReturn(Optional.empty());

        Result<AssetResponse, AssetSaveError> result = assetService.create(request("LAP-001", 42L), ACTOR_ID);

        assertThat(result.getError()).isEqualTo(new EntityNotFoundError("Location", 42L));
    }

    @Test
    @DisplayName("A copy takes the source's descriptive fields under a new tag and starts unassigned")
    void copy_createsUnassignedAssetWithNewTag() {
        Asset source = new Asset();
        source.setTag("LAP-001");
        source.setName("ThinkPad X1");
        source.setSerial("PF3K9");
        source.setLocationId(3L);
        source.setNotes("14 inch");
        setField(source, "id", 1L);
        source.assign(AssignmentTarget.user(7L), OffsetDateTime.parse("2025-02-01T00:00:00Z"), null, null);
        when(assetRepository.findById(1L)).thenReturn(Optional.of(source));
        when(assetRepository.existsByTag("LAP-002")).thenReturn(false);
        when(locationLookup.nameOf(3L)).thenReturn(Optional.of("Seoul HQ"));
        when(assetRepository.save(any(Asset.class))).thenAnswer(invocation -> {
            Asset saved = invocation.getArgument(0);
            setField(saved, "id", 2L);
            return saved;
        });

        Result<AssetResponse, AssetSaveError> result = assetService.copy(1L, new AssetCopyRequest("lap-002", null), ACTOR_ID);

        assertThat(result.isOk()).isTrue();
        assertThat(result.get().id()).isEqualTo(2L);
        assertThat(result.get().tag()).isEqualTo("LAP-002");
        assertThat(result.get().name()).isEqualTo("ThinkPad X1");
        assertThat(result.get().serial()).isNull();
        assertThat(result.get().notes()).isEqualTo("14 inch");
        assertThat(result.get().locationLabel()).isEqualTo("Seoul HQ");
        assertThat(result.get().assignedType()).isNull();
        assertThat(result.get().checkoutCounter()).isZero();
    }

    @Test
    @DisplayName("Copying an unknown asset is reported as not found")
    void copy_unknownSource() {
        when(assetRepository.findById(1L)).thenReturn(Optional.empty());

        Result<AssetResponse, AssetSaveError> result = assetService.copy(1L, new AssetCopyRequest("LAP-002", null), ACTOR_ID);

        assertThat(result.getError()).isEqualTo(new EntityNotFoundError("Asset", 1L));
        verify(assetRepository, never()).save(any());
    }

    @Test
    @DisplayName("Updating may keep the asset's own tag")
    void update_allowsOwnTag() {
        Asset asset = new Asset();
        asset.setTag("LAP-001");
        setField(asset, "id", 1L);
        when(assetRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(asset));
        when(assetRepository.existsByTagAndIdNot("LAP-001", 1L)).thenReturn(false);
        when(licenseSeatRepository.findByAssetIdOrderByIdAsc(1L)).thenReturn(List.of());

        Result<AssetResponse, AssetSaveError> result = assetService.update(1L, request("lap-001", null), ACTOR_ID);

        assertThat(result.isOk()).isTrue();
        assertThat(asset.getModifiedBy()).isEqualTo(ACTOR_ID);
    }

    @Test
    @DisplayName("A checked-out asset holding a license seat cannot be deleted")
    void delete_rejectedWhileInUse() {
        Asset asset = new Asset();
        asset.setTag("LAP-001");
        setField(asset, "id", 1L);
        asset.assign(AssignmentTarget.user(7L), OffsetDateTime.parse("2025-02-01T00:00:00Z"), null, null);
        when(assetRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(asset));
        when(licenseSeatRepository.countByAssetId(1L)).thenReturn(1L);
        when(assetRepository.countByAssignedTypeAndAssignedTo(AssignmentTargetKind.ASSET, 1L)).thenReturn(0L);

        Result<Void, AssetSaveError> result = assetService.delete(1L, ACTOR_ID);

        assertThat(result.getError()).isEqualTo(new AssetInUseError(1L, true, 1, 0));
        assertThat(asset.isActive()).isTrue();
        verify(assetRepository, never()).save(any());
    }

    @Test
    @DisplayName("An idle asset is soft-deleted")
    void delete_softDeletesIdleAsset() {
        Asset asset = new Asset();
        asset.setTag("LAP-001");
        setField(asset, "id", 1L);
        when(assetRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(asset));
        when(licenseSeatRepository.countByAssetId(1L)).thenReturn(0L);
        when(assetRepository.countByAssignedTypeAndAssignedTo(AssignmentTargetKind.ASSET, 1L)).thenReturn(0L);

        Result<Void, AssetSaveError> result = assetService.delete(1L, ACTOR_ID);

        assertThat(result.isOk()).isTrue();
        assertThat(asset.getDeletedAt()).isEqualTo(OffsetDateTime.parse("2025-03-01T09:00:00Z"));
        verify(assetRepository).save(asset);
    }

    @Test
    @DisplayName("Asset detail lists its assignment and the license seats attached to it")
    void getAsset_includesSeats() {
        Asset asset = new Asset();
        asset.setTag("LAP-001");
        setField(asset, "id", 1L);
        asset.assign(AssignmentTarget.user(7L), OffsetDateTime.parse("2025-02-01T00:00:00Z"), null, null);
        License license = new License();
        license.setName("Office Suite");
        setField(license, "id", 10L);
        LicenseSeat seat = new LicenseSeat(license);
        setField(seat, "id", 100L);
        seat.assign(AssignmentTarget.asset(1L), OffsetDateTime.parse("2025-02-02T00:00:00Z"), null, 7L);

        when(assetRepository.findById(1L)).thenReturn(Optional.of(asset));
        when(licenseSeatRepository.findByAssetIdOrderByIdAsc(1L)).thenReturn(List.of(seat));
        when(targetResolver.describe(AssignmentTarget.user(7L))).thenReturn(Optional.of("Mina Park"));

        AssetResponse response = assetService.getAsset(1L).orElseThrow();

        assertThat(response.assigneeLabel()).isEqualTo("Mina Park");
        assertThat(response.licenseSeats()).singleElement()
                .satisfies(attached -> {
                    assertThat(attached.licenseId()).isEqualTo(10L);
                    assertThat(attached.licenseName()).isEqualTo("Office Suite");
                });
    }

    private AssetRequest request(String tag, Long locationId) {
        return new AssetRequest(tag, "ThinkPad X1", "PF3K9", null, null, null, locationId, null, null, null, null, null);
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
