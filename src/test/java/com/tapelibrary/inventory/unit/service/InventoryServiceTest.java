package com.tapelibrary.inventory.unit.service;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.changer.ChangerException;
import com.tapelibrary.inventory.changer.SlotStatus;
import com.tapelibrary.inventory.config.InventoryProperties;
import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.MoveKind;
import com.tapelibrary.inventory.domain.SlotCategory;
import com.tapelibrary.inventory.domain.VolumeCategory;
import com.tapelibrary.inventory.domain.VolumeFlag;
import com.tapelibrary.inventory.domain.VolumeFlags;
import com.tapelibrary.inventory.dto.request.CreatePathRequest;
import com.tapelibrary.inventory.dto.request.LocationRequest;
import com.tapelibrary.inventory.dto.request.RegisterVolumeRequest;
import com.tapelibrary.inventory.dto.request.UpdateVolumeRequest;
import com.tapelibrary.inventory.dto.response.AuditReport;
import com.tapelibrary.inventory.dto.response.VolumeResponse;
import com.tapelibrary.inventory.entity.Volume;
import com.tapelibrary.inventory.exception.AlreadyExistsException;
import com.tapelibrary.inventory.exception.FinalizeFailedException;
import com.tapelibrary.inventory.exception.InvalidTransitionException;
import com.tapelibrary.inventory.exception.ResourceNotFoundException;
import com.tapelibrary.inventory.exception.VolumesExhaustedException;
import com.tapelibrary.inventory.repository.PathEntryRepository;
import com.tapelibrary.inventory.repository.VolumeRepository;
import com.tapelibrary.inventory.service.InventoryService;
import com.tapelibrary.inventory.service.PendingMove;
import com.tapelibrary.inventory.service.VolumeBookkeeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InventoryServiceTest {

    @Mock
    private VolumeRepository volumeRepository;

    @Mock
    private PathEntryRepository pathEntryRepository;

    @Mock
    private VolumeBookkeeper bookkeeper;

    @Mock
    private Changer changer;

    private InventoryService inventoryService;

    @BeforeEach
    void setUp() {
        inventoryService = service(false);
    }

    @Test
    void load_happyPath_drivesChangerBetweenPhases() {
        PendingMove move = new PendingMove(MoveKind.LOAD, "V00001", Location.storage(10), Location.transfer(0));
        Volume finished = new Volume("V00001", VolumeCategory.SCRATCH);
        finished.setLocation(Location.transfer(0));
        finished.setHome(Location.storage(10));
        finished.setFlags(VolumeFlags.of(VolumeFlag.MOUNTED));
        when(bookkeeper.prepare(MoveKind.LOAD, "V00001", Location.transfer(0))).thenReturn(move);
        when(bookkeeper.complete(move)).thenReturn(finished);

        VolumeResponse response = inventoryService.load("V00001", Location.transfer(0), changer);

        verify(changer).load(Location.storage(10), Location.transfer(0));
        assertThat(response.location().category()).isEqualTo("transfer");
        assertThat(response.home().addr()).isEqualTo(10);
        assertThat(response.flags()).containsExactly("mounted");
    }

    @Test
    void load_whenChangerFails_rethrowsUnchangedAndNeverCompletes() {
        PendingMove move = new PendingMove(MoveKind.LOAD, "V00001", Location.storage(10), Location.transfer(0));
        when(bookkeeper.prepare(MoveKind.LOAD, "V00001", Location.transfer(0))).thenReturn(move);
        ChangerException fault = new ChangerException("changer.load", "picker jammed");
        doThrow(fault).when(changer).load(Location.storage(10), Location.transfer(0));

        assertThatThrownBy(() -> inventoryService.load("V00001", Location.transfer(0), changer))
            .isSameAs(fault);
        verify(bookkeeper, never()).complete(any());
    }

    @Test
    void unload_whenRecordingFails_throwsFinalizeFailed() {
        PendingMove move = new PendingMove(MoveKind.UNLOAD, "V00001", Location.transfer(0), Location.storage(10));
        when(bookkeeper.prepare(MoveKind.UNLOAD, "V00001", null)).thenReturn(move);
        OptimisticLockingFailureException cause = new OptimisticLockingFailureException("row changed");
        when(bookkeeper.complete(move)).thenThrow(cause);

        assertThatThrownBy(() -> inventoryService.unload("V00001", null, changer))
            .isInstanceOf(FinalizeFailedException.class)
            .hasCause(cause)
            .satisfies(e -> {
                FinalizeFailedException ffe = (FinalizeFailedException) e;
                assertThat(ffe.getSerial()).isEqualTo("V00001");
                assertThat(ffe.getDestination()).isEqualTo(Location.storage(10));
                assertThat(ffe.getOperation()).isEqualTo("inventory.unload");
            });
        verify(changer).unload(Location.transfer(0), Location.storage(10));
    }

    @Test
    void transfer_whenPrepareRejects_neverTouchesChanger() {
        when(bookkeeper.prepare(MoveKind.TRANSFER, "V00001", Location.transfer(1)))
            .thenThrow(new InvalidTransitionException("inventory.transfer", "V00001", "invalid destination slot"));

        assertThatThrownBy(() -> inventoryService.transfer("V00001", Location.transfer(1), changer))
            .isInstanceOf(InvalidTransitionException.class);
        verify(changer, never()).transfer(any(), any());
    }

    @Test
    void alloc_whenNoCandidates_throwsVolumesExhausted() {
        when(volumeRepository.findAllocationCandidatesForUpdate(any(), eq(SlotCategory.STORAGE), any(Pageable.class)))
            .thenReturn(List.of());

        assertThatThrownBy(() -> inventoryService.alloc())
            .isInstanceOf(VolumesExhaustedException.class);
    }

    @Test
    void alloc_scratchWinner_becomesAllocating() {
        Volume scratch = new Volume("V00001", VolumeCategory.SCRATCH);
        when(volumeRepository.findAllocationCandidatesForUpdate(any(), eq(SlotCategory.STORAGE), any(Pageable.class)))
            .thenReturn(List.of(scratch));

        assertThat(inventoryService.alloc()).isEqualTo("V00001");
        assertThat(scratch.getCategory()).isEqualTo(VolumeCategory.ALLOCATING);
        verify(volumeRepository).save(scratch);
    }

    @Test
    void alloc_fillingWinner_keepsCategory() {
        Volume filling = new Volume("V00002", VolumeCategory.FILLING);
        when(volumeRepository.findAllocationCandidatesForUpdate(any(), eq(SlotCategory.STORAGE), any(Pageable.class)))
            .thenReturn(List.of(filling));

        assertThat(inventoryService.alloc()).isEqualTo("V00002");
        assertThat(filling.getCategory()).isEqualTo(VolumeCategory.FILLING);
        verify(volumeRepository, never()).save(any());
    }

    @Test
    void register_withNonInitialCategory_throws() {
        var request = new RegisterVolumeRequest("V00001", new LocationRequest(1, "storage"), "full");

        assertThatThrownBy(() -> inventoryService.register(request))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("unknown or scratch");
        verify(volumeRepository, never()).save(any());
    }

    @Test
    void register_whenSerialKnown_throwsAlreadyExists() {
        when(volumeRepository.existsById("V00001")).thenReturn(true);

        assertThatThrownBy(() -> inventoryService.register(
            new RegisterVolumeRequest("V00001", new LocationRequest(1, "storage"), null)))
            .isInstanceOf(AlreadyExistsException.class);
    }

    @Test
    void register_whenSlotOccupied_throwsAlreadyExists() {
        when(volumeRepository.findByLocation(1, SlotCategory.STORAGE))
            .thenReturn(Optional.of(new Volume("V00009", VolumeCategory.SCRATCH)));

        assertThatThrownBy(() -> inventoryService.register(
            new RegisterVolumeRequest("V00001", new LocationRequest(1, "storage"), null)))
            .isInstanceOf(AlreadyExistsException.class)
            .hasMessageContaining("V00009");
    }

    @Test
    void update_rejectedTransition_leavesVolumeUnchanged() {
        Volume volume = new Volume("V00001", VolumeCategory.FULL);
        when(volumeRepository.findById("V00001")).thenReturn(Optional.of(volume));

        assertThatThrownBy(() -> inventoryService.update("V00001", new UpdateVolumeRequest("scratch", true, null)))
            .isInstanceOf(InvalidTransitionException.class);
        assertThat(volume.getCategory()).isEqualTo(VolumeCategory.FULL);
        assertThat(volume.getFlags().isEmpty()).isTrue();
    }

    @Test
    void loaded_onNonTransferSlot_throwsIllegalArgument() {
        assertThatThrownBy(() -> inventoryService.loaded(Location.storage(0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loaded_emptyDrive_isNotAnError() {
        when(volumeRepository.findByLocation(anyInt(), eq(SlotCategory.TRANSFER))).thenReturn(Optional.empty());

        assertThat(inventoryService.loaded(Location.transfer(2))).isEmpty();
    }

    @Test
    void create_existingPath_throwsAlreadyExists() {
        when(pathEntryRepository.existsById("/backup/a")).thenReturn(true);

        assertThatThrownBy(() -> inventoryService.create(new CreatePathRequest("/backup/a/", "V00001")))
            .isInstanceOf(AlreadyExistsException.class);
        verify(pathEntryRepository, never()).save(any());
    }

    @Test
    void lookup_unmappedPath_throwsResourceNotFound() {
        when(pathEntryRepository.findByPathWithVolume("/missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> inventoryService.lookup("/missing"))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("/missing");
    }

    @Test
    void audit_reconcilesSnapshotWithConfiguredCleaningPrefix() {
        SlotStatus snapshot = new SlotStatus(Map.of());
        AuditReport report = new AuditReport(0, 0, 0, 0, List.of());
        when(changer.status()).thenReturn(snapshot);
        when(bookkeeper.reconcile(snapshot, "CLN")).thenReturn(report);

        assertThat(inventoryService.audit(changer)).isSameAs(report);
    }

    @Test
    void reset_whenNotAllowed_throwsAndDeletesNothing() {
        assertThatThrownBy(() -> inventoryService.reset())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("allow-reset");
        verify(volumeRepository, never()).deleteAllInBatch();
        verify(pathEntryRepository, never()).deleteAllInBatch();
    }

    @Test
    void reset_whenAllowed_deletesPathsThenVolumes() {
        service(true).reset();

        verify(pathEntryRepository).deleteAllInBatch();
        verify(volumeRepository).deleteAllInBatch();
    }

    private InventoryService service(boolean allowReset) {
        var properties = new InventoryProperties("localhost", "tapelib", "tapelib", "", "CLN", allowReset, false);
        return new InventoryService(volumeRepository, pathEntryRepository, bookkeeper, properties);
    }
}
