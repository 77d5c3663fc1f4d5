package com.tapelibrary.inventory.service;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.changer.SlotStatus;
import com.tapelibrary.inventory.config.InventoryProperties;
import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.MoveKind;
import com.tapelibrary.inventory.domain.PathName;
import com.tapelibrary.inventory.domain.SlotCategory;
import com.tapelibrary.inventory.domain.VolumeCategory;
import com.tapelibrary.inventory.domain.VolumeFlag;
import com.tapelibrary.inventory.domain.VolumeFlags;
import com.tapelibrary.inventory.dto.request.CreatePathRequest;
import com.tapelibrary.inventory.dto.request.RegisterVolumeRequest;
import com.tapelibrary.inventory.dto.request.UpdateVolumeRequest;
import com.tapelibrary.inventory.dto.response.AuditReport;
import com.tapelibrary.inventory.dto.response.PathResponse;
import com.tapelibrary.inventory.dto.response.SlotStatusResponse;
import com.tapelibrary.inventory.dto.response.VolumeResponse;
import com.tapelibrary.inventory.entity.PathEntry;
import com.tapelibrary.inventory.entity.Volume;
import com.tapelibrary.inventory.exception.AlreadyExistsException;
import com.tapelibrary.inventory.exception.FinalizeFailedException;
import com.tapelibrary.inventory.exception.InvalidTransitionException;
import com.tapelibrary.inventory.exception.ResourceNotFoundException;
import com.tapelibrary.inventory.exception.VolumesExhaustedException;
import com.tapelibrary.inventory.mapper.PathMapper;
import com.tapelibrary.inventory.mapper.SlotStatusMapper;
import com.tapelibrary.inventory.mapper.VolumeMapper;
import com.tapelibrary.inventory.repository.PathEntryRepository;
import com.tapelibrary.inventory.repository.VolumeRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * The inventory engine: owns the volume records and is the only caller of the changer
 * for moves.
 *
 * <p>Moves follow a fixed order. The row is locked and validated and the intent committed
 * ({@link VolumeBookkeeper#prepare}); the changer is driven with no transaction open; the
 * result is recorded in a new transaction ({@link VolumeBookkeeper#complete}). Move and
 * audit methods refuse to run inside a caller's transaction, since that transaction
 * would otherwise stay open for the whole physical move.
 *
 * <p>A changer failure is passed on unchanged and leaves the volume without a location
 * and marked as transfering. A failure to record a completed move is reported as
 * {@link FinalizeFailedException}. Neither is retried or compensated here; both are
 * repaired by {@link #audit}.
 */
@Service
@RequiredArgsConstructor
public class InventoryService {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private static final EnumSet<VolumeCategory> ALLOCATABLE = EnumSet.of(VolumeCategory.FILLING, VolumeCategory.SCRATCH);
    private static final EnumSet<VolumeCategory> REGISTRABLE = EnumSet.of(VolumeCategory.UNKNOWN, VolumeCategory.SCRATCH);

    private final VolumeRepository volumeRepository;
    private final PathEntryRepository pathEntryRepository;
    private final VolumeBookkeeper bookkeeper;
    private final InventoryProperties properties;

    @Transactional(readOnly = true)
    public Page<VolumeResponse> findAll(Pageable pageable) {
        return volumeRepository.findAll(pageable)
            .map(VolumeMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public VolumeResponse info(String serial) {
        Volume volume = volumeRepository.findById(serial)
            .orElseThrow(() -> new ResourceNotFoundException("inventory.info", "Volume", serial));
        return VolumeMapper.toResponse(volume);
    }

    /**
     * Adds a cartridge that entered the library outside of an audit, e.g. during the
     * initial library load.
     */
    @Transactional
    public VolumeResponse register(RegisterVolumeRequest request) {
        final String op = "inventory.register";

        VolumeCategory category = request.category() == null
            ? VolumeCategory.SCRATCH
            : VolumeCategory.fromLabel(request.category());
        if (!REGISTRABLE.contains(category)) {
            throw new InvalidTransitionException(op, request.serial(),
                "new volumes must start as unknown or scratch, not " + category);
        }
        if (volumeRepository.existsById(request.serial())) {
            throw new AlreadyExistsException(op, "Volume", request.serial());
        }

        Location location = VolumeMapper.toLocation(request.location());
        volumeRepository.findByLocation(location.addr(), location.category())
            .ifPresent(other -> {
                throw new AlreadyExistsException(op, "Volume at slot " + location, other.getSerial());
            });

        Volume volume = new Volume(request.serial(), category);
        volume.setLocation(location);
        volume.setFlags(VolumeFlags.none().with(VolumeFlag.MOUNTED, location.isTransfer()));
        Volume saved = volumeRepository.save(volume);
        log.info("{}: {} registered at {} as {}", op, saved.getSerial(), location, category);
        return VolumeMapper.toResponse(saved);
    }

    /**
     * Operator update of category and the user-managed flags. Location, home and the
     * transit/mount flags only change through moves and audits.
     */
    @Transactional
    public VolumeResponse update(String serial, UpdateVolumeRequest request) {
        final String op = "inventory.update";

        Volume volume = volumeRepository.findById(serial)
            .orElseThrow(() -> new ResourceNotFoundException(op, "Volume", serial));

        if (request.category() != null) {
            volume.transitionTo(VolumeCategory.fromLabel(request.category()), op);
        }
        VolumeFlags flags = volume.getFlags();
        if (request.needsCleaning() != null) {
            flags = flags.with(VolumeFlag.NEEDS_CLEANING, request.needsCleaning());
        }
        if (request.formatted() != null) {
            flags = flags.with(VolumeFlag.FORMATTED, request.formatted());
        }
        volume.setFlags(flags);

        return VolumeMapper.toResponse(volumeRepository.save(volume));
    }

    /**
     * Picks the volume the next write should go to: filling volumes before scratch
     * volumes, then by serial, among volumes idle in a storage slot. A scratch winner is
     * marked allocating; a filling winner keeps its category.
     *
     * @throws VolumesExhaustedException if no volume qualifies
     */
    @Transactional
    public String alloc() {
        final String op = "inventory.alloc";

        List<Volume> candidates = volumeRepository.findAllocationCandidatesForUpdate(
            ALLOCATABLE, SlotCategory.STORAGE, PageRequest.of(0, 1));
        if (candidates.isEmpty()) {
            throw new VolumesExhaustedException(op);
        }

        Volume winner = candidates.get(0);
        if (winner.getCategory() != VolumeCategory.FILLING) {
            winner.transitionTo(VolumeCategory.ALLOCATING, op);
            volumeRepository.save(winner);
        }
        log.info("{}: allocated {} ({})", op, winner.getSerial(), winner.getCategory());
        return winner.getSerial();
    }

    @Transactional(propagation = Propagation.NEVER)
    public VolumeResponse load(String serial, Location destination, Changer changer) {
        return move(MoveKind.LOAD, serial, destination, changer);
    }

    /**
     * @param destination target slot, or {@code null} to return the volume to its home slot
     */
    @Transactional(propagation = Propagation.NEVER)
    public VolumeResponse unload(String serial, Location destination, Changer changer) {
        return move(MoveKind.UNLOAD, serial, destination, changer);
    }

    @Transactional(propagation = Propagation.NEVER)
    public VolumeResponse transfer(String serial, Location destination, Changer changer) {
        return move(MoveKind.TRANSFER, serial, destination, changer);
    }

    private VolumeResponse move(MoveKind kind, String serial, Location destination, Changer changer) {
        PendingMove move = bookkeeper.prepare(kind, serial, destination);
        String op = move.operation();

        try {
            switch (kind) {
                case LOAD -> changer.load(move.source(), move.destination());
                case UNLOAD -> changer.unload(move.source(), move.destination());
                case TRANSFER -> changer.transfer(move.source(), move.destination());
            }
        } catch (RuntimeException e) {
            log.error("{}: changer failed moving {} from {} to {}; volume left in transit until audited",
                op, serial, move.source(), move.destination(), e);
            throw e;
        }

        Volume finished;
        try {
            finished = bookkeeper.complete(move);
        } catch (RuntimeException e) {
            log.error("{}: {} reached {} but the inventory was not updated", op, serial, move.destination(), e);
            throw new FinalizeFailedException(op, serial, move.destination(), e);
        }

        log.info("{}: {} moved {} -> {}", op, serial, move.source(), move.destination());
        return VolumeMapper.toResponse(finished);
    }

    /**
     * Reconciles the inventory with what the changer physically reports. The device is
     * queried before any transaction is opened.
     */
    @Transactional(propagation = Propagation.NEVER)
    public AuditReport audit(Changer changer) {
        SlotStatus snapshot = changer.status();
        AuditReport report = bookkeeper.reconcile(snapshot, properties.cleaningPrefix());
        log.info("inventory.audit: {} occupied slots, {} registered, {} corrected, {} unchanged, displaced {}",
            report.examined(), report.registered(), report.relocated(), report.unchanged(), report.displaced());
        return report;
    }

    public SlotStatusResponse status(Changer changer) {
        return SlotStatusMapper.toResponse(changer.status());
    }

    /**
     * Serial of the volume recorded in the given drive, if any. An empty drive is a
     * normal answer, not an error.
     */
    @Transactional(readOnly = true)
    public Optional<String> loaded(Location location) {
        if (!location.isTransfer()) {
            throw new IllegalArgumentException("Only transfer slots hold loaded volumes, got " + location);
        }
        return volumeRepository.findByLocation(location.addr(), location.category())
            .map(Volume::getSerial);
    }

    @Transactional
    public PathResponse create(CreatePathRequest request) {
        final String op = "inventory.create";

        PathName path = PathName.of(request.path());
        if (pathEntryRepository.existsById(path.value())) {
            throw new AlreadyExistsException(op, "Path", path.value());
        }
        Volume volume = volumeRepository.findById(request.serial())
            .orElseThrow(() -> new ResourceNotFoundException(op, "Volume", request.serial()));

        PathEntry saved = pathEntryRepository.save(new PathEntry(path.value(), volume));
        log.debug("{}: {} -> {}", op, saved.getPath(), volume.getSerial());
        return PathMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public PathResponse lookup(String path) {
        PathName name = PathName.of(path);
        PathEntry entry = pathEntryRepository.findByPathWithVolume(name.value())
            .orElseThrow(() -> new ResourceNotFoundException("inventory.lookup", "Path", name.value()));
        return PathMapper.toResponse(entry);
    }

    /**
     * Deletes every path mapping and volume record. For test and bootstrap use only.
     *
     * @throws IllegalStateException unless {@code tapelib.inventory.allow-reset} is set
     */
    @Transactional
    public void reset() {
        if (!properties.allowReset()) {
            throw new IllegalStateException("inventory.reset: disabled; set tapelib.inventory.allow-reset=true");
        }
        pathEntryRepository.deleteAllInBatch();
        volumeRepository.deleteAllInBatch();
        log.warn("inventory.reset: all volumes and path mappings deleted");
    }
}
