package com.tapelibrary.inventory.service;

import com.tapelibrary.inventory.changer.Slot;
import com.tapelibrary.inventory.changer.SlotStatus;
import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.MoveKind;
import com.tapelibrary.inventory.domain.VolumeCategory;
import com.tapelibrary.inventory.domain.VolumeFlag;
import com.tapelibrary.inventory.domain.VolumeFlags;
import com.tapelibrary.inventory.dto.response.AuditReport;
import com.tapelibrary.inventory.entity.Volume;
import com.tapelibrary.inventory.exception.InvalidTransitionException;
import com.tapelibrary.inventory.exception.ResourceNotFoundException;
import com.tapelibrary.inventory.repository.VolumeRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Database side of volume moves and audits. Each public method is one short transaction.
 *
 * <p>Lives in its own bean so that {@link InventoryService} calls go through the
 * transactional proxy: {@link #prepare} must have committed before the changer is driven,
 * and {@link #complete} must start a fresh transaction afterwards.
 */
@Component
@RequiredArgsConstructor
public class VolumeBookkeeper {

    private static final Logger log = LoggerFactory.getLogger(VolumeBookkeeper.class);

    private final VolumeRepository volumeRepository;

    /**
     * Locks the volume row, validates the move and records the intent.
     *
     * <p>On return the volume has no location and carries {@link VolumeFlag#TRANSFERING}.
     * A load additionally marks it mounted and remembers the source as its home; an unload
     * clears the mounted flag and, when {@code destination} is {@code null}, goes home.
     *
     * @throws ResourceNotFoundException   if the serial is unknown
     * @throws InvalidTransitionException  if the move does not fit the volume's state
     */
    @Transactional
    public PendingMove prepare(MoveKind kind, String serial, Location destination) {
        String op = "inventory." + kind.verb();

        Volume volume = volumeRepository.findBySerialForUpdate(serial)
            .orElseThrow(() -> new ResourceNotFoundException(op, "Volume", serial));

        if (volume.isInTransit()) {
            throw new InvalidTransitionException(op, serial, "a move is already in progress");
        }
        Location source = volume.getLocation()
            .orElseThrow(() -> new InvalidTransitionException(op, serial, "current location is unknown"));

        Location target = destination;
        if (target == null && kind == MoveKind.UNLOAD) {
            target = volume.getHome()
                .orElseThrow(() -> new InvalidTransitionException(op, serial,
                    "no destination given and no home location recorded"));
        }
        if (target == null) {
            throw new InvalidTransitionException(op, serial, "a destination is required");
        }

        if (!kind.allowsSource(source.category())) {
            throw new InvalidTransitionException(op, serial,
                "invalid source slot " + source + " for " + kind.verb() + " operation");
        }
        if (!kind.allowsDestination(target.category())) {
            throw new InvalidTransitionException(op, serial,
                "invalid destination slot " + target + " for " + kind.verb() + " operation");
        }
        Location requested = target;
        Optional<Volume> occupant = volumeRepository.findByLocation(requested.addr(), requested.category());
        if (occupant.isPresent()) {
            throw new InvalidTransitionException(op, serial,
                "destination " + requested + " is occupied by " + occupant.get().getSerial());
        }

        VolumeFlags flags = volume.getFlags().with(VolumeFlag.TRANSFERING);
        switch (kind) {
            case LOAD -> {
                flags = flags.with(VolumeFlag.MOUNTED);
                volume.setHome(source);
            }
            case UNLOAD -> flags = flags.without(VolumeFlag.MOUNTED);
        }
        volume.setFlags(flags);
        volume.clearLocation();
        volumeRepository.save(volume);

        log.debug("{}: {} in transit {} -> {}", op, serial, source, target);
        return new PendingMove(kind, serial, source, target);
    }

    /**
     * Records a move the changer has carried out. Clears {@link VolumeFlag#TRANSFERING} on
     * every path. A load promotes an allocating volume to allocated; an unload forgets the
     * home location.
     *
     * @throws IllegalStateException if the row is no longer marked as in transit, e.g.
     *                               because an audit reconciled it in the meantime
     */
    @Transactional
    public Volume complete(PendingMove move) {
        String op = move.operation();

        Volume volume = volumeRepository.findBySerialForUpdate(move.serial())
            .orElseThrow(() -> new ResourceNotFoundException(op, "Volume", move.serial()));

        if (!volume.isInTransit() || volume.getLocation().isPresent()) {
            throw new IllegalStateException("Volume " + move.serial() + " is no longer in transit: " + volume);
        }

        volume.setFlags(volume.getFlags().without(VolumeFlag.TRANSFERING));
        volume.setLocation(move.destination());

        switch (move.kind()) {
            case LOAD -> {
                if (volume.getCategory() == VolumeCategory.ALLOCATING) {
                    volume.transitionTo(VolumeCategory.ALLOCATED, op);
                }
            }
            case UNLOAD -> volume.clearHome();
        }

        return volumeRepository.save(volume);
    }

    /**
     * Brings the inventory in line with a changer snapshot.
     *
     * <p>Every occupied slot is upserted by serial. Unknown serials are registered as
     * cleaning or scratch media; known ones get their location corrected, the in-transit
     * marker cleared and the mounted flag set only in transfer slots. Category, home and
     * the remaining flags are kept. A volume recorded at a slot now holding another
     * cartridge loses its location and is reported as displaced unless the snapshot shows
     * it elsewhere. Rows that already match are not written.
     */
    @Transactional
    public AuditReport reconcile(SlotStatus snapshot, String cleaningPrefix) {
        int registered = 0;
        int relocated = 0;
        int unchanged = 0;
        Set<String> seen = new HashSet<>();
        List<String> evicted = new ArrayList<>();

        for (Slot slot : snapshot.occupied()) {
            Location location = slot.location();
            String serial = slot.serial();
            seen.add(serial);

            volumeRepository.findByLocation(location.addr(), location.category())
                .filter(other -> !other.getSerial().equals(serial))
                .ifPresent(other -> {
                    log.warn("audit: {} recorded at {} but the changer reports {} there", other.getSerial(), location, serial);
                    other.clearLocation();
                    other.setFlags(other.getFlags().without(VolumeFlag.MOUNTED));
                    volumeRepository.saveAndFlush(other);
                    evicted.add(other.getSerial());
                });

            Optional<Volume> existing = volumeRepository.findBySerialForUpdate(serial);
            if (existing.isEmpty()) {
                VolumeCategory category = serial.startsWith(cleaningPrefix)
                    ? VolumeCategory.CLEANING
                    : VolumeCategory.SCRATCH;
                Volume volume = new Volume(serial, category);
                volume.setLocation(location);
                volume.setFlags(VolumeFlags.none().with(VolumeFlag.MOUNTED, location.isTransfer()));
                volumeRepository.saveAndFlush(volume);
                log.info("audit: registered {} as {} at {}", serial, category, location);
                registered++;
                continue;
            }

            Volume volume = existing.get();
            VolumeFlags flags = volume.getFlags()
                .without(VolumeFlag.TRANSFERING)
                .with(VolumeFlag.MOUNTED, location.isTransfer());
            if (volume.getLocation().filter(location::equals).isPresent() && flags.equals(volume.getFlags())) {
                unchanged++;
                continue;
            }
            log.info("audit: {} corrected from {} to {} ({})", serial,
                volume.getLocation().map(Location::toString).orElse("none"), location, flags);
            volume.setLocation(location);
            volume.setFlags(flags);
            volumeRepository.saveAndFlush(volume);
            relocated++;
        }

        List<String> displaced = evicted.stream()
            .filter(serial -> !seen.contains(serial))
            .distinct()
            .sorted()
            .toList();
        return new AuditReport(seen.size(), registered, relocated, unchanged, displaced);
    }
}
