package com.tapelibrary.inventory.entity;

import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.SlotCategory;
import com.tapelibrary.inventory.domain.VolumeCategory;
import com.tapelibrary.inventory.domain.VolumeFlag;
import com.tapelibrary.inventory.domain.VolumeFlags;
import com.tapelibrary.inventory.exception.InvalidTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Objects;
import java.util.Optional;

/**
 * JPA entity for one tape cartridge, keyed by its VOLSER.
 *
 * <p><strong>Location and home</strong> are each stored as an {@code (addr, category)}
 * column pair that is either fully set or fully {@code NULL} (enforced by a CHECK
 * constraint in V1). The raw columns are not exposed; callers see
 * {@code Optional<Location>}. An absent location means the volume is between slots:
 * either a move is in flight ({@link VolumeFlag#TRANSFERING} set) or an audit found
 * another cartridge in the slot it was recorded at.
 *
 * <p><strong>Uniqueness of location</strong> is enforced by {@code idx_volumes_location}.
 * PostgreSQL treats NULLs as distinct, so any number of volumes may be in transit.
 *
 * <p><strong>Locking</strong>: moves take a pessimistic row lock through
 * {@code VolumeRepository.findBySerialForUpdate}. {@link #version} additionally guards
 * unlocked read-modify-write paths such as operator updates.
 *
 * <p>{@code @ToString} is omitted; {@link #toString()} is hand written to use labels.
 */
@Entity
@Table(name = "volumes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "serial", callSuper = false)
public class Volume extends BaseEntity {

    @Id
    @Column(name = "serial", nullable = false, updatable = false, length = 32)
    private String serial;

    @Getter(AccessLevel.NONE)
    @Column(name = "location_addr")
    private Integer locationAddr;

    @Getter(AccessLevel.NONE)
    @Convert(converter = SlotCategoryConverter.class)
    @Column(name = "location_category", length = 20)
    private SlotCategory locationCategory;

    @Getter(AccessLevel.NONE)
    @Column(name = "home_addr")
    private Integer homeAddr;

    @Getter(AccessLevel.NONE)
    @Convert(converter = SlotCategoryConverter.class)
    @Column(name = "home_category", length = 20)
    private SlotCategory homeCategory;

    @Convert(converter = VolumeCategoryConverter.class)
    @Column(name = "category", nullable = false, length = 20)
    private VolumeCategory category;

    @Convert(converter = VolumeFlagsConverter.class)
    @Column(name = "flags", nullable = false)
    private VolumeFlags flags = VolumeFlags.none();

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public Volume(String serial, VolumeCategory category) {
        this.serial = Objects.requireNonNull(serial, "serial");
        this.category = Objects.requireNonNull(category, "category");
    }

    public Optional<Location> getLocation() {
        return locationAddr == null ? Optional.empty() : Optional.of(new Location(locationAddr, locationCategory));
    }

    public void setLocation(Location location) {
        Objects.requireNonNull(location, "location; use clearLocation()");
        this.locationAddr = location.addr();
        this.locationCategory = location.category();
    }

    public void clearLocation() {
        this.locationAddr = null;
        this.locationCategory = null;
    }

    public Optional<Location> getHome() {
        return homeAddr == null ? Optional.empty() : Optional.of(new Location(homeAddr, homeCategory));
    }

    public void setHome(Location home) {
        Objects.requireNonNull(home, "home; use clearHome()");
        this.homeAddr = home.addr();
        this.homeCategory = home.category();
    }

    public void clearHome() {
        this.homeAddr = null;
        this.homeCategory = null;
    }

    public void setFlags(VolumeFlags flags) {
        this.flags = Objects.requireNonNull(flags, "flags");
    }

    public boolean isInTransit() {
        return flags.has(VolumeFlag.TRANSFERING);
    }

    /**
     * Moves the volume to {@code target} if {@link VolumeCategory#canTransitionTo} allows it.
     *
     * @throws InvalidTransitionException otherwise
     */
    public void transitionTo(VolumeCategory target, String operation) {
        if (!category.canTransitionTo(target)) {
            throw new InvalidTransitionException(operation, serial,
                "category " + category + " cannot change to " + target);
        }
        this.category = target;
    }

    @Override
    public String toString() {
        return "[" + serial + " " + category
            + " (loc: " + getLocation().map(Location::toString).orElse("none") + ")"
            + " (home: " + getHome().map(Location::toString).orElse("none") + ")"
            + " (flags: " + flags + ")]";
    }
}
