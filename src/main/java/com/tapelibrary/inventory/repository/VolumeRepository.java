package com.tapelibrary.inventory.repository;

import com.tapelibrary.inventory.domain.SlotCategory;
import com.tapelibrary.inventory.domain.VolumeCategory;
import com.tapelibrary.inventory.entity.Volume;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface VolumeRepository extends JpaRepository<Volume, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT v FROM Volume v WHERE v.serial = :serial")
    Optional<Volume> findBySerialForUpdate(@Param("serial") String serial);

    /**
     * Allocation candidates, best first. Category is compared on its stored label, so
     * filling volumes come before scratch volumes; serial breaks ties.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("""
        SELECT v FROM Volume v
        WHERE v.category IN :categories
          AND v.locationCategory = :slotCategory
        ORDER BY v.category, v.serial
        """)
    List<Volume> findAllocationCandidatesForUpdate(
        @Param("categories") Collection<VolumeCategory> categories,
        @Param("slotCategory") SlotCategory slotCategory,
        Pageable pageable
    );

    @Query("SELECT v FROM Volume v WHERE v.locationAddr = :addr AND v.locationCategory = :category")
    Optional<Volume> findByLocation(@Param("addr") int addr, @Param("category") SlotCategory category);
}
