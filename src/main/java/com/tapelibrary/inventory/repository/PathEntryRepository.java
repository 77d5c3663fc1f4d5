package com.tapelibrary.inventory.repository;

import com.tapelibrary.inventory.entity.PathEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PathEntryRepository extends JpaRepository<PathEntry, String> {

    @Query("SELECT p FROM PathEntry p JOIN FETCH p.volume WHERE p.path = :path")
    Optional<PathEntry> findByPathWithVolume(@Param("path") String path);
}
