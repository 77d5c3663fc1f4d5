package com.tapelibrary.inventory.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Row of the path index: a logical path and the volume holding its data.
 *
 * <p>{@code volume} is LAZY; lookups fetch it with a JOIN FETCH so the full volume record
 * comes back in one query. The FK uses {@code ON DELETE RESTRICT}, so a volume cannot be
 * removed while paths still point at it.
 */
@Entity
@Table(name = "tree")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode(of = "path", callSuper = false)
public class PathEntry extends BaseEntity {

    @Id
    @Column(name = "path", nullable = false, updatable = false, length = 1024)
    private String path;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "serial", nullable = false, updatable = false)
    private Volume volume;

    public PathEntry(String path, Volume volume) {
        this.path = path;
        this.volume = volume;
    }
}
