package com.tapelibrary.inventory.unit.domain;

import com.tapelibrary.inventory.domain.MoveKind;
import com.tapelibrary.inventory.domain.SlotCategory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MoveKindTest {

    @Test
    void load_fromStorageOrImportExport_intoDrive() {
        assertThat(MoveKind.LOAD.allowsSource(SlotCategory.STORAGE)).isTrue();
        assertThat(MoveKind.LOAD.allowsSource(SlotCategory.IMPORT_EXPORT)).isTrue();
        assertThat(MoveKind.LOAD.allowsSource(SlotCategory.TRANSFER)).isFalse();
        assertThat(MoveKind.LOAD.allowsDestination(SlotCategory.TRANSFER)).isTrue();
        assertThat(MoveKind.LOAD.allowsDestination(SlotCategory.STORAGE)).isFalse();
    }

    @Test
    void unload_fromDrive_only() {
        assertThat(MoveKind.UNLOAD.allowsSource(SlotCategory.TRANSFER)).isTrue();
        assertThat(MoveKind.UNLOAD.allowsSource(SlotCategory.STORAGE)).isFalse();
        assertThat(MoveKind.UNLOAD.allowsDestination(SlotCategory.IMPORT_EXPORT)).isTrue();
        assertThat(MoveKind.UNLOAD.allowsDestination(SlotCategory.TRANSFER)).isFalse();
    }

    @Test
    void transfer_neverTouchesDrivesOrCleaningSlots() {
        assertThat(MoveKind.TRANSFER.allowsSource(SlotCategory.TRANSFER)).isFalse();
        assertThat(MoveKind.TRANSFER.allowsDestination(SlotCategory.TRANSFER)).isFalse();
        assertThat(MoveKind.TRANSFER.allowsDestination(SlotCategory.CLEANING)).isFalse();
        assertThat(MoveKind.TRANSFER.allowsDestination(SlotCategory.IMPORT_EXPORT)).isTrue();
    }
}
