package com.tapelibrary.inventory.unit.domain;

import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.SlotCategory;
import com.tapelibrary.inventory.exception.InvalidCategoryException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocationTest {

    @Test
    void equality_needsAddressAndCategory() {
        assertThat(Location.storage(1)).isEqualTo(new Location(1, SlotCategory.STORAGE));
        assertThat(Location.storage(1)).isNotEqualTo(Location.transfer(1));
        assertThat(Location.storage(1)).isNotEqualTo(Location.storage(2));
    }

    @Test
    void negativeAddress_isRejected() {
        assertThatThrownBy(() -> Location.storage(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isTransfer_onlyForDrives() {
        assertThat(Location.transfer(0).isTransfer()).isTrue();
        assertThat(Location.importExport(0).isTransfer()).isFalse();
    }

    @Test
    void toString_usesLabels() {
        assertThat(Location.importExport(3)).hasToString("(3, import-export)");
    }

    @Test
    void slotCategory_fromLabel() {
        assertThat(SlotCategory.fromLabel("import-export")).isEqualTo(SlotCategory.IMPORT_EXPORT);
        assertThatThrownBy(() -> SlotCategory.fromLabel("drive"))
            .isInstanceOf(InvalidCategoryException.class)
            .hasMessageContaining("slot category 'drive'");
    }
}
