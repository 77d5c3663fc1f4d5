package com.tapelibrary.inventory.integration;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.changer.ChangerException;
import com.tapelibrary.inventory.changer.fake.FakeChanger;
import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.SlotCategory;
import com.tapelibrary.inventory.dto.request.LocationRequest;
import com.tapelibrary.inventory.dto.request.RegisterVolumeRequest;
import com.tapelibrary.inventory.dto.response.AuditReport;
import com.tapelibrary.inventory.dto.response.LocationResponse;
import com.tapelibrary.inventory.dto.response.SlotStatusResponse;
import com.tapelibrary.inventory.dto.response.VolumeResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class AuditIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private FakeChanger changer;

    @BeforeEach
    void setUpChanger() {
        changer = new FakeChanger(Map.of(SlotCategory.STORAGE, 20, SlotCategory.TRANSFER, 2));
    }

    @Test
    void audit_registersUnknownCartridges() {
        changer.place(Location.storage(0), "V00001");
        changer.place(Location.transfer(1), "CLN001");

        AuditReport report = inventoryService.audit(changer);

        assertThat(report.examined()).isEqualTo(2);
        assertThat(report.registered()).isEqualTo(2);
        VolumeResponse data = inventoryService.info("V00001");
        assertThat(data.category()).isEqualTo("scratch");
        assertThat(data.location()).isEqualTo(new LocationResponse(0, "storage"));
        assertThat(data.flags()).isEmpty();
        VolumeResponse cleaning = inventoryService.info("CLN001");
        assertThat(cleaning.category()).isEqualTo("cleaning");
        assertThat(cleaning.flags()).containsExactly("mounted");
    }

    @Test
    void audit_secondRunWritesNothing() {
        changer.place(Location.storage(0), "V00001");
        changer.place(Location.storage(1), "V00002");
        changer.place(Location.transfer(0), "V00003");
        inventoryService.audit(changer);
        Map<String, Object> before = row("V00002");

        AuditReport second = inventoryService.audit(changer);

        assertThat(second.registered()).isZero();
        assertThat(second.relocated()).isZero();
        assertThat(second.unchanged()).isEqualTo(3);
        assertThat(second.changedAnything()).isFalse();
        Map<String, Object> after = row("V00002");
        assertThat(after.get("version")).isEqualTo(before.get("version"));
        assertThat((Timestamp) after.get("updated_at")).isEqualTo((Timestamp) before.get("updated_at"));
    }

    @Test
    void audit_correctsLocationAndMountFlag_keepingHomeAndCategory() {
        register("V00001", 5);
        jdbcTemplate.update("UPDATE volumes SET category = 'filling', flags = 4 WHERE serial = ?", "V00001");
        changer.place(Location.transfer(1), "V00001");

        AuditReport report = inventoryService.audit(changer);

        assertThat(report.relocated()).isEqualTo(1);
        VolumeResponse volume = inventoryService.info("V00001");
        assertThat(volume.location()).isEqualTo(new LocationResponse(1, "transfer"));
        assertThat(volume.category()).isEqualTo("filling");
        assertThat(volume.flags()).containsExactly("mounted", "needs-cleaning");
    }

    @Test
    void audit_staleOccupant_isDisplaced() {
        register("V00001", 3);
        changer.place(Location.storage(3), "V00002");

        AuditReport report = inventoryService.audit(changer);

        assertThat(report.registered()).isEqualTo(1);
        assertThat(report.displaced()).containsExactly("V00001");
        assertThat(inventoryService.info("V00001").location()).isNull();
        assertThat(inventoryService.info("V00002").location()).isEqualTo(new LocationResponse(3, "storage"));
    }

    @Test
    void audit_swappedCartridges_areBothRelocated() {
        register("V00001", 1);
        register("V00002", 2);
        changer.place(Location.storage(1), "V00002");
        changer.place(Location.storage(2), "V00001");

        AuditReport report = inventoryService.audit(changer);

        assertThat(report.relocated()).isEqualTo(2);
        assertThat(report.displaced()).isEmpty();
        assertThat(inventoryService.info("V00001").location()).isEqualTo(new LocationResponse(2, "storage"));
        assertThat(inventoryService.info("V00002").location()).isEqualTo(new LocationResponse(1, "storage"));
    }

    @Test
    void changerFailure_leavesVolumeInTransit_untilAudit() {
        register("V00001", 10);
        Changer broken = mock(Changer.class);
        ChangerException fault = new ChangerException("changer.load", "drive 0: door open");
        doThrow(fault).when(broken).load(any(), any());

        assertThatThrownBy(() -> inventoryService.load("V00001", Location.transfer(0), broken))
            .isSameAs(fault);

        VolumeResponse stuck = inventoryService.info("V00001");
        assertThat(stuck.location()).isNull();
        assertThat(stuck.flags()).containsExactly("transfering", "mounted");
        assertThat(stuck.home()).isEqualTo(new LocationResponse(10, "storage"));

        // The cartridge never left its slot
        changer.place(Location.storage(10), "V00001");
        AuditReport report = inventoryService.audit(changer);

        assertThat(report.relocated()).isEqualTo(1);
        VolumeResponse repaired = inventoryService.info("V00001");
        assertThat(repaired.location()).isEqualTo(new LocationResponse(10, "storage"));
        assertThat(repaired.flags()).isEmpty();
        assertThat(repaired.category()).isEqualTo("scratch");
    }

    @Test
    void auditEndpoint_usesConfiguredChanger() {
        ResponseEntity<AuditReport> audit = restTemplate.postForEntity("/api/v1/library/audit", null, AuditReport.class);
        ResponseEntity<SlotStatusResponse> status =
            restTemplate.getForEntity("/api/v1/library/status", SlotStatusResponse.class);

        assertThat(audit.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(audit.getBody().registered()).isZero();
        assertThat(status.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(status.getBody().slots().get("storage")).hasSize(20);
        assertThat(status.getBody().slots().get("transfer")).hasSize(4);
    }

    private void register(String serial, int storageAddr) {
        inventoryService.register(new RegisterVolumeRequest(serial, new LocationRequest(storageAddr, "storage"), null));
    }

    private Map<String, Object> row(String serial) {
        return jdbcTemplate.queryForMap("SELECT version, updated_at FROM volumes WHERE serial = ?", serial);
    }
}
