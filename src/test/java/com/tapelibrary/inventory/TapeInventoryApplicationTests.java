package com.tapelibrary.inventory;

import com.tapelibrary.inventory.integration.AbstractIntegrationTest;
import org.junit.jupiter.api.Test;

class TapeInventoryApplicationTests extends AbstractIntegrationTest {

    @Test
    void contextLoads() {
        // Verifies: Spring context starts, Testcontainers PostgreSQL spins up,
        // Flyway runs all migrations, Hibernate validates entity mappings.
    }
}
