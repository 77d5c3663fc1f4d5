package com.tapelibrary.inventory.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the PostgreSQL inventory backend, bound from {@code tapelib.inventory.*}.
 *
 * <p>All five connection keys are required. Binding fails, and the application does not
 * start, before any DataSource is built or connection attempted.
 *
 * @param dbhost         host, optionally with {@code :port}
 * @param dbname         database name
 * @param username       database role
 * @param password       password of {@code username}; may be empty but must be given
 * @param cleaningPrefix VOLSER prefix that identifies cleaning cartridges during audit
 * @param allowReset     whether {@code reset()} may wipe the inventory
 * @param resetOnStartup wipe the inventory once at startup (requires {@code allowReset})
 */
@Validated
@ConfigurationProperties("tapelib.inventory")
public record InventoryProperties(
    @NotBlank(message = "the dbhost option must be specified")
    String dbhost,

    @NotBlank(message = "the dbname option must be specified")
    String dbname,

    @NotBlank(message = "the username option must be specified")
    String username,

    @NotNull(message = "the password option must be specified")
    String password,

    @NotBlank(message = "the cleaning-prefix option must be specified")
    String cleaningPrefix,

    boolean allowReset,

    boolean resetOnStartup
) {

    public String jdbcUrl() {
        return "jdbc:postgresql://" + dbhost + "/" + dbname;
    }
}
