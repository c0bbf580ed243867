package dev.leadtracker.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Where jobs, queries and the recovery log live.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    public enum Backend {
        FILE,
        DATABASE
    }

    @NotNull
    private Backend backend = Backend.DATABASE;

    /** Root directory; per-user files go to {@code <dataDir>/<username>/}. */
    @NotNull
    private Path dataDir = Path.of(System.getProperty("user.home"), ".lead-tracker");

    @NotBlank
    private String username = System.getProperty("user.name", "default");

    /** Legacy flat job file imported into the active backend before a run. */
    private Path importFile;

    public Path userDir() {
        return dataDir.resolve(username);
    }
}
