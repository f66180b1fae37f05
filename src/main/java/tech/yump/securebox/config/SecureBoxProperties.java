package tech.yump.securebox.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.securebox.crypto.KeyMaterial;

import java.nio.file.Path;

/**
 * Configuration properties for SecureBox under the 'securebox' prefix.
 */
@ConfigurationProperties(prefix = "securebox")
@Validated
public record SecureBoxProperties(

        @Valid
        @NotNull(message = "Storage configuration (securebox.storage) is required.")
        StorageProperties storage,

        @Valid
        @NotNull(message = "Crypto configuration (securebox.crypto) is required.")
        CryptoProperties crypto,

        @Valid
        @NotNull(message = "Backup configuration (securebox.backup) is required.")
        BackupProperties backup,

        @Valid
        @NotNull(message = "Audit configuration (securebox.audit) is required.")
        AuditProperties audit,

        // external override file imported by application.yml, shown by --print-paths
        String configFile
) {

    /**
     * Location of the local vault file.
     */
    @Validated
    public record StorageProperties(
            @NotBlank(message = "Save folder (securebox.storage.folder) must be provided.")
            String folder,

            @NotBlank(message = "Vault file name (securebox.storage.file-name) must be provided.")
            String fileName
    ) {
        public Path vaultPath() {
            return Path.of(folder).resolve(fileName);
        }

        @AssertTrue(message = "Vault file name (securebox.storage.file-name) must be a plain file name, not a path.")
        public boolean isFileNamePlain() {
            return fileName == null || (!fileName.contains("/") && !fileName.contains("\\"));
        }
    }

    @Validated
    public record CryptoProperties(
            @Min(value = 1000, message = "KDF iterations (securebox.crypto.kdf-iterations) must be at least 1000.")
            @Max(value = KeyMaterial.MAX_ITERATIONS, message = "KDF iterations (securebox.crypto.kdf-iterations) must be at most 10000000.")
            int kdfIterations
    ) {}

    @Validated
    public record BackupProperties(
            boolean autoUpload,

            @NotBlank(message = "Remote backup suffix (securebox.backup.remote-suffix) must be provided.")
            String remoteSuffix
    ) {}

    @Validated
    public record AuditProperties(
            @NotNull(message = "Audit backend (securebox.audit.backend) must be 'slf4j' or 'file'.")
            AuditBackendType backend,

            @Valid
            FileAuditProperties file
    ) {
        public enum AuditBackendType {
            SLF4J, FILE
        }

        public record FileAuditProperties(String path) {
            public static final String PATH_PROPERTY = "securebox.audit.file.path";
        }

        @AssertTrue(message = "Audit file path (securebox.audit.file.path) must be provided when the file audit backend is selected.")
        public boolean isFilePathValid() {
            return backend != AuditBackendType.FILE || (file != null && StringUtils.hasText(file.path()));
        }
    }
}
