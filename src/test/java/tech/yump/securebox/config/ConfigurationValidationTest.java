package tech.yump.securebox.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigurationValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TestConfig.class));

    @EnableConfigurationProperties(SecureBoxProperties.class)
    static class TestConfig {}

    private ApplicationContextRunner runnerWithBaseProps() {
        return contextRunner.withPropertyValues(
                "securebox.storage.folder=./test-validation-storage",
                "securebox.storage.file-name=securebox.json",
                "securebox.crypto.kdf-iterations=500000",
                "securebox.backup.auto-upload=false",
                "securebox.backup.remote-suffix=.BAK",
                "securebox.audit.backend=slf4j"
        );
    }

    @Test
    @DisplayName("Config Validation: Should PASS with a complete configuration")
    void validConfiguration_shouldPass() {
        runnerWithBaseProps()
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SecureBoxProperties properties = context.getBean(SecureBoxProperties.class);
                    assertThat(properties.storage().vaultPath())
                            .isEqualTo(Path.of("./test-validation-storage").resolve("securebox.json"));
                    assertThat(properties.crypto().kdfIterations()).isEqualTo(500000);
                    assertThat(properties.backup().remoteSuffix()).isEqualTo(".BAK");
                    assertThat(properties.audit().backend()).isEqualTo(SecureBoxProperties.AuditProperties.AuditBackendType.SLF4J);
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when kdf iterations are below 1000")
    void validateKdfIterations_tooLow_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues("securebox.crypto.kdf-iterations=999")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("must be at least 1000");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the file audit backend has no path")
    void validateAuditFile_pathMissing_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues("securebox.audit.backend=file")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("securebox.audit.file.path");
                });
    }

    @Test
    @DisplayName("Config Validation: Should PASS when the file audit backend has a path")
    void validateAuditFile_pathPresent_shouldPass() {
        runnerWithBaseProps()
                .withPropertyValues(
                        "securebox.audit.backend=file",
                        "securebox.audit.file.path=./logs/audit.log")
                .run(context -> assertThat(context).hasNotFailed());
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the file name is a path")
    void validateFileName_path_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues("securebox.storage.file-name=sub/securebox.json")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("must be a plain file name");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the remote suffix is blank")
    void validateRemoteSuffix_blank_shouldFail() {
        runnerWithBaseProps()
                .withPropertyValues("securebox.backup.remote-suffix=")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
                });
    }
}
