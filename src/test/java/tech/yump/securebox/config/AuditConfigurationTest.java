package tech.yump.securebox.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.securebox.audit.AuditBackend;
import tech.yump.securebox.audit.FileAuditBackend;
import tech.yump.securebox.audit.LogAuditBackend;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Audit Configuration: backend selection")
class AuditConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(AuditConfiguration.class);

    @Test
    @DisplayName("Should default to the SLF4j backend")
    void defaultsToSlf4j() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AuditBackend.class);
            assertThat(context.getBean(AuditBackend.class)).isInstanceOf(LogAuditBackend.class);
        });
    }

    @Test
    @DisplayName("Should use the file backend when selected")
    void fileBackend() {
        contextRunner
                .withPropertyValues("securebox.audit.backend=file", "securebox.audit.file.path=target/audit.log")
                .run(context -> {
                    assertThat(context).hasSingleBean(AuditBackend.class);
                    assertThat(context.getBean(AuditBackend.class)).isInstanceOf(FileAuditBackend.class);
                });
    }
}
