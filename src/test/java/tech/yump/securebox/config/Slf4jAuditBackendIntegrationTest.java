package tech.yump.securebox.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import tech.yump.securebox.audit.AuditBackend;
import tech.yump.securebox.audit.AuditHelper;
import tech.yump.securebox.audit.LogAuditBackend;
import tech.yump.securebox.cli.SecureBoxCommandLine;
import tech.yump.securebox.core.VaultService;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context with the default SLF4j audit backend.
 */
@SpringBootTest
@DisplayName("Integration Test: SLF4j Audit Backend (Default)")
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
public class Slf4jAuditBackendIntegrationTest {

    @Autowired
    private AuditBackend auditBackend;
    @Autowired
    private AuditHelper auditHelper;
    @Autowired
    private VaultService vaultService;
    @Autowired
    private SecureBoxProperties properties;
    @Autowired(required = false)
    private SecureBoxCommandLine commandLine;

    @Test
    void shouldUseSlf4jAuditBackendAndLogToConsole(CapturedOutput output) {
        assertThat(auditBackend)
                .withFailMessage("Expected LogAuditBackend bean as the default")
                .isInstanceOf(LogAuditBackend.class);

        String eventId = UUID.randomUUID().toString();
        auditHelper.logVaultEvent("test_slf4j", "log_event", AuditHelper.SUCCESS, Path.of("vault.json"), null, null, null,
                Map.of("id", eventId));

        assertThat(output.getAll())
                .contains("AUDIT_EVENT:")
                .contains("\"type\":\"test_slf4j\"")
                .contains(eventId);
    }

    @Test
    void shouldBindTestProfileAndKeepCommandLineOff() {
        assertThat(properties.crypto().kdfIterations()).isEqualTo(1000);
        assertThat(properties.backup().remoteSuffix()).isEqualTo(".BAK");
        assertThat(commandLine).isNull();
        assertThat(vaultService.exists(Path.of("does-not-exist.json"))).isFalse();
    }
}
