package tech.yump.securebox.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuditHelperTest {

    private static final Path VAULT = Path.of("/tmp/securebox.json");

    @Mock
    private AuditBackend mockAuditBackend;

    @InjectMocks
    private AuditHelper auditHelper;

    @Captor
    private ArgumentCaptor<AuditEvent> auditEventCaptor;

    @Test
    @DisplayName("logVaultEvent: Should log event with full context")
    void logVaultEvent_FullContext() {
        // Arrange
        Map<String, Object> data = Map.of("containers", 3);

        // Act
        auditHelper.logVaultEvent("vault", "open", AuditHelper.SUCCESS, VAULT, null, null, null, data);

        // Assert
        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.type()).isEqualTo("vault");
        assertThat(event.action()).isEqualTo("open");
        assertThat(event.outcome()).isEqualTo("success");
        assertThat(event.timestamp()).isNotNull();
        assertThat(event.vault()).isEqualTo(VAULT.toString());
        assertThat(event.containerId()).isNull();
        assertThat(event.data()).isEqualTo(data);
    }

    @Test
    @DisplayName("failure: Should carry the error kind and message")
    void failure_WithError() {
        // Act
        auditHelper.failure("container", "get_container", VAULT, 7, "NOT_FOUND", "No container with id 7.");

        // Assert
        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.outcome()).isEqualTo(AuditHelper.FAILURE);
        assertThat(event.containerId()).isEqualTo(7);
        assertThat(event.errorKind()).isEqualTo("NOT_FOUND");
        assertThat(event.errorMessage()).isEqualTo("No container with id 7.");
    }

    @Test
    @DisplayName("success: Should drop an empty data map and a missing vault path")
    void success_NoOptionalContext() {
        // Act
        auditHelper.success("vault", "lock", null, null);

        // Assert
        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();

        assertThat(event.vault()).isNull();
        assertThat(event.data()).isNull();
        assertThat(event.errorKind()).isNull();
    }

    @Test
    @DisplayName("logVaultEvent: Should not propagate backend failures")
    void logVaultEvent_BackendThrows() {
        // Arrange
        doThrow(new RuntimeException("disk full")).when(mockAuditBackend).logEvent(any());

        // Act & Assert
        assertThatCode(() -> auditHelper.success("vault", "create", VAULT, null)).doesNotThrowAnyException();
    }
}
