package tech.yump.securebox.backup;

import org.springframework.lang.Nullable;

/**
 * Builds a short-lived {@link BackupGateway} from the credentials stored in the vault.
 */
public interface BackupGatewayFactory {

  BackupGateway create(CloudCredentials credentials, @Nullable CloudToken token);
}
