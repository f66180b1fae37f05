package tech.yump.securebox.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import tech.yump.securebox.audit.AuditHelper;
import tech.yump.securebox.backup.BackupGatewayFactory;
import tech.yump.securebox.storage.VaultFileStore;

/**
 * Collaborators shared by every {@link Vault} session opened through {@link VaultService}.
 *
 * @param kdfIterations PBKDF2 iterations used for new key material (create, password change, rotation).
 * @param remoteSuffix  Suffix appended to the vault file name for the remote backup object.
 */
record VaultContext(
    VaultCodec codec,
    ContainerCipher containerCipher,
    VaultFileStore store,
    BackupGatewayFactory backupGatewayFactory,
    AuditHelper audit,
    ObjectMapper objectMapper,
    int kdfIterations,
    String remoteSuffix) {
}
