package tech.yump.securebox.core;

/**
 * Result of a degraded unlock: a session holding only the containers that verified, plus the
 * report of what did not. The next mutating call persists the verified subset only.
 */
public record RecoveredVault(Vault vault, IntegrityReport report) {
}
