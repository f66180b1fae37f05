package tech.yump.securebox.core;

import java.util.Objects;

public record VaultError(ErrorKind kind, String message) {

  public VaultError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }
}
