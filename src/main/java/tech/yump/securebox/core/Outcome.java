package tech.yump.securebox.core;

import java.util.Objects;

/**
 * Result of a vault operation: either a value or a typed {@link VaultError}.
 *
 * @param <T> Type of the success value. {@code Void} operations succeed with {@code null}.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

  static <T> Outcome<T> success(T value) {
    return new Success<>(value);
  }

  static Outcome<Void> done() {
    return new Success<>(null);
  }

  static <T> Outcome<T> failure(ErrorKind kind, String message) {
    return new Failure<>(new VaultError(kind, message));
  }

  boolean isSuccess();

  /**
   * @throws IllegalStateException if this is a failure.
   */
  T value();

  /**
   * @throws IllegalStateException if this is a success.
   */
  VaultError error();

  default boolean isFailure() {
    return !isSuccess();
  }

  /**
   * True if this is a failure of the given kind.
   */
  default boolean failedWith(ErrorKind kind) {
    return isFailure() && error().kind() == kind;
  }

  record Success<T>(T value) implements Outcome<T> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public VaultError error() {
      throw new IllegalStateException("Outcome is a success and carries no error.");
    }
  }

  record Failure<T>(VaultError error) implements Outcome<T> {
    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T value() {
      throw new IllegalStateException("Outcome is a failure (" + error.kind() + "): " + error.message());
    }
  }
}
