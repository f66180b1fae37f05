package tech.yump.securebox.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeTest {

  @Test
  @DisplayName("A success carries its value and refuses error()")
  void success() {
    Outcome<Integer> outcome = Outcome.success(42);

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.isFailure()).isFalse();
    assertThat(outcome.value()).isEqualTo(42);
    assertThat(outcome.failedWith(ErrorKind.NOT_FOUND)).isFalse();
    assertThatThrownBy(outcome::error).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("A failure carries its kind and refuses value()")
  void failure() {
    Outcome<Integer> outcome = Outcome.failure(ErrorKind.NOT_FOUND, "No container with id 9.");

    assertThat(outcome.failedWith(ErrorKind.NOT_FOUND)).isTrue();
    assertThat(outcome.failedWith(ErrorKind.AUTH)).isFalse();
    assertThat(outcome.error().message()).isEqualTo("No container with id 9.");
    assertThatThrownBy(outcome::value)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("NOT_FOUND");
  }

  @Test
  @DisplayName("done() is a success without a value")
  void done() {
    Outcome<Void> outcome = Outcome.done();

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.value()).isNull();
  }
}
