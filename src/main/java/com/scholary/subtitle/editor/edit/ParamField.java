package com.scholary.subtitle.editor.edit;

import java.util.Objects;
import java.util.Optional;

/**
 * One extracted parameter with its three possible states: the oracle did not mention it, it
 * explicitly said {@code null}, or it supplied a value.
 *
 * @param <T> the value type
 */
public final class ParamField<T> {

  enum State {
    ABSENT,
    NULL,
    PRESENT
  }

  private final State state;
  private final T value;

  private ParamField(State state, T value) {
    this.state = state;
    this.value = value;
  }

  public static <T> ParamField<T> absent() {
    return new ParamField<>(State.ABSENT, null);
  }

  public static <T> ParamField<T> explicitNull() {
    return new ParamField<>(State.NULL, null);
  }

  public static <T> ParamField<T> of(T value) {
    return new ParamField<>(State.PRESENT, Objects.requireNonNull(value, "value"));
  }

  /** Wrap a nullable value as either present or explicit null. */
  public static <T> ParamField<T> ofNullable(T value) {
    return value == null ? explicitNull() : of(value);
  }

  public boolean isPresent() {
    return state == State.PRESENT;
  }

  /** Present value, or empty when absent or null. */
  public Optional<T> asOptional() {
    return Optional.ofNullable(value);
  }

  public T orElse(T fallback) {
    return isPresent() ? value : fallback;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ParamField<?> other)) {
      return false;
    }
    return state == other.state && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, value);
  }

  @Override
  public String toString() {
    return switch (state) {
      case ABSENT -> "<absent>";
      case NULL -> "null";
      case PRESENT -> String.valueOf(value);
    };
  }
}
