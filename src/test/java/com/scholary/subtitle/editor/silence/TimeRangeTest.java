package com.scholary.subtitle.editor.silence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeRangeTest {

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(() -> new TimeRange(-1.0, 10.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void constructor_shouldRejectEndBeforeStart() {
    assertThatThrownBy(() -> new TimeRange(10.0, 5.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("End time must be >= start time");
  }

  @Test
  void duration_shouldCalculateCorrectly() {
    TimeRange range = new TimeRange(10.0, 25.5);
    assertThat(range.duration()).isEqualTo(15.5);
  }
}
