package com.chauhraj.kdbtick.datatypes;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class TimespanTest {

  @Test
  void convertsToAndFromDuration() {
    Duration d = Duration.ofHours(26).plusNanos(5);
    Timespan t = Timespan.of(d);
    assertThat(t.j).isEqualTo(93_600_000_000_005L);
    assertThat(t.toDuration()).isEqualTo(d);
    assertThat(t).hasToString("1D02:00:00.000000005");
  }

  @Test
  void negativeAndNull() {
    assertThat(Timespan.of(Duration.ofMillis(-1500))).hasToString("-00:00:01.500000000");
    assertThat(Timespan.NULL.isNull()).isTrue();
    assertThat(Timespan.NULL).hasToString("");
    assertThat(new Timespan(1)).isGreaterThan(Timespan.NULL);
  }
}
