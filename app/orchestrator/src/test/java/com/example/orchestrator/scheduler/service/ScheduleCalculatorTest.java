/*
 * どこで: Scheduler 次回実行時刻計算のユニットテスト
 * 何を: 固定間隔/cron 式の計算と不正入力の扱いを検証する
 * なぜ: ジョブが早すぎたり同じ時刻に二重実行されたりしないことを保証するため
 */
package com.example.orchestrator.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.orchestrator.config.SchedulerProperties;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ScheduleCalculatorTest {

  private static final Instant BASE = Instant.parse("2026-03-01T02:00:00Z");

  private final ScheduleCalculator calculator =
      new ScheduleCalculator(new SchedulerProperties(true, null, null, null, 0, false, 0, "UTC"));

  @Test
  void intervalScheduleAddsExactlyIntervalSeconds() {
    assertThat(calculator.computeNextRun(null, 3600, BASE)).isEqualTo(BASE.plusSeconds(3600));
    assertThat(calculator.computeNextRun("", 90, BASE)).isEqualTo(BASE.plusSeconds(90));
    assertThat(calculator.computeNextRun("@interval", 1, BASE)).isEqualTo(BASE.plusSeconds(1));
  }

  @Test
  void intervalScheduleRejectsNonPositiveInterval() {
    assertThatThrownBy(() -> calculator.computeNextRun(null, 0, BASE))
        .isInstanceOf(InvalidScheduleException.class);
    assertThatThrownBy(() -> calculator.computeNextRun("@interval", -5, BASE))
        .isInstanceOf(InvalidScheduleException.class);
  }

  @Test
  void fiveFieldCronReturnsNextMatchingMinute() {
    assertThat(calculator.computeNextRun("0 3 * * *", 0, BASE))
        .isEqualTo(Instant.parse("2026-03-01T03:00:00Z"));
  }

  @Test
  void cronResultIsStrictlyAfterFromEvenWhenFromMatches() {
    final Instant matching = Instant.parse("2026-03-01T03:00:00Z");

    assertThat(calculator.computeNextRun("0 3 * * *", 0, matching))
        .isEqualTo(Instant.parse("2026-03-02T03:00:00Z"));
  }

  @Test
  void sixFieldCronSupportsSeconds() {
    assertThat(calculator.computeNextRun("*/30 * * * * *", 0, BASE))
        .isEqualTo(BASE.plusSeconds(30));
  }

  @Test
  void successiveCronRunsAreStrictlyIncreasing() {
    Instant previous = BASE;
    for (int i = 0; i < 20; i++) {
      final Instant next = calculator.computeNextRun("*/15 * * * *", 0, previous);
      assertThat(next).isAfter(previous);
      previous = next;
    }
    assertThat(previous).isEqualTo(BASE.plusSeconds(20L * 15 * 60));
  }

  @Test
  void cronUsesConfiguredZone() {
    final ScheduleCalculator tokyo =
        new ScheduleCalculator(
            new SchedulerProperties(true, null, null, null, 0, false, 0, "Asia/Tokyo"));

    // 03:00 JST は前日 18:00 UTC
    assertThat(tokyo.computeNextRun("0 3 * * *", 0, BASE))
        .isEqualTo(Instant.parse("2026-03-01T18:00:00Z"));
  }

  @Test
  void invalidCronExpressionsAreRejected() {
    assertThatThrownBy(() -> calculator.computeNextRun("not a cron", 60, BASE))
        .isInstanceOf(InvalidScheduleException.class);
    assertThatThrownBy(() -> calculator.computeNextRun("99 * * * *", 60, BASE))
        .isInstanceOf(InvalidScheduleException.class);
    assertThatThrownBy(() -> calculator.computeNextRun("* * * * * * * *", 60, BASE))
        .isInstanceOf(InvalidScheduleException.class);
  }
}
