package com.example.orchestrator.notification.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NotificationEventTypeTest {

  @Test
  void bitsAreUniqueAndSkipWildcard() {
    final Set<Integer> bits = new HashSet<>();
    for (NotificationEventType type : NotificationEventType.values()) {
      assertThat(type.bit()).isGreaterThan(NotificationTypeMask.ALL_CATEGORIES_BIT);
      assertThat(bits.add(type.bit())).as(type.name()).isTrue();
    }
  }

  @Test
  void fromKeyAcceptsKeyAndEnumName() {
    assertThat(NotificationEventType.fromKey("issue_reported"))
        .contains(NotificationEventType.ISSUE_REPORTED);
    assertThat(NotificationEventType.fromKey(" JOB_FAILED "))
        .contains(NotificationEventType.JOB_FAILED);
  }

  @Test
  void fromKeyMapsLegacyNames() {
    assertThat(NotificationEventType.fromKey("media_available"))
        .contains(NotificationEventType.REQUEST_AVAILABLE);
    assertThat(NotificationEventType.fromKey("request_declined"))
        .contains(NotificationEventType.REQUEST_DENIED);
  }

  @Test
  void fromKeyRejectsUnknownOrBlank() {
    assertThat(NotificationEventType.fromKey("nope")).isEmpty();
    assertThat(NotificationEventType.fromKey(" ")).isEmpty();
    assertThat(NotificationEventType.fromKey(null)).isEmpty();
  }
}
