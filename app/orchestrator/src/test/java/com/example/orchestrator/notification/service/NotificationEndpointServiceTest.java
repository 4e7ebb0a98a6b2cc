package com.example.orchestrator.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.model.NotificationTypeMask;
import com.example.orchestrator.notification.repository.NotificationEndpointRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationEndpointServiceTest {

  private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");
  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final String HOOK = "https://hooks.example.com/a";

  @Mock private NotificationEndpointRepository repository;

  private NotificationEndpointService service;

  @BeforeEach
  void setUp() {
    service = new NotificationEndpointService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void createValidatesAndInserts() {
    final NotificationEndpointCommand command =
        new NotificationEndpointCommand(
            " Ops hook ",
            EndpointType.WEBHOOK,
            true,
            true,
            null,
            new EndpointConfig(Map.of("webhookUrl", HOOK)));
    when(repository.insert(any())).thenReturn(5L);
    when(repository.findById(5L)).thenReturn(Optional.of(record(5L, "Bearer x")));

    service.create(command);

    final ArgumentCaptor<NotificationEndpointRecord> inserted =
        ArgumentCaptor.forClass(NotificationEndpointRecord.class);
    verify(repository).insert(inserted.capture());
    assertThat(inserted.getValue().name()).isEqualTo("Ops hook");
    assertThat(inserted.getValue().eventMask()).isEqualTo(NotificationTypeMask.ALL);
    assertThat(inserted.getValue().createdAt()).isEqualTo(NOW);
  }

  @Test
  void createRejectsInvalidConfigWithoutInsert() {
    final NotificationEndpointCommand command =
        new NotificationEndpointCommand(
            "hook", EndpointType.WEBHOOK, true, false, null, EndpointConfig.empty());

    assertThatThrownBy(() -> service.create(command))
        .isInstanceOf(InvalidEndpointConfigException.class)
        .hasMessageContaining("webhookUrl is required");
    verify(repository, never()).insert(any());
  }

  @Test
  void updateKeepsMaskedSecret() {
    when(repository.findById(5L)).thenReturn(Optional.of(record(5L, "Bearer x")));
    when(repository.update(any())).thenReturn(1);
    final NotificationEndpointCommand command =
        new NotificationEndpointCommand(
            "hook",
            EndpointType.WEBHOOK,
            false,
            false,
            null,
            new EndpointConfig(
                Map.of("webhookUrl", HOOK, "authHeader", EndpointConfig.MASKED_VALUE)));

    service.update(5L, command);

    final ArgumentCaptor<NotificationEndpointRecord> updated =
        ArgumentCaptor.forClass(NotificationEndpointRecord.class);
    verify(repository).update(updated.capture());
    assertThat(updated.getValue().config().text("authHeader")).contains("Bearer x");
    assertThat(updated.getValue().createdAt()).isEqualTo(CREATED);
    assertThat(updated.getValue().updatedAt()).isEqualTo(NOW);
    assertThat(updated.getValue().enabled()).isFalse();
  }

  @Test
  void deleteMissingThrowsNotFound() {
    when(repository.delete(9L)).thenReturn(0);

    assertThatThrownBy(() -> service.delete(9L))
        .isInstanceOf(NotificationEndpointNotFoundException.class);
  }

  @Test
  void replaceAssignmentsRejectsUnknownEndpoint() {
    when(repository.findById(5L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.replaceAssignments("user-1", Set.of(5L)))
        .isInstanceOf(NotificationEndpointNotFoundException.class);
    verify(repository, never()).deleteAssignments(anyString());
  }

  @Test
  void replaceAssignmentsSwapsSet() {
    when(repository.findById(5L)).thenReturn(Optional.of(record(5L, "Bearer x")));
    when(repository.findEndpointIdsForUser("user-1")).thenReturn(List.of(5L));

    final List<Long> ids = service.replaceAssignments("user-1", Set.of(5L));

    assertThat(ids).containsExactly(5L);
    verify(repository).deleteAssignments("user-1");
    verify(repository).insertAssignments("user-1", Set.of(5L));
  }

  @Test
  void assignmentsRequireUserId() {
    assertThatThrownBy(() -> service.listAssignments(" "))
        .isInstanceOf(IllegalArgumentException.class);
    verify(repository, never()).insertAssignments(anyString(), anySet());
  }

  private static NotificationEndpointRecord record(long id, String authHeader) {
    return new NotificationEndpointRecord(
        id,
        "hook",
        EndpointType.WEBHOOK,
        true,
        false,
        NotificationTypeMask.ALL,
        new EndpointConfig(Map.of("webhookUrl", HOOK, "authHeader", authHeader)),
        CREATED,
        CREATED);
  }
}
