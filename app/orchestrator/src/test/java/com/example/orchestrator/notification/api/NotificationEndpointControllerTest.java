package com.example.orchestrator.notification.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.orchestrator.api.ApiExceptionHandler;
import com.example.orchestrator.config.AdminRateLimitInterceptor;
import com.example.orchestrator.config.InternalTokenInterceptor;
import com.example.orchestrator.config.WebMvcConfig;
import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationTypeMask;
import com.example.orchestrator.notification.service.InvalidEndpointConfigException;
import com.example.orchestrator.notification.service.NotificationDispatcher;
import com.example.orchestrator.notification.service.NotificationEndpointCommand;
import com.example.orchestrator.notification.service.NotificationEndpointNotFoundException;
import com.example.orchestrator.notification.service.NotificationEndpointService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = NotificationEndpointController.class,
    excludeFilters =
        @ComponentScan.Filter(
            type = FilterType.ASSIGNABLE_TYPE,
            classes = {
              WebMvcConfig.class,
              AdminRateLimitInterceptor.class,
              InternalTokenInterceptor.class
            }))
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationEndpointControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationEndpointService endpointService;
  @MockitoBean private NotificationDispatcher dispatcher;

  @Test
  void listMasksSecrets() throws Exception {
    when(endpointService.list()).thenReturn(List.of(pushover()));

    mockMvc
        .perform(get("/v1/admin/notification-endpoints"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.endpoints[0].type").value("pushover"))
        .andExpect(jsonPath("$.endpoints[0].event_mask").value(1 << 14))
        .andExpect(jsonPath("$.endpoints[0].all_event_types").value(false))
        .andExpect(jsonPath("$.endpoints[0].event_types[0]").value("job_failed"))
        .andExpect(jsonPath("$.endpoints[0].config.userKey").value(EndpointConfig.MASKED_VALUE))
        .andExpect(jsonPath("$.endpoints[0].config.apiToken").value(EndpointConfig.MASKED_VALUE));
  }

  @Test
  void createResolvesEventTypesIntoMask() throws Exception {
    when(endpointService.create(any())).thenReturn(pushover());

    mockMvc
        .perform(
            post("/v1/admin/notification-endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"Phone","type":"pushover","event_types":["job_failed"],
                     "config":{"userKey":"u-1","apiToken":"t-1"}}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(3));

    final ArgumentCaptor<NotificationEndpointCommand> command =
        ArgumentCaptor.forClass(NotificationEndpointCommand.class);
    verify(endpointService).create(command.capture());
    assertThat(command.getValue().type()).isEqualTo(EndpointType.PUSHOVER);
    assertThat(command.getValue().enabled()).isTrue();
    assertThat(command.getValue().global()).isFalse();
    assertThat(command.getValue().eventMask())
        .isEqualTo(NotificationTypeMask.of(NotificationEventType.JOB_FAILED));
  }

  @Test
  void createWithUnknownTypeReturns400() throws Exception {
    mockMvc
        .perform(
            post("/v1/admin/notification-endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"x\",\"type\":\"fax\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void invalidConfigReturnsViolations() throws Exception {
    when(endpointService.create(any()))
        .thenThrow(
            new InvalidEndpointConfigException(
                List.of("userKey is required", "apiToken is required")));

    mockMvc
        .perform(
            post("/v1/admin/notification-endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"x\",\"type\":\"pushover\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ENDPOINT_CONFIG"))
        .andExpect(jsonPath("$.message").value("userKey is required; apiToken is required"));
  }

  @Test
  void unknownEndpointReturns404() throws Exception {
    when(endpointService.update(eq(9L), any()))
        .thenThrow(new NotificationEndpointNotFoundException(9L));

    mockMvc
        .perform(
            put("/v1/admin/notification-endpoints/9")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"x\",\"type\":\"slack\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ENDPOINT_NOT_FOUND"));
  }

  @Test
  void deleteReturns204() throws Exception {
    mockMvc.perform(delete("/v1/admin/notification-endpoints/3")).andExpect(status().isNoContent());

    verify(endpointService).delete(3L);
  }

  @Test
  void sendTestReportsFailureDetails() throws Exception {
    when(dispatcher.sendTest(3L))
        .thenReturn(DeliveryResult.failure(DeliveryError.httpStatus(401, "bad token")));

    mockMvc
        .perform(post("/v1/admin/notification-endpoints/3/test"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.endpoint_id").value(3))
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error_kind").value("HTTP_STATUS"))
        .andExpect(jsonPath("$.http_status").value(401));
  }

  @Test
  void replaceAssignments() throws Exception {
    when(endpointService.replaceAssignments("user-1", Set.of(3L, 4L))).thenReturn(List.of(3L, 4L));

    mockMvc
        .perform(
            put("/v1/admin/users/user-1/notification-endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endpoint_ids\":[3,4]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("user-1"))
        .andExpect(jsonPath("$.endpoint_ids[1]").value(4));
  }

  @Test
  void replaceAssignmentsRequiresIds() throws Exception {
    mockMvc
        .perform(
            put("/v1/admin/users/user-1/notification-endpoints")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());
  }

  private static NotificationEndpointRecord pushover() {
    return new NotificationEndpointRecord(
        3L,
        "Phone",
        EndpointType.PUSHOVER,
        true,
        false,
        NotificationTypeMask.of(NotificationEventType.JOB_FAILED),
        new EndpointConfig(Map.of("userKey", "u-1", "apiToken", "t-1")),
        NOW,
        NOW);
  }
}
