/*
 * どこで: Notification 管理 API
 * 何を: エンドポイント CRUD、テスト送信、ユーザー割り当ての管理エンドポイントを提供する
 * なぜ: 管理画面から通知チャネルを構成できるようにするため
 */
package com.example.orchestrator.notification.api;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.service.NotificationDispatcher;
import com.example.orchestrator.notification.service.NotificationEndpointService;
import jakarta.validation.Valid;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Validated
public class NotificationEndpointController {

  private final NotificationEndpointService endpointService;
  private final NotificationDispatcher dispatcher;

  @GetMapping("/notification-endpoints")
  public NotificationEndpointsResponse list() {
    return new NotificationEndpointsResponse(
        endpointService.list().stream().map(NotificationEndpointResponse::from).toList());
  }

  @PostMapping("/notification-endpoints")
  public ResponseEntity<NotificationEndpointResponse> create(
      @Valid @RequestBody NotificationEndpointRequest request) {
    final NotificationEndpointRecord created = endpointService.create(request.toCommand());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(NotificationEndpointResponse.from(created));
  }

  @GetMapping("/notification-endpoints/{id}")
  public NotificationEndpointResponse get(@PathVariable("id") long id) {
    return NotificationEndpointResponse.from(endpointService.get(id));
  }

  @PutMapping("/notification-endpoints/{id}")
  public NotificationEndpointResponse update(
      @PathVariable("id") long id, @Valid @RequestBody NotificationEndpointRequest request) {
    return NotificationEndpointResponse.from(endpointService.update(id, request.toCommand()));
  }

  @DeleteMapping("/notification-endpoints/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") long id) {
    endpointService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/notification-endpoints/{id}/test")
  public TestNotificationResponse sendTest(@PathVariable("id") long id) {
    final DeliveryResult result = dispatcher.sendTest(id);
    return TestNotificationResponse.from(id, result);
  }

  @GetMapping("/users/{user_id}/notification-endpoints")
  public UserEndpointAssignmentsResponse listAssignments(@PathVariable("user_id") String userId) {
    return new UserEndpointAssignmentsResponse(userId, endpointService.listAssignments(userId));
  }

  @PutMapping("/users/{user_id}/notification-endpoints")
  public UserEndpointAssignmentsResponse replaceAssignments(
      @PathVariable("user_id") String userId,
      @Valid @RequestBody UserEndpointAssignmentsRequest request) {
    final List<Long> assigned =
        endpointService.replaceAssignments(userId, new LinkedHashSet<>(request.endpointIds()));
    return new UserEndpointAssignmentsResponse(userId, assigned);
  }
}
