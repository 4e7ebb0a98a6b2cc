/*
 * どこで: Notification 内部 API
 * 何を: ポータル本体からの通知イベントを受け付け、非同期にディスパッチする
 * なぜ: 外部チャネルの遅延をイベント発行側のリクエストに波及させないため
 */
package com.example.orchestrator.notification.api;

import com.example.orchestrator.notification.model.DispatchScope;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.service.NotificationDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/v1")
@RequiredArgsConstructor
public class NotificationEventController {

  private final NotificationDispatcher dispatcher;

  @PostMapping("/notification-events")
  public ResponseEntity<NotificationEventAcceptedResponse> accept(
      @Valid @RequestBody NotificationEventRequest request) {
    final NotificationEventType eventType = request.resolveEventType();
    final DispatchScope scope = request.toScope();
    dispatcher.dispatchAsync(eventType, request.toPayload(), scope);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new NotificationEventAcceptedResponse(eventType.key(), scope.kind().name()));
  }
}
