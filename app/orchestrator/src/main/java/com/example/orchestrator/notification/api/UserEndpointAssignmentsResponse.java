/*
 * どこで: Notification 管理 API
 * 何を: ユーザーに割り当て済みのエンドポイント ID 一覧
 * なぜ: user_id と endpoint_ids を明示的に返すため
 */
package com.example.orchestrator.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserEndpointAssignmentsResponse(String userId, List<Long> endpointIds) {

  public UserEndpointAssignmentsResponse {
    endpointIds = endpointIds == null ? List.of() : List.copyOf(endpointIds);
  }
}
