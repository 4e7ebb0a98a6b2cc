/*
 * どこで: Notification 管理 API
 * 何を: ユーザーへのエンドポイント割り当て置換リクエスト
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.orchestrator.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserEndpointAssignmentsRequest(
    @NotNull(message = "endpoint_ids is required") List<Long> endpointIds) {

  public UserEndpointAssignmentsRequest {
    endpointIds = endpointIds == null ? null : List.copyOf(endpointIds);
  }
}
