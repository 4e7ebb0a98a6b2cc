/*
 * どこで: Orchestrator API
 * 何を: エラーレスポンスのコード一覧
 * なぜ: クライアントが文言ではなくコードで分岐できるようにするため
 */
package com.example.orchestrator.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  JOB_NOT_FOUND,
  ENDPOINT_NOT_FOUND,
  JOB_ALREADY_RUNNING,
  JOB_HANDLER_MISSING,
  INVALID_SCHEDULE,
  INVALID_ENDPOINT_CONFIG,
  TOO_MANY_REQUESTS,
  INTERNAL_ERROR
}
