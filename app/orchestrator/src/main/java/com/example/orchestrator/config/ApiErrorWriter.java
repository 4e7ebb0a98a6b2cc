/*
 * どこで: Orchestrator Web 設定
 * 何を: インターセプタから ApiErrorResponse を直接書き出す
 * なぜ: コントローラ到達前に拒否する応答も API と同じ形式に揃えるため
 */
package com.example.orchestrator.config;

import com.example.orchestrator.api.ApiErrorCode;
import com.example.orchestrator.api.ApiErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ApiErrorWriter {

  private final ObjectMapper objectMapper;

  public ApiErrorWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public void tooManyRequests(HttpServletResponse response, long retryAfterSec, String message)
      throws IOException {
    response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSec));
    write(response, HttpStatus.TOO_MANY_REQUESTS, ApiErrorCode.TOO_MANY_REQUESTS, message);
  }

  public void write(
      HttpServletResponse response, HttpStatus status, ApiErrorCode code, String message)
      throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getOutputStream(), new ApiErrorResponse(code, message));
  }
}
