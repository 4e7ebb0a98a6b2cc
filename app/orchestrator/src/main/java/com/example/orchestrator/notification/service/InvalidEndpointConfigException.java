/*
 * どこで: Notification サービス層
 * 何を: エンドポイント設定がチャネル種別のスキーマに合わないことを表す
 * なぜ: 保存時点で設定不備を 400 として返すため
 */
package com.example.orchestrator.notification.service;

import java.util.List;

public class InvalidEndpointConfigException extends RuntimeException {

  private final List<String> violations;

  public InvalidEndpointConfigException(List<String> violations) {
    super(String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> violations() {
    return violations;
  }
}
