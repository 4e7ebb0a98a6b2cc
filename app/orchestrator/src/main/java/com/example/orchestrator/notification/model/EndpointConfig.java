/*
 * どこで: Notification ドメインモデル
 * 何を: エンドポイント種別ごとの設定値 (config JSONB) を読み取り専用で保持する
 * なぜ: アダプタが Map の型変換を個別に書かずに済むようにするため
 */
package com.example.orchestrator.notification.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record EndpointConfig(Map<String, Object> values) {

  public static final String MASKED_VALUE = "********";

  public EndpointConfig {
    values =
        values == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static EndpointConfig empty() {
    return new EndpointConfig(Map.of());
  }

  public Optional<String> text(String key) {
    final Object value = values.get(key);
    if (value == null) {
      return Optional.empty();
    }
    final String text = String.valueOf(value).trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  public String requireText(String key) {
    return text(key).orElseThrow(() -> new MissingConfigValueException(key));
  }

  public Optional<Integer> integer(String key) {
    final Object value = values.get(key);
    if (value instanceof Number number) {
      return Optional.of(number.intValue());
    }
    return text(key).map(Integer::valueOf);
  }

  public int integer(String key, int defaultValue) {
    return integer(key).orElse(defaultValue);
  }

  public boolean flag(String key) {
    final Object value = values.get(key);
    if (value instanceof Boolean bool) {
      return bool;
    }
    return text(key).map(Boolean::parseBoolean).orElse(false);
  }

  /** 秘密値を伏せたコピーを返す。値が空のキーはそのまま残す。 */
  public EndpointConfig masked(Set<String> secretKeys) {
    final Map<String, Object> copy = new LinkedHashMap<>(values);
    for (String key : secretKeys) {
      if (text(key).isPresent()) {
        copy.put(key, MASKED_VALUE);
      }
    }
    return new EndpointConfig(copy);
  }

  /**
   * 更新要求の値をマージする。マスク値のまま送り返された秘密値は既存値を維持する。
   */
  public EndpointConfig mergeUpdate(EndpointConfig update, Set<String> secretKeys) {
    final Map<String, Object> merged = new LinkedHashMap<>(update.values());
    for (String key : secretKeys) {
      if (MASKED_VALUE.equals(merged.get(key)) && values.containsKey(key)) {
        merged.put(key, values.get(key));
      }
    }
    return new EndpointConfig(merged);
  }

  /** 送信時に必須キーが欠けていたことを表す。 */
  public static class MissingConfigValueException extends IllegalStateException {

    public MissingConfigValueException(String key) {
      super(key + " is not configured");
    }
  }
}
