/*
 * どこで: Notification ドメインモデル
 * 何を: dispatch の宛先範囲
 * なぜ: 全体向けイベントとユーザー向けイベントで対象エンドポイントの絞り方が異なるため
 */
package com.example.orchestrator.notification.model;

import java.util.Set;

public record DispatchScope(Kind kind, Set<String> userIds) {

  public enum Kind {
    /** 有効かつマスクが一致する全エンドポイント。 */
    ALL,
    /** 指定ユーザーに割り当てられたエンドポイントのみ。 */
    USERS,
    /** 指定ユーザーの割り当て分と global エンドポイント。 */
    USERS_AND_GLOBAL
  }

  public DispatchScope {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    userIds = userIds == null ? Set.of() : Set.copyOf(userIds);
  }

  public static DispatchScope all() {
    return new DispatchScope(Kind.ALL, Set.of());
  }

  public static DispatchScope users(Set<String> userIds) {
    return new DispatchScope(Kind.USERS, userIds);
  }

  public static DispatchScope usersAndGlobal(Set<String> userIds) {
    return new DispatchScope(Kind.USERS_AND_GLOBAL, userIds);
  }
}
