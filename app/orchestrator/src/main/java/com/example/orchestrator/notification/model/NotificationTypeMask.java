/*
 * どこで: Notification ドメインモデル
 * 何を: エンドポイントが受け取るイベントカテゴリのビットマスク
 * なぜ: 数値リテラルではなく名前付きの操作でマスクを扱うため
 */
package com.example.orchestrator.notification.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 通知カテゴリのビットマスク。
 *
 * <p>ビット 0 は「全カテゴリ」を意味し、新規エンドポイントの既定値になる。個別ビットは
 * {@link NotificationEventType#bit()} の固定位置を使うため、カテゴリ追加で既存値がずれることはない。
 * 未知のビットは保持したまま扱う。
 */
public record NotificationTypeMask(int value) {

  public static final int ALL_CATEGORIES_BIT = 0;
  public static final NotificationTypeMask ALL = new NotificationTypeMask(1 << ALL_CATEGORIES_BIT);
  public static final NotificationTypeMask NONE = new NotificationTypeMask(0);

  public NotificationTypeMask {
    if (value < 0) {
      throw new IllegalArgumentException("event mask must be non-negative");
    }
  }

  public static NotificationTypeMask of(NotificationEventType... types) {
    int value = 0;
    for (NotificationEventType type : types) {
      value |= type.mask();
    }
    return new NotificationTypeMask(value);
  }

  public static NotificationTypeMask ofValue(Integer value) {
    return value == null ? ALL : new NotificationTypeMask(value);
  }

  public boolean allCategories() {
    return (value & (1 << ALL_CATEGORIES_BIT)) != 0;
  }

  public boolean includes(NotificationEventType type) {
    return allCategories() || (value & type.mask()) == type.mask();
  }

  public NotificationTypeMask with(NotificationEventType type) {
    return new NotificationTypeMask(value | type.mask());
  }

  public NotificationTypeMask without(NotificationEventType type) {
    return new NotificationTypeMask(value & ~type.mask());
  }

  /** マスクが明示的に選択しているカテゴリ (ワイルドカードは展開しない)。 */
  public Set<NotificationEventType> selectedTypes() {
    final Set<NotificationEventType> types = EnumSet.noneOf(NotificationEventType.class);
    for (NotificationEventType type : NotificationEventType.values()) {
      if ((value & type.mask()) == type.mask()) {
        types.add(type);
      }
    }
    return types;
  }
}
