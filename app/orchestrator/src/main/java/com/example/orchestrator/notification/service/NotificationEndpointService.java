/*
 * どこで: Notification サービス層
 * 何を: エンドポイントの作成/更新/削除とユーザー割り当てを管理する
 * なぜ: 保存前に種別スキーマで設定を検証し、ディスパッチ時の設定不備を防ぐため
 */
package com.example.orchestrator.notification.service;

import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.repository.NotificationEndpointRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationEndpointService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEndpointService.class);

  private final NotificationEndpointRepository endpointRepository;
  private final Clock clock;

  public List<NotificationEndpointRecord> list() {
    return endpointRepository.findAll();
  }

  public NotificationEndpointRecord get(long id) {
    return endpointRepository
        .findById(id)
        .orElseThrow(() -> new NotificationEndpointNotFoundException(id));
  }

  public NotificationEndpointRecord create(NotificationEndpointCommand command) {
    validate(command, command.config());
    final Instant now = clock.instant();
    final NotificationEndpointRecord draft =
        new NotificationEndpointRecord(
            null,
            command.name().trim(),
            command.type(),
            command.enabled(),
            command.global(),
            command.eventMask(),
            command.config(),
            now,
            now);
    final long id = endpointRepository.insert(draft);
    logger.info("notification endpoint created id={} type={}", id, command.type());
    return get(id);
  }

  /**
   * 既存エンドポイントを置き換える。種別が変わらない場合、マスク値のまま返された秘密値は保持する。
   */
  public NotificationEndpointRecord update(long id, NotificationEndpointCommand command) {
    final NotificationEndpointRecord existing = get(id);
    final EndpointConfig config =
        existing.type() == command.type()
            ? existing
                .config()
                .mergeUpdate(command.config(), EndpointConfigSchema.secretKeys(existing.type()))
            : command.config();
    validate(command, config);
    final NotificationEndpointRecord updated =
        new NotificationEndpointRecord(
            id,
            command.name().trim(),
            command.type(),
            command.enabled(),
            command.global(),
            command.eventMask(),
            config,
            existing.createdAt(),
            clock.instant());
    if (endpointRepository.update(updated) == 0) {
      throw new NotificationEndpointNotFoundException(id);
    }
    logger.info("notification endpoint updated id={} type={}", id, command.type());
    return get(id);
  }

  public void delete(long id) {
    if (endpointRepository.delete(id) == 0) {
      throw new NotificationEndpointNotFoundException(id);
    }
    logger.info("notification endpoint deleted id={}", id);
  }

  public List<Long> listAssignments(String userId) {
    requireUserId(userId);
    return endpointRepository.findEndpointIdsForUser(userId);
  }

  /** ユーザーの割り当てを指定集合で置き換える。未知の ID が含まれる場合は何も変更しない。 */
  @Transactional
  public List<Long> replaceAssignments(String userId, Set<Long> endpointIds) {
    requireUserId(userId);
    final Set<Long> ids = endpointIds == null ? Set.of() : new LinkedHashSet<>(endpointIds);
    for (Long endpointId : ids) {
      if (endpointId == null || endpointRepository.findById(endpointId).isEmpty()) {
        throw new NotificationEndpointNotFoundException(endpointId == null ? -1L : endpointId);
      }
    }
    endpointRepository.deleteAssignments(userId);
    endpointRepository.insertAssignments(userId, ids);
    return endpointRepository.findEndpointIdsForUser(userId);
  }

  private void validate(NotificationEndpointCommand command, EndpointConfig config) {
    if (command.name() == null || command.name().isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    if (command.type() == null) {
      throw new IllegalArgumentException("type is required");
    }
    EndpointConfigSchema.validate(command.type(), config);
  }

  private void requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
  }
}
