/*
 * どこで: Email 配信サービス層
 * 何を: 配信記録の単票照会と、利用者/状態で絞り込んだ一覧取得を行う
 * なぜ: ページサイズの既定値と上限を API 層から切り離して一か所で管理するため
 */
package com.example.email.service;

import com.example.email.model.NotificationPage;
import com.example.email.model.NotificationRecord;
import com.example.email.model.NotificationStatus;
import com.example.email.model.PaginationMeta;
import com.example.email.repository.NotificationRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationQueryService {

  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  private final NotificationRepository repository;

  public NotificationRecord get(String requestId) {
    return repository
        .findByRequestId(requestId)
        .orElseThrow(() -> new NotificationNotFoundException(requestId));
  }

  /**
   * @param limit null は既定値、上限超過は上限へ丸める
   * @param page 1 始まり。null は 1
   * @throws IllegalArgumentException limit/page が 1 未満、または status が未知の場合
   */
  public NotificationPage list(String userId, String status, Integer limit, Integer page) {
    final int effectiveLimit = resolveLimit(limit);
    final int effectivePage = page == null ? 1 : page;
    if (effectivePage < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    final NotificationStatus statusFilter =
        status == null || status.isBlank() ? null : NotificationStatus.fromValue(status);
    final String userFilter = userId == null || userId.isBlank() ? null : userId;

    final long total = repository.count(userFilter, statusFilter);
    final long offset = (long) (effectivePage - 1) * effectiveLimit;
    final List<NotificationRecord> records =
        offset >= total
            ? List.of()
            : repository.findPage(userFilter, statusFilter, effectiveLimit, (int) offset);
    return new NotificationPage(records, PaginationMeta.of(total, effectiveLimit, effectivePage));
  }

  private int resolveLimit(Integer limit) {
    if (limit == null) {
      return DEFAULT_LIMIT;
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1");
    }
    return Math.min(limit, MAX_LIMIT);
  }
}
