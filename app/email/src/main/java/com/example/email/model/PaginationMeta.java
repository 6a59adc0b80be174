/*
 * どこで: Email 配信ドメインモデル
 * 何を: 一覧取得のページング情報
 * なぜ: 総件数とページ位置からクライアントが次ページ有無を判断できるようにするため
 */
package com.example.email.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PaginationMeta(
    long total, int limit, int page, long totalPages, boolean hasNext, boolean hasPrevious) {

  public static PaginationMeta of(long total, int limit, int page) {
    if (limit < 1 || page < 1) {
      throw new IllegalArgumentException("limit and page must be positive");
    }
    final long totalPages = (total + limit - 1) / limit;
    return new PaginationMeta(total, limit, page, totalPages, page < totalPages, page > 1);
  }
}
