/*
 * どこで: Email 配信 API
 * 何を: 配信要求の受付、単票照会、ページング付き一覧を提供する
 * なぜ: 非同期配信の入口と状態確認の窓口を HTTP で公開するため
 */
package com.example.email.api;

import com.example.email.model.NotificationPage;
import com.example.email.model.NotificationRecord;
import com.example.email.service.NotificationQueryService;
import com.example.email.service.NotificationSubmissionService;
import com.example.email.service.SubmissionResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationSubmissionService submissionService;
  private final NotificationQueryService queryService;

  @PostMapping
  public ResponseEntity<ApiResponse<SubmissionView>> submit(
      @Valid @RequestBody NotificationRequest request) {
    final SubmissionResult result = submissionService.submit(request.toPayload());
    final String message =
        result.queued() ? "Notification queued for delivery" : "Notification is being processed";
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(ApiResponse.ok(message, new SubmissionView(result.requestId(), result.status())));
  }

  @GetMapping("/{request_id}")
  public ApiResponse<NotificationView> get(@PathVariable("request_id") String requestId) {
    final NotificationRecord record = queryService.get(requestId);
    return ApiResponse.ok("Notification status retrieved", NotificationView.from(record));
  }

  @GetMapping
  public ApiResponse<List<NotificationView>> list(
      @RequestParam(name = "user_id", required = false) String userId,
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "page", required = false) Integer page) {
    final NotificationPage result = queryService.list(userId, status, limit, page);
    final List<NotificationView> items =
        result.records().stream().map(NotificationView::from).toList();
    return ApiResponse.ok("Notifications retrieved", items, result.meta());
  }
}
