package io.crisisintel.coordination.notification;

import io.crisisintel.coordination.common.PageRequests;
import io.crisisintel.coordination.common.PagedResponse;
import io.crisisintel.coordination.security.CallerContext;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

  private final NotificationService notificationService;
  private final PageRequests pageRequests;

  public NotificationController(
      NotificationService notificationService, PageRequests pageRequests) {
    this.notificationService = notificationService;
    this.pageRequests = pageRequests;
  }

  @GetMapping
  public ResponseEntity<PagedResponse<NotificationResponse>> listNotifications(
      CallerContext caller,
      @RequestParam(defaultValue = "false") boolean unreadOnly,
      @RequestParam(required = false) Integer page,
      @RequestParam(name = "page_size", required = false) Integer pageSize) {
    var notifications =
        notificationService.listNotifications(
            caller.userId(), unreadOnly, pageRequests.of(page, pageSize, Sort.unsorted()));
    return ResponseEntity.ok(PagedResponse.from(notifications, NotificationResponse::from));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> getUnreadCount(CallerContext caller) {
    return ResponseEntity.ok(
        new UnreadCountResponse(notificationService.getUnreadCount(caller.userId())));
  }

  @PutMapping("/{id}/read")
  public ResponseEntity<Void> markAsRead(CallerContext caller, @PathVariable UUID id) {
    notificationService.markAsRead(id, caller.userId());
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/read-all")
  public ResponseEntity<Void> markAllAsRead(CallerContext caller) {
    notificationService.markAllAsRead(caller.userId());
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record NotificationResponse(
      UUID id,
      String type,
      String title,
      String body,
      String referenceEntityType,
      UUID referenceEntityId,
      UUID referenceCrisisId,
      boolean isRead,
      Instant createdAt) {

    public static NotificationResponse from(Notification notification) {
      return new NotificationResponse(
          notification.getId(),
          notification.getType(),
          notification.getTitle(),
          notification.getBody(),
          notification.getReferenceEntityType(),
          notification.getReferenceEntityId(),
          notification.getReferenceCrisisId(),
          notification.isRead(),
          notification.getCreatedAt());
    }
  }

  public record UnreadCountResponse(long count) {}
}
