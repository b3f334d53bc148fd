package io.crisisintel.coordination.notification;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientUserId = :userId
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findByRecipientUserId(@Param("userId") UUID userId, Pageable pageable);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.recipientUserId = :userId
        AND n.isRead = false
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findUnreadByRecipientUserId(@Param("userId") UUID userId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.recipientUserId = :userId
        AND n.isRead = false
      """)
  long countUnreadByRecipientUserId(@Param("userId") UUID userId);

  @Modifying
  @Query(
      """
      UPDATE Notification n SET n.isRead = true
      WHERE n.recipientUserId = :userId
        AND n.isRead = false
      """)
  void markAllAsRead(@Param("userId") UUID userId);

  @Query(
      """
      SELECT COUNT(n) > 0 FROM Notification n
      WHERE n.type = :type
        AND n.recipientUserId = :userId
        AND n.referenceCrisisId = :crisisId
      """)
  boolean existsByTypeAndRecipientAndCrisis(
      @Param("type") String type,
      @Param("userId") UUID userId,
      @Param("crisisId") UUID crisisId);
}
