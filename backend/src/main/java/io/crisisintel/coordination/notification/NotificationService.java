package io.crisisintel.coordination.notification;

import io.crisisintel.coordination.event.InvitationCreatedEvent;
import io.crisisintel.coordination.event.ParticipationDecidedEvent;
import io.crisisintel.coordination.event.PotentialVictimDetectedEvent;
import io.crisisintel.coordination.event.RequestStatusChangedEvent;
import io.crisisintel.coordination.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  public static final String INVITATION_RECEIVED = "INVITATION_RECEIVED";
  public static final String PARTICIPATION_DECIDED = "PARTICIPATION_DECIDED";
  public static final String POTENTIAL_VICTIM = "POTENTIAL_VICTIM";
  public static final String REQUEST_STATUS_CHANGED = "REQUEST_STATUS_CHANGED";

  private final NotificationRepository notificationRepository;

  public NotificationService(NotificationRepository notificationRepository) {
    this.notificationRepository = notificationRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification createNotification(
      UUID recipientUserId,
      String type,
      String title,
      String body,
      String refEntityType,
      UUID refEntityId,
      UUID refCrisisId) {
    var notification =
        new Notification(
            recipientUserId, type, title, body, refEntityType, refEntityId, refCrisisId);
    return notificationRepository.save(notification);
  }

  @Transactional(readOnly = true)
  public Page<Notification> listNotifications(UUID userId, boolean unreadOnly, Pageable pageable) {
    if (unreadOnly) {
      return notificationRepository.findUnreadByRecipientUserId(userId, pageable);
    }
    return notificationRepository.findByRecipientUserId(userId, pageable);
  }

  @Transactional(readOnly = true)
  public long getUnreadCount(UUID userId) {
    return notificationRepository.countUnreadByRecipientUserId(userId);
  }

  @Transactional
  public void markAsRead(UUID notificationId, UUID userId) {
    var notification =
        notificationRepository
            .findById(notificationId)
            .filter(n -> n.getRecipientUserId().equals(userId))
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    notification.markAsRead();
  }

  @Transactional
  public void markAllAsRead(UUID userId) {
    notificationRepository.markAllAsRead(userId);
  }

  // --- Fan-out handler methods (called by NotificationEventHandler) ---

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification handleInvitationCreated(InvitationCreatedEvent event) {
    return notificationRepository.save(
        new Notification(
            event.invitedUserId(),
            INVITATION_RECEIVED,
            "You were invited to join \"%s\"".formatted(event.crisisTitle()),
            null,
            "invitation",
            event.entityId(),
            event.crisisId()));
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Notification handleParticipationDecided(ParticipationDecidedEvent event) {
    String outcome = event.approved() ? "approved" : "rejected";
    return notificationRepository.save(
        new Notification(
            event.requesterId(),
            PARTICIPATION_DECIDED,
            "Your participation request was " + outcome,
            null,
            "participation_request",
            event.entityId(),
            event.crisisId()));
  }

  /**
   * Notifies a user found inside a crisis radius. A user is told about the same crisis once, no
   * matter how many location updates place them inside it.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public List<Notification> handlePotentialVictimDetected(PotentialVictimDetectedEvent event) {
    UUID userId = event.entityId();
    if (notificationRepository.existsByTypeAndRecipientAndCrisis(
        POTENTIAL_VICTIM, userId, event.crisisId())) {
      log.debug("User {} already notified about crisis {}", userId, event.crisisId());
      return List.of();
    }
    var notification =
        new Notification(
            userId,
            POTENTIAL_VICTIM,
            "You are inside the affected area of \"%s\"".formatted(event.crisisTitle()),
            String.format(
                Locale.ROOT,
                "Your last known location is %.2f km from the crisis centre. Enroll as a victim"
                    + " if you need help.",
                event.distanceKm()),
            "crisis",
            event.crisisId(),
            event.crisisId());
    return List.of(notificationRepository.save(notification));
  }

  /** Tells every party to the request, other than the actor, about the new status. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public List<Notification> handleRequestStatusChanged(RequestStatusChangedEvent event) {
    Set<UUID> recipients = new LinkedHashSet<>();
    recipients.add(event.requesterId());
    recipients.add(event.counterpartyId());
    recipients.remove(event.actorId());

    String title =
        "%s request is now %s"
            .formatted(capitalize(event.kind()), event.newStatus().toLowerCase(Locale.ROOT));
    var created = new ArrayList<Notification>();
    for (UUID recipient : recipients) {
      created.add(
          notificationRepository.save(
              new Notification(
                  recipient,
                  REQUEST_STATUS_CHANGED,
                  title,
                  null,
                  "request",
                  event.entityId(),
                  event.crisisId())));
    }
    return created;
  }

  private static String capitalize(String value) {
    if (value == null || value.isEmpty()) {
      return "Request";
    }
    return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
  }
}
