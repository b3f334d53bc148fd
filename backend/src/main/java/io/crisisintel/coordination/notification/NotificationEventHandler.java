package io.crisisintel.coordination.notification;

import io.crisisintel.coordination.event.InvitationCreatedEvent;
import io.crisisintel.coordination.event.ParticipationDecidedEvent;
import io.crisisintel.coordination.event.PotentialVictimDetectedEvent;
import io.crisisintel.coordination.event.RequestStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Listens to domain events and stores notifications for the affected users. All handler methods
 * run AFTER_COMMIT in a new transaction, ensuring:
 *
 * <ol>
 *   <li>Notifications are only created for committed domain changes.
 *   <li>Notification failures do not affect the domain transaction.
 * </ol>
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationService notificationService;

  public NotificationEventHandler(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onInvitationCreated(InvitationCreatedEvent event) {
    try {
      notificationService.handleInvitationCreated(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notification for invitation.created event={}", event.entityId(), e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onParticipationDecided(ParticipationDecidedEvent event) {
    try {
      notificationService.handleParticipationDecided(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notification for participation.decided event={}",
          event.entityId(),
          e);
    }
  }

  /** Fires after commit, or immediately when published outside a transaction. */
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onPotentialVictimDetected(PotentialVictimDetectedEvent event) {
    try {
      notificationService.handlePotentialVictimDetected(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notification for victim.detected user={} crisis={}",
          event.entityId(),
          event.crisisId(),
          e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onRequestStatusChanged(RequestStatusChangedEvent event) {
    try {
      notificationService.handleRequestStatusChanged(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for request.status_changed event={}",
          event.entityId(),
          e);
    }
  }
}
