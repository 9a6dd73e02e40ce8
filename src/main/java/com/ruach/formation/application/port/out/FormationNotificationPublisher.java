package com.ruach.formation.application.port.out;

import com.ruach.formation.application.service.FormationNotification;

/**
 * Secondary (outbound) port: delivers "something opened up" notifications
 * to the user-facing channels.
 * <p>
 * Implementations must be idempotent per notification id.
 * </p>
 */
public interface FormationNotificationPublisher {

    /**
     * @param notification notification to deliver
     * @throws RuntimeException if delivery fails; callers treat delivery as
     *                          best-effort
     */
    void publish(FormationNotification notification);
}
