package com.aporkolab.messaging.dlq;

/**
 * Alerting hook called for every quarantined message when admin notifications are enabled.
 */
public interface DeadLetterNotifier {

    String name();

    void notify(DeadLetterRecord record);
}
