package com.aporkolab.messaging.retry;

import com.aporkolab.messaging.events.IntegrationEvent;

public record PaymentCaptured(String paymentId, long amountCents) implements IntegrationEvent {
}
