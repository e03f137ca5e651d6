package com.aporkolab.messaging.dlq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: writes the quarantine to the log for log-based alerting.
 */
public class LoggingDeadLetterNotifier implements DeadLetterNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(DeadLetterRecord record) {
        switch (record.getFailureType()) {
            case CRITICAL -> log.error("[DeadLetter] type={}, queue={}, id={}, attempts={}, reason={}",
                    record.getMessageType(), record.getSourceQueue(), record.getMessageId(),
                    record.getAttemptCount(), record.getFailureReason());
            default -> log.warn("[DeadLetter] type={}, queue={}, id={}, attempts={}, failureType={}",
                    record.getMessageType(), record.getSourceQueue(), record.getMessageId(),
                    record.getAttemptCount(), record.getFailureType());
        }
    }
}
