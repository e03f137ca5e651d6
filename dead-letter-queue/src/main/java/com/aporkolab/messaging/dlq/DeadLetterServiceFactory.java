package com.aporkolab.messaging.dlq;

import java.util.function.Supplier;

import com.aporkolab.messaging.bus.TransportFactory;
import com.aporkolab.messaging.bus.TransportMode;

/**
 * Picks the {@link DeadLetterService} for the selected transport, independently of
 * the message bus factory.
 */
public class DeadLetterServiceFactory {

    private final TransportFactory<DeadLetterService> factory;

    public DeadLetterServiceFactory(TransportMode mode,
                                    Supplier<? extends DeadLetterService> localBroker,
                                    Supplier<? extends DeadLetterService> managedCloudBroker) {
        this.factory = TransportFactory.<DeadLetterService>builder("DeadLetterService")
                .localBroker(localBroker)
                .managedCloudBroker(managedCloudBroker)
                .disabled(NoOpDeadLetterService::new)
                .build(mode);
    }

    public DeadLetterService createDeadLetterService() {
        return factory.get();
    }

    public TransportMode getTransportMode() {
        return factory.getMode();
    }
}
