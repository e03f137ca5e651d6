package com.aporkolab.messaging.bus;

import java.util.function.Supplier;

/**
 * Picks the {@link MessageBus} for the selected transport.
 * <p>
 * Only the bus of the selected mode is constructed; the broker suppliers of the
 * other modes are never called.
 */
public class MessageBusFactory {

    private final TransportFactory<MessageBus> factory;

    public MessageBusFactory(TransportMode mode,
                             Supplier<? extends MessageBus> localBroker,
                             Supplier<? extends MessageBus> managedCloudBroker) {
        this.factory = TransportFactory.<MessageBus>builder("MessageBus")
                .localBroker(localBroker)
                .managedCloudBroker(managedCloudBroker)
                .disabled(NoOpMessageBus::new)
                .build(mode);
    }

    public MessageBus createMessageBus() {
        return factory.get();
    }

    public TransportMode getTransportMode() {
        return factory.getMode();
    }
}
