package io.storvix.core.delivery;

import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DisabledDeliveryAgent implements DeliveryAgent {
    private static final Logger LOG = LoggerFactory.getLogger(DisabledDeliveryAgent.class);

    private final String reason;

    public DisabledDeliveryAgent(String reason) {
        this.reason = reason == null || reason.isBlank() ? "mail delivery is not configured" : reason;
    }

    @Override
    public CompletableFuture<DeliveryResult> send(MailMessage message) {
        LOG.warn("Dropping mail '{}' to {}: {}", message.subject(), message.to(), reason);
        return CompletableFuture.completedFuture(DeliveryResult.failed(reason));
    }
}
