package io.storvix.core.delivery;

import java.util.concurrent.CompletableFuture;

/**
 * Sends mail without blocking the caller. Implementations complete the future normally with a
 * failed {@link DeliveryResult} instead of completing it exceptionally.
 */
public interface DeliveryAgent {
    CompletableFuture<DeliveryResult> send(MailMessage message);
}
