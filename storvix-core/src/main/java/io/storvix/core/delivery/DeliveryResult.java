package io.storvix.core.delivery;

public record DeliveryResult(
    boolean delivered,
    String detail
) {
    public DeliveryResult {
        detail = detail == null ? "" : detail;
    }

    public static DeliveryResult delivered(String detail) {
        return new DeliveryResult(true, detail);
    }

    public static DeliveryResult failed(String detail) {
        return new DeliveryResult(false, detail);
    }
}
