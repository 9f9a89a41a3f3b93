package io.netfield.fieldops.transport;

/** Outcome of a single {@link MessagingTransport#send} call. */
public record DeliveryResult(boolean delivered, String providerMessageId, String errorMessage) {

  public static DeliveryResult delivered(String providerMessageId) {
    return new DeliveryResult(true, providerMessageId, null);
  }

  public static DeliveryResult unreachable(String errorMessage) {
    return new DeliveryResult(false, null, errorMessage);
  }
}
