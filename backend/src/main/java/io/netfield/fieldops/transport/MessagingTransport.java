package io.netfield.fieldops.transport;

/**
 * Port for the external messaging channel (a WhatsApp gateway in production). The transport owns
 * its own session and connectivity; callers only see per-message outcomes and a connectivity flag.
 * Implementations are injected wherever delivery happens instead of being reached through shared
 * mutable state.
 */
public interface MessagingTransport {

  /** Channel identifier stamped on every envelope (e.g. "whatsapp"). */
  String channelId();

  /**
   * Hands one message to the channel. Implementations report failures through the result rather
   * than by throwing; callers still treat an exception as {@link DeliveryResult#unreachable}.
   */
  DeliveryResult send(String address, String body);

  /** Whether the channel currently reports an open session. Used by the inline fast path only. */
  boolean isConnected();
}
