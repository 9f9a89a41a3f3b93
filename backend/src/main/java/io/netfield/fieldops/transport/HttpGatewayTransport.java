package io.netfield.fieldops.transport;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Talks to a messaging gateway that owns the WhatsApp session. {@code POST /messages} sends one
 * text; {@code GET /status} reports whether the session is open. The status answer is cached
 * briefly because the inline fast path asks for it on every enqueue.
 */
@Component
@ConditionalOnProperty(name = "fieldops.transport.provider", havingValue = "http")
public class HttpGatewayTransport implements MessagingTransport {

  private static final Logger log = LoggerFactory.getLogger(HttpGatewayTransport.class);
  private static final String STATUS_KEY = "status";

  private final RestClient restClient;
  private final String channel;
  private final Cache<String, Boolean> statusCache;

  public HttpGatewayTransport(TransportProperties properties) {
    this(buildClient(properties), properties);
  }

  HttpGatewayTransport(RestClient restClient, TransportProperties properties) {
    this.restClient = restClient;
    this.channel = properties.channel();
    this.statusCache =
        Caffeine.newBuilder().expireAfterWrite(properties.statusCacheTtl()).maximumSize(1).build();
  }

  private static RestClient buildClient(TransportProperties properties) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException(
          "fieldops.transport.base-url is required when provider is 'http'");
    }
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    var builder = RestClient.builder().baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.defaultHeader("X-Api-Key", properties.apiKey());
    }
    return builder.build();
  }

  @Override
  public String channelId() {
    return channel;
  }

  @Override
  public DeliveryResult send(String address, String body) {
    try {
      GatewayResponse response =
          restClient
              .post()
              .uri("/messages")
              .contentType(MediaType.APPLICATION_JSON)
              .body(Map.of("to", address, "text", body))
              .retrieve()
              .body(GatewayResponse.class);
      if (response == null || !response.delivered()) {
        String reason = response != null ? response.error() : "empty gateway response";
        return DeliveryResult.unreachable(reason);
      }
      return DeliveryResult.delivered(response.messageId());
    } catch (RestClientException e) {
      log.warn("Gateway send to {} failed: {}", address, e.getMessage());
      statusCache.invalidateAll();
      return DeliveryResult.unreachable(e.getMessage());
    }
  }

  @Override
  public boolean isConnected() {
    return statusCache.get(STATUS_KEY, key -> fetchConnected());
  }

  private boolean fetchConnected() {
    try {
      GatewayStatus status = restClient.get().uri("/status").retrieve().body(GatewayStatus.class);
      return status != null && status.connected();
    } catch (RestClientException e) {
      log.debug("Gateway status check failed: {}", e.getMessage());
      return false;
    }
  }

  record GatewayResponse(boolean delivered, String messageId, String error) {}

  record GatewayStatus(boolean connected) {}
}
