package io.netfield.fieldops.transport;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("fieldops.transport")
public record TransportProperties(
    @DefaultValue("noop") String provider,
    @DefaultValue("whatsapp") String channel,
    String baseUrl,
    String apiKey,
    @DefaultValue("3s") Duration connectTimeout,
    @DefaultValue("8s") Duration readTimeout,
    @DefaultValue("5s") Duration statusCacheTtl) {}
