package io.b2mash.appintegrations.webhook;

import io.b2mash.appintegrations.appintegration.AppIntegration;
import io.b2mash.appintegrations.appintegration.Platform;
import io.b2mash.appintegrations.secret.SecretFields;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Slack request signing (v0): {@code X-Slack-Signature} must equal {@code "v0=" +
 * hex(HMAC-SHA256(signingSecret, "v0:" + timestamp + ":" + body))} and {@code
 * X-Slack-Request-Timestamp} must be within five minutes of now.
 */
@Component
public class SlackSignatureVerifier implements WebhookSignatureVerifier {

  private static final Logger log = LoggerFactory.getLogger(SlackSignatureVerifier.class);

  static final String SIGNATURE_HEADER = "X-Slack-Signature";
  static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";
  private static final String VERSION = "v0";
  private static final Duration MAX_CLOCK_SKEW = Duration.ofMinutes(5);

  private final Clock clock;

  public SlackSignatureVerifier(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Platform platform() {
    return Platform.SLACK;
  }

  @Override
  public boolean verify(AppIntegration integration, HttpHeaders headers, byte[] body) {
    var signingSecret = integration.getSecrets().get(SecretFields.SIGNING_SECRET);
    if (signingSecret.isEmpty()) {
      log.warn("Slack integration {} has no signing secret, rejecting", integration.getId());
      return false;
    }

    String signature = headers.getFirst(SIGNATURE_HEADER);
    String timestamp = headers.getFirst(TIMESTAMP_HEADER);
    if (signature == null || timestamp == null) {
      log.debug("Slack request for integration {} lacks signature headers", integration.getId());
      return false;
    }

    Instant requestTime;
    try {
      requestTime = Instant.ofEpochSecond(Long.parseLong(timestamp.trim()));
    } catch (NumberFormatException | DateTimeException e) {
      log.debug("Malformed Slack timestamp for integration {}", integration.getId());
      return false;
    }
    if (Duration.between(requestTime, clock.instant()).abs().compareTo(MAX_CLOCK_SKEW) > 0) {
      log.debug("Stale Slack request for integration {}", integration.getId());
      return false;
    }

    byte[] prefix = (VERSION + ":" + timestamp.trim() + ":").getBytes(StandardCharsets.UTF_8);
    byte[] payload = body == null ? new byte[0] : body;
    String expected = VERSION + "=" + HmacSha256.hex(signingSecret.get(), prefix, payload);
    return HmacSha256.constantTimeEquals(expected, signature);
  }
}
