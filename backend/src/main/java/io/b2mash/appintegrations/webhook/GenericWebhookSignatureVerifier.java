package io.b2mash.appintegrations.webhook;

import io.b2mash.appintegrations.appintegration.AppIntegration;
import io.b2mash.appintegrations.appintegration.Platform;
import io.b2mash.appintegrations.secret.SecretFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Generic webhooks are signed only when the integration stores a {@code secret}; the header is then
 * {@code X-Webhook-Signature: sha256=<hex HMAC-SHA256 of the body>}. Without a stored secret the
 * path secret already checked by the guard is the only authentication.
 */
@Component
public class GenericWebhookSignatureVerifier implements WebhookSignatureVerifier {

  private static final Logger log = LoggerFactory.getLogger(GenericWebhookSignatureVerifier.class);

  static final String SIGNATURE_HEADER = "X-Webhook-Signature";
  private static final String SIGNATURE_PREFIX = "sha256=";

  @Override
  public Platform platform() {
    return Platform.WEBHOOK;
  }

  @Override
  public boolean verify(AppIntegration integration, HttpHeaders headers, byte[] body) {
    var secret = integration.getSecrets().get(SecretFields.SECRET);
    if (secret.isEmpty()) {
      return true;
    }
    String signature = headers.getFirst(SIGNATURE_HEADER);
    if (signature == null) {
      log.debug("Signed webhook integration {} received an unsigned request", integration.getId());
      return false;
    }
    String expected =
        SIGNATURE_PREFIX + HmacSha256.hex(secret.get(), body == null ? new byte[0] : body);
    return HmacSha256.constantTimeEquals(expected, signature.trim());
  }
}
