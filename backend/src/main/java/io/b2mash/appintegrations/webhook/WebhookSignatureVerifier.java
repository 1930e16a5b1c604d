package io.b2mash.appintegrations.webhook;

import io.b2mash.appintegrations.appintegration.AppIntegration;
import io.b2mash.appintegrations.appintegration.Platform;
import org.springframework.http.HttpHeaders;

/**
 * Platform-specific authentication of a webhook request that already passed {@link
 * WebhookSecretGuard}. Implementations fail closed: a missing header or a missing stored secret
 * they depend on yields {@code false}.
 */
public interface WebhookSignatureVerifier {

  Platform platform();

  /**
   * @param body the request body exactly as received, before any form or JSON parsing
   */
  boolean verify(AppIntegration integration, HttpHeaders headers, byte[] body);
}
