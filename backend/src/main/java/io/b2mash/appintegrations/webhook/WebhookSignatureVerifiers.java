package io.b2mash.appintegrations.webhook;

import io.b2mash.appintegrations.appintegration.Platform;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Looks up the signature verifier of a platform, if this service verifies that platform. */
@Component
public class WebhookSignatureVerifiers {

  private final Map<Platform, WebhookSignatureVerifier> verifiers = new EnumMap<>(Platform.class);

  public WebhookSignatureVerifiers(List<WebhookSignatureVerifier> verifiers) {
    for (var verifier : verifiers) {
      if (this.verifiers.putIfAbsent(verifier.platform(), verifier) != null) {
        throw new IllegalStateException(
            "Duplicate webhook signature verifier for platform " + verifier.platform());
      }
    }
  }

  public Optional<WebhookSignatureVerifier> forPlatform(Platform platform) {
    return Optional.ofNullable(verifiers.get(platform));
  }
}
