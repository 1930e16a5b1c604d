package io.b2mash.appintegrations.webhook;

import io.b2mash.appintegrations.appintegration.AppIntegration;
import io.b2mash.appintegrations.appintegration.IntegrationSecretStore;
import io.b2mash.appintegrations.appintegration.Platform;
import io.b2mash.appintegrations.secret.SecretFields;
import io.b2mash.appintegrations.secret.WebhookSecretGenerator;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * First check on every inbound webhook: the secret embedded in the URL path must match the
 * integration's stored webhook secret. Unknown ids, a platform mismatch and a wrong secret are
 * indistinguishable to the caller, and the secret comparison runs in constant time even when the
 * integration does not exist.
 */
@Component
public class WebhookSecretGuard {

  private static final Logger log = LoggerFactory.getLogger(WebhookSecretGuard.class);

  private static final byte[] PLACEHOLDER_SECRET =
      "x".repeat(WebhookSecretGenerator.SECRET_LENGTH).getBytes(StandardCharsets.UTF_8);

  private final IntegrationSecretStore secretStore;

  public WebhookSecretGuard(IntegrationSecretStore secretStore) {
    this.secretStore = secretStore;
  }

  public WebhookValidation validate(
      String platformId, String integrationId, String suppliedSecret) {
    byte[] supplied =
        suppliedSecret == null ? new byte[0] : suppliedSecret.getBytes(StandardCharsets.UTF_8);

    Optional<AppIntegration> found = parseId(integrationId).flatMap(secretStore::findById);
    if (found.isEmpty()) {
      MessageDigest.isEqual(PLACEHOLDER_SECRET, supplied);
      log.debug("Webhook rejected: no integration {}", integrationId);
      return WebhookValidation.rejected();
    }

    var integration = found.get();
    var stored = integration.getSecrets().get(SecretFields.WEBHOOK_SECRET);
    byte[] expected =
        stored.map(s -> s.getBytes(StandardCharsets.UTF_8)).orElse(PLACEHOLDER_SECRET);
    boolean secretMatches = MessageDigest.isEqual(expected, supplied) && stored.isPresent();
    boolean platformMatches =
        Platform.fromId(platformId)
            .map(platform -> platform.id().equals(integration.getPlatformId()))
            .orElse(false);

    if (!secretMatches || !platformMatches) {
      log.debug(
          "Webhook rejected for integration {}: secretMatches={}, platformMatches={}",
          integration.getId(),
          secretMatches,
          platformMatches);
      return WebhookValidation.rejected();
    }
    return WebhookValidation.accepted(integration);
  }

  private static Optional<UUID> parseId(String integrationId) {
    if (integrationId == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(integrationId));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
