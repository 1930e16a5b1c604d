package io.b2mash.appintegrations.appintegration;

import io.b2mash.appintegrations.secret.MaskedSecretBundle;
import io.b2mash.appintegrations.secret.SecretFields;
import io.b2mash.appintegrations.secret.SecretMasker;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/** API view of an integration. Secrets are always masked; the ciphertext is never exposed. */
public record AppIntegrationResponse(
    UUID id,
    String tenantId,
    String platformId,
    String name,
    String description,
    boolean enabled,
    Map<String, Object> configuration,
    MaskedSecretBundle secrets,
    String webhookUrl,
    Instant createdAt,
    Instant updatedAt) {

  private static final List<String> SENSITIVE_KEY_PARTS =
      List.of("token", "secret", "password", "key", "webhook");

  /** Path segment prefix of inbound webhook URLs. */
  public static final String WEBHOOK_PATH_PREFIX = "/webhooks/";

  /** Response with the webhook secret masked inside {@code webhookUrl}. */
  public static AppIntegrationResponse from(AppIntegration entity) {
    return from(entity, false);
  }

  /**
   * Maps an integration to its response.
   *
   * @param revealWebhookSecret whether {@code webhookUrl} carries the full webhook secret, for
   *     create and rotate responses only
   */
  public static AppIntegrationResponse from(AppIntegration entity, boolean revealWebhookSecret) {
    return new AppIntegrationResponse(
        entity.getId(),
        entity.getTenantId(),
        entity.getPlatformId(),
        entity.getName(),
        entity.getDescription(),
        entity.isEnabled(),
        maskSensitiveConfiguration(entity.getConfiguration()),
        SecretMasker.mask(entity.getSecrets()),
        webhookUrl(entity, revealWebhookSecret),
        entity.getCreatedAt(),
        entity.getUpdatedAt());
  }

  private static String webhookUrl(AppIntegration entity, boolean revealWebhookSecret) {
    return entity
        .getSecrets()
        .get(SecretFields.WEBHOOK_SECRET)
        .map(secret -> revealWebhookSecret ? secret : SecretMasker.maskValue(secret))
        .map(
            secret ->
                WEBHOOK_PATH_PREFIX + entity.getPlatformId() + "/" + entity.getId() + "/" + secret)
        .orElse(null);
  }

  // Unknown configuration keys that look like credentials are masked as well.
  private static Map<String, Object> maskSensitiveConfiguration(Map<String, Object> configuration) {
    var masked = new LinkedHashMap<String, Object>();
    configuration.forEach(
        (key, value) -> {
          String lower = key.toLowerCase(Locale.ROOT);
          boolean sensitive =
              value != null && SENSITIVE_KEY_PARTS.stream().anyMatch(lower::contains);
          masked.put(key, sensitive ? SecretMasker.maskValue(String.valueOf(value)) : value);
        });
    return masked;
  }
}
