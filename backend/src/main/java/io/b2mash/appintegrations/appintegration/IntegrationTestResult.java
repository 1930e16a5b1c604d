package io.b2mash.appintegrations.appintegration;

import io.b2mash.appintegrations.secret.SecretFields;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of checking an integration's stored configuration and secrets. {@code details} reports
 * which fields are present, never their values.
 */
public record IntegrationTestResult(
    boolean success, String platformId, String message, Map<String, Boolean> details) {

  static final String SECRETS_UNAVAILABLE =
      "Secrets unavailable: the stored secrets could not be decrypted with the configured keys";

  static IntegrationTestResult of(AppIntegration integration) {
    var platform = Platform.require(integration.getPlatformId());
    var configuration = integration.getConfiguration();
    var secrets = integration.getSecrets();

    var details = new LinkedHashMap<String, Boolean>();
    for (String field : PlatformConfigurationRequirements.reportedFields(platform)) {
      details.put(
          presenceKey(field),
          PlatformConfigurationRequirements.isPresent(field, configuration, secrets));
    }
    details.put(presenceKey(SecretFields.WEBHOOK_SECRET), secrets.has(SecretFields.WEBHOOK_SECRET));
    details.put("secretsAvailable", !integration.isSecretsUnavailable());
    var view = Collections.unmodifiableMap(details);

    if (integration.isSecretsUnavailable()) {
      return new IntegrationTestResult(false, platform.id(), SECRETS_UNAVAILABLE, view);
    }
    var missing = PlatformConfigurationRequirements.missingFields(platform, configuration, secrets);
    if (!missing.isEmpty()) {
      return new IntegrationTestResult(
          false, platform.id(), "Missing required fields: " + String.join(", ", missing), view);
    }
    String message =
        platform == Platform.WEBHOOK
            ? "Configuration validation passed (no live test available for this platform)"
            : "Configuration for " + platform.id() + " is valid";
    return new IntegrationTestResult(true, platform.id(), message, view);
  }

  private static String presenceKey(String field) {
    return "has" + Character.toUpperCase(field.charAt(0)) + field.substring(1);
  }
}
