package io.b2mash.appintegrations.appintegration;

import io.b2mash.appintegrations.exception.InvalidStateException;
import io.b2mash.appintegrations.secret.SecretBundle;
import io.b2mash.appintegrations.secret.SecretFields;
import java.util.List;
import java.util.Map;

/**
 * Fields each platform needs before an integration can be saved. A field counts as present when it
 * is a non-blank configuration value or a stored secret, so legacy clients that still send secrets
 * inside the configuration pass the same check.
 */
public final class PlatformConfigurationRequirements {

  private static final Map<Platform, List<String>> REQUIRED_FIELDS =
      Map.of(
          Platform.SLACK, List.of("signingSecret"),
          Platform.TEAMS, List.of("appId", "appPassword"),
          Platform.OUTLOOK, List.of("clientId", "clientSecret", "tenantId"),
          Platform.WEBHOOK, List.of());

  private static final Map<Platform, List<String>> REQUIRED_SECRET_FIELDS =
      Map.of(
          Platform.SLACK, List.of(SecretFields.SIGNING_SECRET),
          Platform.TEAMS, List.of(SecretFields.APP_PASSWORD),
          Platform.OUTLOOK, List.of(SecretFields.CLIENT_SECRET),
          Platform.WEBHOOK, List.of());

  // Reported by a connection test, in display order.
  private static final Map<Platform, List<String>> REPORTED_FIELDS =
      Map.of(
          Platform.SLACK,
          List.of(
              SecretFields.INCOMING_WEBHOOK_URL,
              SecretFields.SIGNING_SECRET,
              SecretFields.BOT_TOKEN),
          Platform.TEAMS, List.of("appId", SecretFields.APP_PASSWORD),
          Platform.OUTLOOK, List.of("clientId", SecretFields.CLIENT_SECRET, "tenantId"),
          Platform.WEBHOOK, List.of(SecretFields.SECRET));

  private PlatformConfigurationRequirements() {}

  public static List<String> requiredFields(Platform platform) {
    return REQUIRED_FIELDS.get(platform);
  }

  /** The subset of {@link #requiredFields} that is stored encrypted. */
  public static List<String> requiredSecretFields(Platform platform) {
    return REQUIRED_SECRET_FIELDS.get(platform);
  }

  public static List<String> reportedFields(Platform platform) {
    return REPORTED_FIELDS.get(platform);
  }

  public static List<String> missingFields(
      Platform platform, Map<String, Object> configuration, SecretBundle secrets) {
    return requiredFields(platform).stream()
        .filter(field -> !isPresent(field, configuration, secrets))
        .toList();
  }

  /** Throws a 400 listing every required field missing from both maps. */
  public static void validate(
      Platform platform, Map<String, Object> configuration, SecretBundle secrets) {
    var missing = missingFields(platform, configuration, secrets);
    if (!missing.isEmpty()) {
      throw new InvalidStateException(
          "Missing required fields",
          "Platform '" + platform.id() + "' requires: " + String.join(", ", missing));
    }
  }

  public static boolean isPresent(
      String field, Map<String, Object> configuration, SecretBundle secrets) {
    if (secrets != null && secrets.has(field)) {
      return true;
    }
    if (configuration == null) {
      return false;
    }
    Object value = configuration.get(field);
    return value != null && !String.valueOf(value).isBlank();
  }
}
