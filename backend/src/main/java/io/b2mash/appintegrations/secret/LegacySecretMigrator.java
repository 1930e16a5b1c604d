package io.b2mash.appintegrations.secret;

import io.b2mash.appintegrations.appintegration.Platform;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Moves secret fields that older clients still send inside the plain configuration map into a
 * {@link SecretBundle}. Runs on every create and update so records in the old shape self-heal.
 * Running it on already-migrated configuration is a no-op.
 */
@Component
public class LegacySecretMigrator {

  /** Legacy field name to bundle field, per platform, in extraction order. */
  private static final Map<Platform, List<FieldMapping>> SECRET_FIELDS =
      Map.of(
          Platform.SLACK,
          List.of(
              FieldMapping.same(SecretFields.SIGNING_SECRET),
              FieldMapping.same(SecretFields.BOT_TOKEN),
              FieldMapping.same(SecretFields.INCOMING_WEBHOOK_URL),
              // misspelling shipped by early Slack clients
              new FieldMapping("incomingWekhookUrl", SecretFields.INCOMING_WEBHOOK_URL)),
          Platform.TEAMS,
          List.of(FieldMapping.same(SecretFields.APP_PASSWORD)),
          Platform.OUTLOOK,
          List.of(FieldMapping.same(SecretFields.CLIENT_SECRET)),
          Platform.WEBHOOK,
          List.of(FieldMapping.same(SecretFields.SECRET)));

  /**
   * Extracts the platform's secret fields from {@code configuration}. Neither input map is mutated.
   *
   * @throws io.b2mash.appintegrations.exception.InvalidStateException for an unsupported platform
   */
  public MigrationResult extract(String platformId, Map<String, Object> configuration) {
    return extract(Platform.require(platformId), configuration);
  }

  public MigrationResult extract(Platform platform, Map<String, Object> configuration) {
    var remaining =
        configuration == null
            ? new LinkedHashMap<String, Object>()
            : new LinkedHashMap<>(configuration);
    var extracted = new LinkedHashMap<String, String>();

    for (var mapping : SECRET_FIELDS.get(platform)) {
      if (!remaining.containsKey(mapping.configKey())) {
        continue;
      }
      Object value = remaining.remove(mapping.configKey());
      if (value != null && !extracted.containsKey(mapping.secretField())) {
        String text = String.valueOf(value);
        if (!text.isBlank()) {
          extracted.put(mapping.secretField(), text);
        }
      }
    }
    return new MigrationResult(
        SecretBundle.of(extracted), Collections.unmodifiableMap(remaining));
  }

  /** Whether {@code configuration} still carries any secret field for the platform. */
  public boolean hasLegacySecrets(Platform platform, Map<String, Object> configuration) {
    if (configuration == null || configuration.isEmpty()) {
      return false;
    }
    return SECRET_FIELDS.get(platform).stream()
        .anyMatch(mapping -> configuration.containsKey(mapping.configKey()));
  }

  private record FieldMapping(String configKey, String secretField) {

    static FieldMapping same(String name) {
      return new FieldMapping(name, name);
    }
  }
}
