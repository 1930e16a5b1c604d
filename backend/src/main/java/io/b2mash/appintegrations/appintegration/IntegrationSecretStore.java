package io.b2mash.appintegrations.appintegration;

import io.b2mash.appintegrations.crypto.DecryptionResult;
import io.b2mash.appintegrations.crypto.KeyRing;
import io.b2mash.appintegrations.crypto.SecretCipher;
import io.b2mash.appintegrations.exception.ResourceConflictException;
import io.b2mash.appintegrations.secret.LegacySecretMigrator;
import io.b2mash.appintegrations.secret.MigrationResult;
import io.b2mash.appintegrations.secret.SecretBundle;
import io.b2mash.appintegrations.secret.SecretFields;
import io.b2mash.appintegrations.secret.WebhookSecretGenerator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only path through which integrations are read or written. Every write migrates legacy secret
 * fields out of the configuration map, ensures a webhook secret and re-encrypts the whole bundle
 * under the active key, so the configuration column never holds a secret and records written under
 * a retired key move to the active key on their next update.
 *
 * <p>Reads never fail because of the ciphertext: a blob whose key is gone or whose data does not
 * authenticate is logged, counted and surfaced as an empty secret bundle. Such a blob is never
 * overwritten by a partial write, so restoring the missing key recovers it.
 */
@Service
public class IntegrationSecretStore {

  private static final Logger log = LoggerFactory.getLogger(IntegrationSecretStore.class);

  static final String DECRYPTION_FAILURES_METRIC = "integration.secrets.decryption.failures";

  private final AppIntegrationRepository repository;
  private final KeyRing keyRing;
  private final SecretCipher secretCipher;
  private final LegacySecretMigrator legacySecretMigrator;
  private final WebhookSecretGenerator webhookSecretGenerator;
  private final MeterRegistry meterRegistry;

  public IntegrationSecretStore(
      AppIntegrationRepository repository,
      KeyRing keyRing,
      SecretCipher secretCipher,
      LegacySecretMigrator legacySecretMigrator,
      WebhookSecretGenerator webhookSecretGenerator,
      MeterRegistry meterRegistry) {
    this.repository = repository;
    this.keyRing = keyRing;
    this.secretCipher = secretCipher;
    this.legacySecretMigrator = legacySecretMigrator;
    this.webhookSecretGenerator = webhookSecretGenerator;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Persists a new integration. Secrets given explicitly through {@link AppIntegration#setSecrets}
   * win over secret fields found in the configuration map. A supplied webhook secret is validated;
   * otherwise one is generated.
   */
  @Transactional
  public AppIntegration create(AppIntegration integration) {
    var migration =
        legacySecretMigrator.extract(integration.getPlatformId(), integration.getConfiguration());
    var secrets = migration.secrets().mergedWith(integration.getSecrets());

    var webhookSecret = secrets.get(SecretFields.WEBHOOK_SECRET);
    if (webhookSecret.isPresent()) {
      webhookSecretGenerator.validate(webhookSecret.get());
    } else {
      secrets = secrets.with(SecretFields.WEBHOOK_SECRET, webhookSecretGenerator.generate());
    }

    protect(integration, migration.remainingConfiguration(), secrets);
    var saved = repository.save(integration);
    log.info(
        "Created app integration: id={}, tenant={}, platform={}, keyId={}",
        saved.getId(),
        saved.getTenantId(),
        saved.getPlatformId(),
        keyRing.active().keyId());
    return saved;
  }

  /**
   * Applies {@code secretChanges} over the integration's current secrets and re-encrypts. The
   * existing webhook secret is kept unless {@code secretChanges} carries a new one.
   *
   * <p>When the stored secrets could not be decrypted, a change without secrets saves everything
   * except the blob, which stays as stored. A change with secrets replaces the blob only if it
   * supplies every secret the platform requires; otherwise it is rejected with a 409.
   *
   * @param integration an integration loaded through this store, with any detail or configuration
   *     changes already applied
   */
  @Transactional
  public AppIntegration update(AppIntegration integration, SecretBundle secretChanges) {
    var changes = secretChanges == null ? SecretBundle.empty() : secretChanges;
    changes.get(SecretFields.WEBHOOK_SECRET).ifPresent(webhookSecretGenerator::validate);

    var migration =
        legacySecretMigrator.extract(integration.getPlatformId(), integration.getConfiguration());
    if (integration.isSecretsUnavailable()) {
      return replaceUnreadableSecrets(integration, migration, changes);
    }

    var secrets = integration.getSecrets().mergedWith(migration.secrets()).mergedWith(changes);
    if (!secrets.has(SecretFields.WEBHOOK_SECRET)) {
      secrets = secrets.with(SecretFields.WEBHOOK_SECRET, webhookSecretGenerator.generate());
    }

    protect(integration, migration.remainingConfiguration(), secrets);
    return repository.save(integration);
  }

  /**
   * Replaces the webhook secret with a newly generated one. The old webhook URL stops working.
   * Rejected with a 409 while the stored secrets cannot be decrypted.
   */
  @Transactional
  public AppIntegration rotateWebhookSecret(AppIntegration integration) {
    if (integration.isSecretsUnavailable()) {
      throw secretsUnavailable(integration, "Restore the key before rotating the webhook secret.");
    }
    var secrets =
        integration
            .getSecrets()
            .with(SecretFields.WEBHOOK_SECRET, webhookSecretGenerator.generate());
    protect(integration, integration.getConfiguration(), secrets);
    var saved = repository.save(integration);
    log.info("Rotated webhook secret of integration {}", saved.getId());
    return saved;
  }

  @Transactional(readOnly = true)
  public Optional<AppIntegration> findById(UUID id) {
    return repository.findById(id).map(this::reveal);
  }

  @Transactional(readOnly = true)
  public List<AppIntegration> findAllByTenant(String tenantId) {
    return repository.findByTenantIdOrderByCreatedAtAsc(tenantId).stream()
        .map(this::reveal)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<AppIntegration> findAllByTenantAndPlatform(String tenantId, String platformId) {
    return repository
        .findByTenantIdAndPlatformIdOrderByCreatedAtAsc(tenantId, platformId)
        .stream()
        .map(this::reveal)
        .toList();
  }

  @Transactional
  public void delete(AppIntegration integration) {
    repository.delete(integration);
    log.info("Deleted app integration {}", integration.getId());
  }

  private AppIntegration replaceUnreadableSecrets(
      AppIntegration integration, MigrationResult migration, SecretBundle changes) {
    var incoming = migration.secrets().mergedWith(changes);
    if (incoming.isEmpty()) {
      log.info(
          "Updating integration {} without touching its undecryptable secrets",
          integration.getId());
      return repository.save(integration);
    }

    var platform = Platform.require(integration.getPlatformId());
    var missing =
        PlatformConfigurationRequirements.requiredSecretFields(platform).stream()
            .filter(field -> !incoming.has(field))
            .toList();
    if (!missing.isEmpty()) {
      throw secretsUnavailable(
          integration,
          "Restore the key, or replace the secrets by supplying all of: "
              + String.join(", ", missing));
    }

    var secrets = incoming;
    if (!secrets.has(SecretFields.WEBHOOK_SECRET)) {
      secrets = secrets.with(SecretFields.WEBHOOK_SECRET, webhookSecretGenerator.generate());
    }
    log.warn(
        "Replacing undecryptable secrets of integration {}; fields not supplied are lost{}",
        integration.getId(),
        changes.has(SecretFields.WEBHOOK_SECRET) ? "" : " and its webhook URL changes");
    protect(integration, migration.remainingConfiguration(), secrets);
    return repository.save(integration);
  }

  private static ResourceConflictException secretsUnavailable(
      AppIntegration integration, String remedy) {
    return new ResourceConflictException(
        "Secrets unavailable",
        "The stored secrets of integration "
            + integration.getId()
            + " cannot be decrypted with the configured keys. "
            + remedy);
  }

  private void protect(
      AppIntegration integration, Map<String, Object> configuration, SecretBundle secrets) {
    var blob = secretCipher.encrypt(secrets, keyRing.active());
    integration.applyProtectedState(configuration, secrets, blob.serialize());
  }

  private AppIntegration reveal(AppIntegration integration) {
    if (integration.getSecretsEncrypted() == null) {
      integration.setSecrets(SecretBundle.empty());
      return integration;
    }
    DecryptionResult result = secretCipher.decrypt(integration.getSecretsEncrypted(), keyRing);
    if (result.isSuccess()) {
      integration.setSecrets(result.bundleOrEmpty());
      return integration;
    }
    log.warn(
        "Secrets of integration {} could not be decrypted: reason={}, keyId={}",
        integration.getId(),
        result.failure(),
        result.keyId());
    Counter.builder(DECRYPTION_FAILURES_METRIC)
        .description("Integration secret blobs that could not be decrypted on load")
        .tag("reason", result.failure().name())
        .register(meterRegistry)
        .increment();
    integration.markSecretsUnavailable();
    return integration;
  }
}
