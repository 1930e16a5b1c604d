package io.b2mash.appintegrations.appintegration;

import io.b2mash.appintegrations.exception.ResourceConflictException;
import io.b2mash.appintegrations.exception.ResourceNotFoundException;
import io.b2mash.appintegrations.multitenancy.TenantContext;
import io.b2mash.appintegrations.secret.SecretBundle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Tenant-scoped management of app integrations on top of {@link IntegrationSecretStore}. */
@Service
public class AppIntegrationService {

  private static final Logger log = LoggerFactory.getLogger(AppIntegrationService.class);

  private final IntegrationSecretStore secretStore;
  private final AppIntegrationRepository repository;

  public AppIntegrationService(
      IntegrationSecretStore secretStore, AppIntegrationRepository repository) {
    this.secretStore = secretStore;
    this.repository = repository;
  }

  @Transactional(readOnly = true)
  public List<AppIntegrationResponse> listIntegrations(String platformId) {
    String tenantId = TenantContext.requireTenantId();
    var integrations =
        platformId == null || platformId.isBlank()
            ? secretStore.findAllByTenant(tenantId)
            : secretStore.findAllByTenantAndPlatform(tenantId, Platform.require(platformId).id());
    return integrations.stream().map(AppIntegrationResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public AppIntegrationResponse getIntegration(UUID id) {
    return AppIntegrationResponse.from(findOwnedOrThrow(id));
  }

  /**
   * Creates an integration for the current tenant. The response is the only one besides rotation
   * that carries the full webhook URL.
   */
  @Transactional
  public AppIntegrationResponse createIntegration(
      String platformId,
      String name,
      String description,
      Map<String, Object> configuration,
      Map<String, String> secrets,
      Boolean enabled) {
    String tenantId = TenantContext.requireTenantId();
    var platform = Platform.require(platformId);
    var secretBundle = SecretBundle.of(secrets);
    PlatformConfigurationRequirements.validate(platform, configuration, secretBundle);

    if (repository.existsByTenantIdAndName(tenantId, name)) {
      throw new ResourceConflictException(
          "Duplicate integration name", "An integration named '" + name + "' already exists");
    }

    var integration = new AppIntegration(tenantId, platform.id(), name);
    integration.updateDetails(name, description);
    integration.setConfiguration(configuration);
    integration.setSecrets(secretBundle);
    if (Boolean.FALSE.equals(enabled)) {
      integration.disable();
    }

    var saved = secretStore.create(integration);
    return AppIntegrationResponse.from(saved, true);
  }

  /**
   * Partially updates an integration. Configuration keys are merged, a {@code null} value removing
   * the key; secrets are merged field by field.
   */
  @Transactional
  public AppIntegrationResponse updateIntegration(
      UUID id,
      String name,
      String description,
      Map<String, Object> configuration,
      Map<String, String> secrets,
      Boolean enabled) {
    var integration = findOwnedOrThrow(id);

    if (name != null
        && !name.equals(integration.getName())
        && repository.existsByTenantIdAndNameAndIdNot(integration.getTenantId(), name, id)) {
      throw new ResourceConflictException(
          "Duplicate integration name", "An integration named '" + name + "' already exists");
    }
    integration.updateDetails(
        name != null ? name : integration.getName(),
        description != null ? description : integration.getDescription());

    if (configuration != null) {
      var merged = new LinkedHashMap<>(integration.getConfiguration());
      configuration.forEach(
          (key, value) -> {
            if (value == null) {
              merged.remove(key);
            } else {
              merged.put(key, value);
            }
          });
      integration.setConfiguration(merged);
    }
    if (enabled != null) {
      if (enabled) {
        integration.enable();
      } else {
        integration.disable();
      }
    }

    var secretChanges = SecretBundle.of(secrets);
    // The store checks undecryptable records against the secrets they must re-supply.
    if (!integration.isSecretsUnavailable()) {
      PlatformConfigurationRequirements.validate(
          Platform.require(integration.getPlatformId()),
          integration.getConfiguration(),
          integration.getSecrets().mergedWith(secretChanges));
    }

    var saved = secretStore.update(integration, secretChanges);
    log.info("Updated app integration {}", saved.getId());
    return AppIntegrationResponse.from(saved);
  }

  @Transactional
  public AppIntegrationResponse toggleIntegration(UUID id, boolean enabled) {
    var integration = findOwnedOrThrow(id);
    if (enabled) {
      integration.enable();
    } else {
      integration.disable();
    }
    var saved = secretStore.update(integration, SecretBundle.empty());
    log.info("App integration {} {}", saved.getId(), enabled ? "enabled" : "disabled");
    return AppIntegrationResponse.from(saved);
  }

  @Transactional
  public AppIntegrationResponse rotateWebhookSecret(UUID id) {
    var integration = findOwnedOrThrow(id);
    return AppIntegrationResponse.from(secretStore.rotateWebhookSecret(integration), true);
  }

  /** Checks that the stored configuration and secrets are complete. Reveals no secret values. */
  @Transactional(readOnly = true)
  public IntegrationTestResult testIntegration(UUID id) {
    var integration = findOwnedOrThrow(id);
    var result = IntegrationTestResult.of(integration);
    log.info(
        "Tested app integration {}: success={}, message={}",
        integration.getId(),
        result.success(),
        result.message());
    return result;
  }

  @Transactional
  public void deleteIntegration(UUID id) {
    secretStore.delete(findOwnedOrThrow(id));
  }

  // Integrations of other tenants are reported as missing.
  private AppIntegration findOwnedOrThrow(UUID id) {
    String tenantId = TenantContext.requireTenantId();
    return secretStore
        .findById(id)
        .filter(integration -> integration.getTenantId().equals(tenantId))
        .orElseThrow(() -> new ResourceNotFoundException("AppIntegration", id));
  }
}
