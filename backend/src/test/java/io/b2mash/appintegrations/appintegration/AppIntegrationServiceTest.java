package io.b2mash.appintegrations.appintegration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.appintegrations.exception.InvalidStateException;
import io.b2mash.appintegrations.exception.ResourceConflictException;
import io.b2mash.appintegrations.exception.ResourceNotFoundException;
import io.b2mash.appintegrations.multitenancy.TenantContext;
import io.b2mash.appintegrations.secret.SecretBundle;
import io.b2mash.appintegrations.secret.SecretFields;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AppIntegrationServiceTest {

  private static final String TENANT = "tenant-a";
  private static final String WEBHOOK_SECRET = "AbCdEfGhIjKlMnOpQrStUvWxYz012345";

  @Mock private IntegrationSecretStore secretStore;
  @Mock private AppIntegrationRepository repository;

  private AppIntegrationService service;

  @BeforeEach
  void setUp() {
    service = new AppIntegrationService(secretStore, repository);
    TenantContext.setTenantId(TENANT);
  }

  @AfterEach
  void tearDown() {
    TenantContext.clear();
  }

  @Test
  void createIntegration_returnsMaskedSecretsAndFullWebhookUrl() {
    when(secretStore.create(any(AppIntegration.class)))
        .thenAnswer(inv -> persisted(inv.getArgument(0)));

    var response =
        service.createIntegration(
            "slack",
            "Support",
            null,
            Map.of("teamId", "T1"),
            Map.of("signingSecret", "8f2b1c0d9e7a6b5c", "botToken", "xoxb-12345"),
            null);

    assertThat(response.tenantId()).isEqualTo(TENANT);
    assertThat(response.enabled()).isTrue();
    assertThat(response.secrets().get("botToken")).isEqualTo("xoxb****2345");
    assertThat(response.secrets().get("signingSecret")).isEqualTo("8f2b****6b5c");
    assertThat(response.webhookUrl())
        .isEqualTo("/webhooks/slack/" + response.id() + "/" + WEBHOOK_SECRET);
  }

  @Test
  void createIntegration_platformAlias_storedUnderCanonicalId() {
    when(secretStore.create(any(AppIntegration.class)))
        .thenAnswer(inv -> persisted(inv.getArgument(0)));

    service.createIntegration(
        "teams",
        "Teams bot",
        null,
        Map.of("appId", "app-1"),
        Map.of("appPassword", "pw-123456789"),
        false);

    var captor = ArgumentCaptor.forClass(AppIntegration.class);
    verify(secretStore).create(captor.capture());
    assertThat(captor.getValue().getPlatformId()).isEqualTo("msteams");
    assertThat(captor.getValue().isEnabled()).isFalse();
  }

  @Test
  void createIntegration_requiredFieldMayArriveInLegacyConfiguration() {
    when(secretStore.create(any(AppIntegration.class)))
        .thenAnswer(inv -> persisted(inv.getArgument(0)));

    var response =
        service.createIntegration(
            "slack", "Legacy", null, Map.of("signingSecret", "legacy-signing"), null, true);

    assertThat(response).isNotNull();
  }

  @Test
  void createIntegration_missingRequiredField_rejectedWithoutWrite() {
    assertThatThrownBy(
            () ->
                service.createIntegration(
                    "outlook", "Mail", null, Map.of("clientId", "c"), Map.of(), true))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("Missing required fields");
    verify(secretStore, never()).create(any());
  }

  @Test
  void createIntegration_unsupportedPlatform_rejected() {
    assertThatThrownBy(
            () -> service.createIntegration("discord", "Chat", null, Map.of(), Map.of(), true))
        .isInstanceOf(InvalidStateException.class);
    verify(secretStore, never()).create(any());
  }

  @Test
  void createIntegration_duplicateName_conflict() {
    when(repository.existsByTenantIdAndName(TENANT, "Hooks")).thenReturn(true);

    assertThatThrownBy(
            () -> service.createIntegration("webhook", "Hooks", null, Map.of(), Map.of(), true))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void getIntegration_otherTenant_notFound() {
    var foreign = existing("tenant-b", "slack");
    when(secretStore.findById(foreign.getId())).thenReturn(Optional.of(foreign));

    assertThatThrownBy(() -> service.getIntegration(foreign.getId()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void getIntegration_masksWebhookSecretInUrl() {
    var integration = existing(TENANT, "webhook");
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var response = service.getIntegration(integration.getId());

    assertThat(response.webhookUrl())
        .isEqualTo("/webhooks/webhook/" + integration.getId() + "/AbCd****2345");
  }

  @Test
  void updateIntegration_mergesConfigurationAndSecrets() {
    var integration = existing(TENANT, "webhook");
    integration.setConfiguration(Map.of("headers", "x", "format", "json"));
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));
    when(secretStore.update(eq(integration), any(SecretBundle.class))).thenReturn(integration);
    var configurationChanges = new HashMap<String, Object>();
    configurationChanges.put("format", "xml");
    configurationChanges.put("headers", null);

    service.updateIntegration(
        integration.getId(),
        null,
        "new description",
        configurationChanges,
        Map.of("secret", "hmac-secret"),
        null);

    var secretsCaptor = ArgumentCaptor.forClass(SecretBundle.class);
    verify(secretStore).update(eq(integration), secretsCaptor.capture());
    assertThat(integration.getConfiguration()).containsOnly(Map.entry("format", "xml"));
    assertThat(integration.getDescription()).isEqualTo("new description");
    assertThat(secretsCaptor.getValue().get("secret")).contains("hmac-secret");
  }

  @Test
  void updateIntegration_renameToExistingName_conflict() {
    var integration = existing(TENANT, "webhook");
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));
    when(repository.existsByTenantIdAndNameAndIdNot(TENANT, "Taken", integration.getId()))
        .thenReturn(true);

    assertThatThrownBy(
            () -> service.updateIntegration(integration.getId(), "Taken", null, null, null, null))
        .isInstanceOf(ResourceConflictException.class);
    verify(secretStore, never()).update(any(), any());
  }

  @Test
  void toggleIntegration_disables() {
    var integration = existing(TENANT, "webhook");
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));
    when(secretStore.update(integration, SecretBundle.empty())).thenReturn(integration);

    var response = service.toggleIntegration(integration.getId(), false);

    assertThat(response.enabled()).isFalse();
  }

  @Test
  void updateIntegration_unreadableSecrets_renameSkipsRequiredSecretCheck() {
    var integration = existing(TENANT, "slack");
    integration.markSecretsUnavailable();
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));
    when(secretStore.update(eq(integration), any(SecretBundle.class))).thenReturn(integration);

    var response =
        service.updateIntegration(integration.getId(), "Renamed", null, null, null, null);

    assertThat(response.name()).isEqualTo("Renamed");
    verify(secretStore).update(integration, SecretBundle.empty());
  }

  @Test
  void testIntegration_completeSlack_reportsPresenceWithoutValues() {
    var integration = existing(TENANT, "slack");
    integration.setSecrets(
        integration.getSecrets().with(SecretFields.SIGNING_SECRET, "8f2b1c0d9e7a6b5c"));
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var result = service.testIntegration(integration.getId());

    assertThat(result.success()).isTrue();
    assertThat(result.platformId()).isEqualTo("slack");
    assertThat(result.details())
        .containsEntry("hasSigningSecret", true)
        .containsEntry("hasBotToken", false)
        .containsEntry("hasIncomingWebhookUrl", false)
        .containsEntry("hasWebhookSecret", true)
        .containsEntry("secretsAvailable", true);
    assertThat(result.toString()).doesNotContain("8f2b1c0d9e7a6b5c", WEBHOOK_SECRET);
  }

  @Test
  void testIntegration_teamsWithoutAppPassword_fails() {
    var integration = existing(TENANT, "msteams");
    integration.setConfiguration(Map.of("appId", "app-1"));
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var result = service.testIntegration(integration.getId());

    assertThat(result.success()).isFalse();
    assertThat(result.message()).contains("appPassword");
    assertThat(result.details())
        .containsEntry("hasAppId", true)
        .containsEntry("hasAppPassword", false);
  }

  @Test
  void testIntegration_unreadableSecrets_reportsSecretsUnavailable() {
    var integration = existing(TENANT, "slack");
    integration.markSecretsUnavailable();
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var result = service.testIntegration(integration.getId());

    assertThat(result.success()).isFalse();
    assertThat(result.message()).startsWith("Secrets unavailable");
    assertThat(result.details()).containsEntry("secretsAvailable", false);
  }

  @Test
  void testIntegration_otherTenant_notFound() {
    var foreign = existing("tenant-b", "slack");
    when(secretStore.findById(foreign.getId())).thenReturn(Optional.of(foreign));

    assertThatThrownBy(() -> service.testIntegration(foreign.getId()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void rotateWebhookSecret_returnsFullWebhookUrl() {
    var integration = existing(TENANT, "slack");
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));
    when(secretStore.rotateWebhookSecret(integration)).thenReturn(integration);

    var response = service.rotateWebhookSecret(integration.getId());

    assertThat(response.webhookUrl()).endsWith("/" + WEBHOOK_SECRET);
  }

  @Test
  void deleteIntegration_otherTenant_notFoundAndNothingDeleted() {
    var foreign = existing("tenant-b", "slack");
    when(secretStore.findById(foreign.getId())).thenReturn(Optional.of(foreign));

    assertThatThrownBy(() -> service.deleteIntegration(foreign.getId()))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(secretStore, never()).delete(any());
  }

  @Test
  void listIntegrations_platformFilterUsesCanonicalId() {
    when(secretStore.findAllByTenantAndPlatform(TENANT, "webhook"))
        .thenReturn(List.of(existing(TENANT, "webhook")));

    var result = service.listIntegrations("generic");

    assertThat(result).hasSize(1);
  }

  private static AppIntegration persisted(AppIntegration integration) {
    ReflectionTestUtils.setField(integration, "id", UUID.randomUUID());
    integration.setSecrets(
        integration.getSecrets().with(SecretFields.WEBHOOK_SECRET, WEBHOOK_SECRET));
    return integration;
  }

  private static AppIntegration existing(String tenantId, String platformId) {
    var integration = new AppIntegration(tenantId, platformId, "Existing " + platformId);
    ReflectionTestUtils.setField(integration, "id", UUID.randomUUID());
    integration.setSecrets(SecretBundle.of(Map.of(SecretFields.WEBHOOK_SECRET, WEBHOOK_SECRET)));
    return integration;
  }
}
