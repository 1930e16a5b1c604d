package io.b2mash.appintegrations.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.appintegrations.appintegration.AppIntegration;
import io.b2mash.appintegrations.appintegration.IntegrationSecretStore;
import io.b2mash.appintegrations.secret.SecretBundle;
import io.b2mash.appintegrations.secret.SecretFields;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class WebhookSecretGuardTest {

  private static final String WEBHOOK_SECRET = "AbCdEfGhIjKlMnOpQrStUvWxYz012345";

  @Mock private IntegrationSecretStore secretStore;

  private WebhookSecretGuard guard;
  private AppIntegration integration;

  @BeforeEach
  void setUp() {
    guard = new WebhookSecretGuard(secretStore);
    integration = new AppIntegration("tenant-a", "slack", "Support");
    ReflectionTestUtils.setField(integration, "id", UUID.randomUUID());
    integration.setSecrets(SecretBundle.of(Map.of(SecretFields.WEBHOOK_SECRET, WEBHOOK_SECRET)));
  }

  @Test
  void validate_matchingSecretAndPlatform_accepted() {
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var result = guard.validate("slack", integration.getId().toString(), WEBHOOK_SECRET);

    assertThat(result.ok()).isTrue();
    assertThat(result.integration()).isSameAs(integration);
  }

  @Test
  void validate_wrongSecret_rejected() {
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var result =
        guard.validate("slack", integration.getId().toString(), "AbCdEfGhIjKlMnOpQrStUvWxYz012346");

    assertThat(result.ok()).isFalse();
    assertThat(result.integration()).isNull();
  }

  @Test
  void validate_platformMismatch_rejected() {
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var result = guard.validate("msteams", integration.getId().toString(), WEBHOOK_SECRET);

    assertThat(result.ok()).isFalse();
  }

  @Test
  void validate_unknownIntegration_rejected() {
    UUID unknown = UUID.randomUUID();
    when(secretStore.findById(unknown)).thenReturn(Optional.empty());

    assertThat(guard.validate("slack", unknown.toString(), WEBHOOK_SECRET).ok()).isFalse();
  }

  @Test
  void validate_nonUuidId_rejectedWithoutLookup() {
    assertThat(guard.validate("slack", "not-a-uuid", WEBHOOK_SECRET).ok()).isFalse();
    verify(secretStore, never()).findById(any());
  }

  @Test
  void validate_strandedIntegrationWithoutWebhookSecret_rejected() {
    integration.setSecrets(SecretBundle.empty());
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    assertThat(guard.validate("slack", integration.getId().toString(), "x".repeat(32)).ok())
        .isFalse();
  }

  @Test
  void validate_allRejectionsAreIndistinguishable() {
    when(secretStore.findById(integration.getId())).thenReturn(Optional.of(integration));

    var wrongSecret = guard.validate("slack", integration.getId().toString(), "nope");
    var wrongPlatform = guard.validate("outlook", integration.getId().toString(), WEBHOOK_SECRET);
    var malformedId = guard.validate("slack", "123", WEBHOOK_SECRET);

    assertThat(wrongSecret).isEqualTo(wrongPlatform).isEqualTo(malformedId);
  }
}
