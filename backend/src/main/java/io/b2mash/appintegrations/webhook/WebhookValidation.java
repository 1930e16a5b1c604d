package io.b2mash.appintegrations.webhook;

import io.b2mash.appintegrations.appintegration.AppIntegration;

/**
 * Outcome of {@link WebhookSecretGuard#validate}. A rejection carries no reason: callers answer
 * every rejection the same way.
 */
public record WebhookValidation(boolean ok, AppIntegration integration) {

  private static final WebhookValidation REJECTED = new WebhookValidation(false, null);

  static WebhookValidation accepted(AppIntegration integration) {
    return new WebhookValidation(true, integration);
  }

  static WebhookValidation rejected() {
    return REJECTED;
  }
}
