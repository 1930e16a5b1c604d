package io.b2mash.appintegrations.secret;

/** Well-known secret field names. Bundles may carry other names; they pass through untouched. */
public final class SecretFields {

  public static final String WEBHOOK_SECRET = "webhookSecret";

  // Slack
  public static final String SIGNING_SECRET = "signingSecret";
  public static final String BOT_TOKEN = "botToken";
  public static final String INCOMING_WEBHOOK_URL = "incomingWebhookUrl";

  // Microsoft Teams
  public static final String APP_PASSWORD = "appPassword";

  // Outlook / Graph
  public static final String CLIENT_SECRET = "clientSecret";

  // Generic webhook HMAC secret
  public static final String SECRET = "secret";

  private SecretFields() {}
}
