package io.b2mash.appintegrations.secret;

import io.b2mash.appintegrations.exception.InvalidStateException;
import java.security.SecureRandom;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Generates and validates the per-integration webhook secret bound into the webhook URL path. The
 * alphabet is restricted to characters that are safe in a URL path segment without encoding.
 */
@Component
public class WebhookSecretGenerator {

  public static final int SECRET_LENGTH = 32;

  private static final String ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";

  private static final Pattern VALID_SECRET =
      Pattern.compile("^[A-Za-z0-9_-]{" + SECRET_LENGTH + "}$");

  private final SecureRandom secureRandom = new SecureRandom();

  public String generate() {
    var sb = new StringBuilder(SECRET_LENGTH);
    for (int i = 0; i < SECRET_LENGTH; i++) {
      sb.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }

  /** Rejects caller-supplied webhook secrets that do not match the generated format. */
  public void validate(String webhookSecret) {
    if (webhookSecret == null || !VALID_SECRET.matcher(webhookSecret).matches()) {
      throw new InvalidStateException(
          "Invalid webhook secret",
          "webhookSecret must be exactly "
              + SECRET_LENGTH
              + " characters from A-Z, a-z, 0-9, '-' and '_'");
    }
  }
}
