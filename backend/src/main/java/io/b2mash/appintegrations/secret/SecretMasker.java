package io.b2mash.appintegrations.secret;

import java.util.LinkedHashMap;

/**
 * Irreversible partial redaction for API responses. Values longer than eight characters keep their
 * first and last four characters; shorter values collapse to a constant mask so near-complete short
 * secrets never leak.
 */
public final class SecretMasker {

  public static final String MASK = "****";

  private static final int VISIBLE_CHARS = 4;
  private static final int MIN_PARTIAL_LENGTH = 2 * VISIBLE_CHARS;

  private SecretMasker() {}

  public static MaskedSecretBundle mask(SecretBundle bundle) {
    var masked = new LinkedHashMap<String, String>();
    if (bundle != null) {
      bundle.asMap().forEach((name, value) -> masked.put(name, maskValue(value)));
    }
    return new MaskedSecretBundle(masked);
  }

  public static String maskValue(String value) {
    if (value == null || value.isEmpty()) {
      return value;
    }
    int length = value.length();
    if (length <= MIN_PARTIAL_LENGTH) {
      return MASK;
    }
    return value.substring(0, VISIBLE_CHARS) + MASK + value.substring(length - VISIBLE_CHARS);
  }
}
