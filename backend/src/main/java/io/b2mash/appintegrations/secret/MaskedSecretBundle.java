package io.b2mash.appintegrations.secret;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Map;

/** Display-safe view of a {@link SecretBundle}. Only ever produced by {@link SecretMasker}. */
public record MaskedSecretBundle(Map<String, String> values) {

  public MaskedSecretBundle {
    values = Map.copyOf(values);
  }

  @JsonValue
  @Override
  public Map<String, String> values() {
    return values;
  }

  public String get(String name) {
    return values.get(name);
  }
}
