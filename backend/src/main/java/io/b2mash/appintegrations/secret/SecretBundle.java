package io.b2mash.appintegrations.secret;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Plaintext credentials of one integration, keyed by field name. Immutable; blank values are
 * dropped on construction. Lives only for the duration of a request and is never persisted as-is.
 */
public final class SecretBundle {

  private static final SecretBundle EMPTY = new SecretBundle(Map.of());

  private final Map<String, String> values;

  private SecretBundle(Map<String, String> values) {
    this.values = values;
  }

  public static SecretBundle empty() {
    return EMPTY;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static SecretBundle of(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return EMPTY;
    }
    var copy = new LinkedHashMap<String, String>();
    values.forEach(
        (name, value) -> {
          if (name != null && value != null && !value.isBlank()) {
            copy.put(name, value);
          }
        });
    return copy.isEmpty() ? EMPTY : new SecretBundle(Collections.unmodifiableMap(copy));
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(values.get(name));
  }

  public boolean has(String name) {
    return values.containsKey(name);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Returns a copy with {@code name} set; a blank value removes the field. */
  public SecretBundle with(String name, String value) {
    var copy = new LinkedHashMap<>(values);
    copy.put(name, value);
    return of(copy);
  }

  /** Returns a copy where fields present in {@code overrides} replace fields of this bundle. */
  public SecretBundle mergedWith(SecretBundle overrides) {
    if (overrides == null || overrides.isEmpty()) {
      return this;
    }
    var merged = new LinkedHashMap<>(values);
    merged.putAll(overrides.values);
    return of(merged);
  }

  @JsonValue
  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SecretBundle other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  /** Field names only. */
  @Override
  public String toString() {
    return "SecretBundle" + values.keySet();
  }
}
