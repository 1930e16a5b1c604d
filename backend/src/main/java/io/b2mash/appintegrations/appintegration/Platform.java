package io.b2mash.appintegrations.appintegration;

import io.b2mash.appintegrations.exception.InvalidStateException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** External platforms an integration can connect. {@link #id()} is the persisted platform id. */
public enum Platform {
  SLACK("slack"),
  TEAMS("msteams", "teams"),
  OUTLOOK("outlook"),
  WEBHOOK("webhook", "generic");

  private final String id;
  private final List<String> aliases;

  Platform(String id, String... aliases) {
    this.id = id;
    this.aliases = List.of(aliases);
  }

  public String id() {
    return id;
  }

  public static Optional<Platform> fromId(String platformId) {
    if (platformId == null) {
      return Optional.empty();
    }
    String normalized = platformId.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(p -> p.id.equals(normalized) || p.aliases.contains(normalized))
        .findFirst();
  }

  /** Resolves a platform id or alias, rejecting anything unsupported with a 400. */
  public static Platform require(String platformId) {
    return fromId(platformId)
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Unsupported platform",
                    "Unsupported platform: "
                        + platformId
                        + ". Supported platforms: "
                        + Arrays.stream(values()).map(Platform::id).toList()));
  }
}
