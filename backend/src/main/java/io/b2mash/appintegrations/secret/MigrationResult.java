package io.b2mash.appintegrations.secret;

import java.util.Map;

/**
 * Output of {@link LegacySecretMigrator#extract}: the secrets pulled out of a configuration map and
 * what is left of that map.
 */
public record MigrationResult(SecretBundle secrets, Map<String, Object> remainingConfiguration) {}
