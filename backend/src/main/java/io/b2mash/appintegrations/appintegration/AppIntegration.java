package io.b2mash.appintegrations.appintegration;

import io.b2mash.appintegrations.secret.SecretBundle;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A tenant's connection to an external platform. Secrets live only in {@code secretsEncrypted};
 * the plaintext {@link #getSecrets() secrets} are populated by {@link IntegrationSecretStore} on
 * load and are never mapped to a column.
 */
@Entity
@Table(name = "app_integrations")
public class AppIntegration {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 50, updatable = false)
  private String tenantId;

  @Column(name = "platform_id", nullable = false, length = 30, updatable = false)
  private String platformId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", length = 1000)
  private String description;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "configuration", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> configuration = new LinkedHashMap<>();

  @Column(name = "secrets_encrypted", columnDefinition = "text")
  private String secretsEncrypted;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Transient private SecretBundle secrets = SecretBundle.empty();

  @Transient private boolean secretsUnavailable;

  protected AppIntegration() {}

  public AppIntegration(String tenantId, String platformId, String name) {
    this.tenantId = tenantId;
    this.platformId = platformId;
    this.name = name;
    this.enabled = true;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void updateDetails(String name, String description) {
    this.name = name;
    this.description = description;
  }

  public void setConfiguration(Map<String, Object> configuration) {
    this.configuration =
        configuration == null ? new LinkedHashMap<>() : new LinkedHashMap<>(configuration);
  }

  /** Plaintext secrets to store on the next write through {@link IntegrationSecretStore}. */
  public void setSecrets(SecretBundle secrets) {
    this.secrets = secrets == null ? SecretBundle.empty() : secrets;
  }

  /** Sets the sanitized configuration, its ciphertext and the plaintext view in one step. */
  void applyProtectedState(
      Map<String, Object> configuration, SecretBundle secrets, String secretsEncrypted) {
    setConfiguration(configuration);
    setSecrets(secrets);
    this.secretsEncrypted = secretsEncrypted;
    this.secretsUnavailable = false;
  }

  /** Marks the stored ciphertext as unreadable with the current key ring. */
  void markSecretsUnavailable() {
    this.secrets = SecretBundle.empty();
    this.secretsUnavailable = true;
  }

  public void enable() {
    this.enabled = true;
  }

  public void disable() {
    this.enabled = false;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getPlatformId() {
    return platformId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Map<String, Object> getConfiguration() {
    return configuration;
  }

  public String getSecretsEncrypted() {
    return secretsEncrypted;
  }

  public SecretBundle getSecrets() {
    return secrets;
  }

  /**
   * True when this integration was loaded with a blob that could not be decrypted. {@link
   * #getSecrets()} is then empty although secrets are stored.
   */
  public boolean isSecretsUnavailable() {
    return secretsUnavailable;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
