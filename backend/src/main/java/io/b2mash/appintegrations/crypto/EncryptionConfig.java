package io.b2mash.appintegrations.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EncryptionProperties.class)
public class EncryptionConfig {

  private static final Logger log = LoggerFactory.getLogger(EncryptionConfig.class);

  /** Fails context startup with {@link KeyRingConfigurationException} on bad key material. */
  @Bean
  KeyRing keyRing(EncryptionProperties properties) {
    var keyRing = KeyRing.from(properties);
    log.info(
        "Integration secret key ring loaded: activeKeyId={}, retiredKeys={}",
        keyRing.active().keyId(),
        keyRing.keyIds().size() - 1);
    return keyRing;
  }
}
