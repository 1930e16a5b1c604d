package io.b2mash.appintegrations.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.appintegrations.appintegration.Platform;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound webhooks from external platforms. The URL handed to the platform embeds the
 * integration's webhook secret, so the endpoint itself is anonymous.
 *
 * <p>Every guard rejection returns the same empty 404, whether the integration is missing, belongs
 * to another platform or the secret is wrong.
 *
 * <p>Signatures are computed over the raw request bytes. The body is read from the servlet input
 * stream rather than bound, because form-encoded posts (Slack slash commands and interactive
 * payloads) would otherwise be rebuilt from parsed parameters.
 */
@RestController
@RequestMapping("/webhooks")
public class AppWebhookController {

  private static final Logger log = LoggerFactory.getLogger(AppWebhookController.class);

  private static final String URL_VERIFICATION = "url_verification";

  private final WebhookSecretGuard webhookSecretGuard;
  private final WebhookSignatureVerifiers signatureVerifiers;
  private final ApplicationEventPublisher eventPublisher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AppWebhookController(
      WebhookSecretGuard webhookSecretGuard,
      WebhookSignatureVerifiers signatureVerifiers,
      ApplicationEventPublisher eventPublisher,
      ObjectMapper objectMapper,
      Clock clock) {
    this.webhookSecretGuard = webhookSecretGuard;
    this.signatureVerifiers = signatureVerifiers;
    this.eventPublisher = eventPublisher;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @PostMapping("/{platform}/{integrationId}/{webhookSecret}")
  public ResponseEntity<Object> receiveWebhook(
      @PathVariable String platform,
      @PathVariable String integrationId,
      @PathVariable String webhookSecret,
      @RequestHeader HttpHeaders headers,
      HttpServletRequest request)
      throws IOException {
    var validation = webhookSecretGuard.validate(platform, integrationId, webhookSecret);
    if (!validation.ok()) {
      return ResponseEntity.notFound().build();
    }

    var integration = validation.integration();
    if (!integration.isEnabled()) {
      log.info("Webhook for disabled integration {} refused", integration.getId());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    byte[] rawBody = request.getInputStream().readAllBytes();
    var resolvedPlatform = Platform.require(integration.getPlatformId());
    var verifier = signatureVerifiers.forPlatform(resolvedPlatform);
    if (verifier.isPresent()) {
      if (!verifier.get().verify(integration, headers, rawBody)) {
        log.warn(
            "Webhook signature verification failed: integration={}, platform={}",
            integration.getId(),
            resolvedPlatform.id());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
      }
    } else {
      log.debug(
          "No signature verifier for platform {}, accepting on webhook secret alone",
          resolvedPlatform.id());
    }

    String body = new String(rawBody, StandardCharsets.UTF_8);
    if (resolvedPlatform == Platform.SLACK) {
      var challenge = urlVerificationChallenge(body);
      if (challenge.isPresent()) {
        log.info("Answered Slack url_verification for integration {}", integration.getId());
        return ResponseEntity.ok(Map.of("challenge", challenge.get()));
      }
    }

    eventPublisher.publishEvent(
        new AppWebhookReceivedEvent(
            integration.getId(),
            integration.getTenantId(),
            integration.getPlatformId(),
            body,
            clock.instant()));
    log.debug("Accepted webhook for integration {}", integration.getId());
    return ResponseEntity.ok().build();
  }

  private Optional<String> urlVerificationChallenge(String body) {
    if (body.isBlank()) {
      return Optional.empty();
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      // interactive payloads arrive form-encoded
      return Optional.empty();
    }
    if (root != null && URL_VERIFICATION.equals(root.path("type").asText())) {
      return Optional.ofNullable(root.path("challenge").textValue());
    }
    return Optional.empty();
  }
}
