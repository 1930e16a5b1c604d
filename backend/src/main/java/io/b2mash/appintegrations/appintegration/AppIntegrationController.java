package io.b2mash.appintegrations.appintegration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/app-integrations")
@PreAuthorize("hasRole('INTEGRATION_ADMIN')")
public class AppIntegrationController {

  private final AppIntegrationService appIntegrationService;

  public AppIntegrationController(AppIntegrationService appIntegrationService) {
    this.appIntegrationService = appIntegrationService;
  }

  @GetMapping
  public ResponseEntity<List<AppIntegrationResponse>> listIntegrations(
      @RequestParam(required = false) String platform) {
    return ResponseEntity.ok(appIntegrationService.listIntegrations(platform));
  }

  @GetMapping("/{id}")
  public ResponseEntity<AppIntegrationResponse> getIntegration(@PathVariable UUID id) {
    return ResponseEntity.ok(appIntegrationService.getIntegration(id));
  }

  @PostMapping
  public ResponseEntity<AppIntegrationResponse> createIntegration(
      @Valid @RequestBody CreateAppIntegrationRequest request) {
    var response =
        appIntegrationService.createIntegration(
            request.platformId(),
            request.name(),
            request.description(),
            request.configuration(),
            request.secrets(),
            request.enabled());
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<AppIntegrationResponse> updateIntegration(
      @PathVariable UUID id, @Valid @RequestBody UpdateAppIntegrationRequest request) {
    return ResponseEntity.ok(
        appIntegrationService.updateIntegration(
            id,
            request.name(),
            request.description(),
            request.configuration(),
            request.secrets(),
            request.enabled()));
  }

  @PatchMapping("/{id}/toggle")
  public ResponseEntity<AppIntegrationResponse> toggleIntegration(
      @PathVariable UUID id, @Valid @RequestBody ToggleRequest request) {
    return ResponseEntity.ok(appIntegrationService.toggleIntegration(id, request.enabled()));
  }

  @PostMapping("/{id}/webhook-secret/rotate")
  public ResponseEntity<AppIntegrationResponse> rotateWebhookSecret(@PathVariable UUID id) {
    return ResponseEntity.ok(appIntegrationService.rotateWebhookSecret(id));
  }

  @PostMapping("/{id}/test")
  public ResponseEntity<IntegrationTestResult> testIntegration(@PathVariable UUID id) {
    return ResponseEntity.ok(appIntegrationService.testIntegration(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteIntegration(@PathVariable UUID id) {
    appIntegrationService.deleteIntegration(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateAppIntegrationRequest(
      @NotBlank(message = "platformId must not be blank") String platformId,
      @NotBlank(message = "name must not be blank") @Size(max = 200) String name,
      @Size(max = 1000) String description,
      Map<String, Object> configuration,
      Map<String, String> secrets,
      Boolean enabled) {}

  public record UpdateAppIntegrationRequest(
      @Size(min = 1, max = 200) String name,
      @Size(max = 1000) String description,
      Map<String, Object> configuration,
      Map<String, String> secrets,
      Boolean enabled) {}

  public record ToggleRequest(boolean enabled) {}
}
