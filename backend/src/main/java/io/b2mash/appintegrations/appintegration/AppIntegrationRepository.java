package io.b2mash.appintegrations.appintegration;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AppIntegrationRepository extends JpaRepository<AppIntegration, UUID> {

  List<AppIntegration> findByTenantIdOrderByCreatedAtAsc(String tenantId);

  List<AppIntegration> findByTenantIdAndPlatformIdOrderByCreatedAtAsc(
      String tenantId, String platformId);

  boolean existsByTenantIdAndName(String tenantId, String name);

  boolean existsByTenantIdAndNameAndIdNot(String tenantId, String name, UUID id);
}
