package io.b2mash.appintegrations.multitenancy;

/**
 * Tenant of the current request. Bound by {@link TenantFilter} for {@code /api/**} requests and
 * cleared when the request completes.
 */
public final class TenantContext {

  private static final ThreadLocal<String> CURRENT_TENANT = new ThreadLocal<>();

  private TenantContext() {}

  public static void setTenantId(String tenantId) {
    CURRENT_TENANT.set(tenantId);
  }

  public static String getTenantId() {
    return CURRENT_TENANT.get();
  }

  /** Returns the tenant id. Throws if not bound by the filter chain. */
  public static String requireTenantId() {
    String tenantId = CURRENT_TENANT.get();
    if (tenantId == null) {
      throw new IllegalStateException("Tenant context not available. TENANT_ID not bound");
    }
    return tenantId;
  }

  public static void clear() {
    CURRENT_TENANT.remove();
  }
}
