package io.b2mash.appintegrations.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the calling tenant for management API requests. The tenant id is resolved upstream by the
 * platform gateway and forwarded in {@code X-Tenant-Id}; requests without a well-formed id are
 * rejected.
 */
@Component
public class TenantFilter extends OncePerRequestFilter {

  public static final String TENANT_HEADER = "X-Tenant-Id";

  private static final Pattern TENANT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,50}$");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String tenantId = request.getHeader(TENANT_HEADER);
    if (tenantId == null || !TENANT_ID_PATTERN.matcher(tenantId).matches()) {
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Missing or invalid tenant id");
      return;
    }

    try {
      TenantContext.setTenantId(tenantId);
      filterChain.doFilter(request, response);
    } finally {
      TenantContext.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }
}
