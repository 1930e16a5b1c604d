package io.b2mash.appintegrations.security;

import io.b2mash.appintegrations.multitenancy.TenantFilter;
import io.b2mash.appintegrations.multitenancy.TenantLoggingFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final TenantFilter tenantFilter;
  private final TenantLoggingFilter tenantLoggingFilter;

  public SecurityConfig(
      ApiKeyAuthFilter apiKeyAuthFilter,
      TenantFilter tenantFilter,
      TenantLoggingFilter tenantLoggingFilter) {
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.tenantFilter = tenantFilter;
    this.tenantLoggingFilter = tenantLoggingFilter;
  }

  /**
   * Webhook endpoints are anonymous: the webhook secret in the path and the platform signature are
   * their authentication. Management endpoints under {@code /api/**} require the gateway API key
   * and a tenant header.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health")
                    .permitAll()
                    .requestMatchers("/webhooks/**")
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .hasAuthority(ApiKeyAuthFilter.AUTHORITY_INTEGRATION_ADMIN)
                    .anyRequest()
                    .denyAll())
        .addFilterBefore(apiKeyAuthFilter, AnonymousAuthenticationFilter.class)
        .addFilterAfter(tenantFilter, ApiKeyAuthFilter.class)
        .addFilterAfter(tenantLoggingFilter, TenantFilter.class);

    return http.build();
  }

  // The filters run inside the security chain only; keep the servlet container from adding them
  // a second time.

  @Bean
  FilterRegistrationBean<ApiKeyAuthFilter> apiKeyAuthFilterRegistration(ApiKeyAuthFilter filter) {
    return disabled(filter);
  }

  @Bean
  FilterRegistrationBean<TenantFilter> tenantFilterRegistration(TenantFilter filter) {
    return disabled(filter);
  }

  @Bean
  FilterRegistrationBean<TenantLoggingFilter> tenantLoggingFilterRegistration(
      TenantLoggingFilter filter) {
    return disabled(filter);
  }

  private static <T extends jakarta.servlet.Filter> FilterRegistrationBean<T> disabled(T filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }
}
