package io.b2mash.appintegrations.security;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class ApiKeyAuthFilterTest {

  private static final String EXPECTED_KEY = "test-secret-api-key";

  private ApiKeyAuthFilter filter;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;
  private boolean filterChainCalled;

  private final FilterChain filterChain =
      (req, res) -> {
        filterChainCalled = true;
      };

  @BeforeEach
  void setUp() {
    filter = new ApiKeyAuthFilter(EXPECTED_KEY);
    request = new MockHttpServletRequest();
    request.setRequestURI("/api/app-integrations");
    response = new MockHttpServletResponse();
    filterChainCalled = false;
    SecurityContextHolder.clearContext();
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validKey_continuesFilterChain() throws ServletException, IOException {
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, EXPECTED_KEY);

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isTrue();
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Test
  void validKey_grantsIntegrationAdmin() throws ServletException, IOException {
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, EXPECTED_KEY);

    filter.doFilterInternal(request, response, filterChain);

    var auth = SecurityContextHolder.getContext().getAuthentication();
    assertThat(auth).isNotNull();
    assertThat(auth.isAuthenticated()).isTrue();
    assertThat(auth.getAuthorities())
        .extracting("authority")
        .containsExactly(ApiKeyAuthFilter.AUTHORITY_INTEGRATION_ADMIN);
  }

  @Test
  void invalidKey_returns401() throws ServletException, IOException {
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "wrong-key");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void missingHeader_returns401() throws ServletException, IOException {
    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void unconfiguredKey_rejectsEvenEmptyHeader() throws ServletException, IOException {
    var unconfigured = new ApiKeyAuthFilter("");
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "");

    unconfigured.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void webhookPaths_areNotFiltered() {
    request.setRequestURI("/webhooks/slack/abc/def");

    assertThat(filter.shouldNotFilter(request)).isTrue();
  }
}
