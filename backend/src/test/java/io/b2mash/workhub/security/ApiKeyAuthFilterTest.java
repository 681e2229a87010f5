package io.b2mash.workhub.security;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.workhub.identity.IdentityProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class ApiKeyAuthFilterTest {

  private static final String EXPECTED_KEY = "automation-secret";

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
    filter = new ApiKeyAuthFilter(properties(EXPECTED_KEY));
    request = new MockHttpServletRequest();
    request.setRequestURI("/mcp/tasks/query");
    response = new MockHttpServletResponse();
    filterChainCalled = false;
    SecurityContextHolder.clearContext();
  }

  @AfterEach
  void tearDown() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validKey_setsAutomationAuthAndContinues() throws ServletException, IOException {
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, EXPECTED_KEY);

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isTrue();
    var auth = SecurityContextHolder.getContext().getAuthentication();
    assertThat(auth).isNotNull();
    assertThat(auth.isAuthenticated()).isTrue();
    assertThat(auth.getAuthorities())
        .extracting("authority")
        .containsExactly(Roles.AUTHORITY_AUTOMATION);
  }

  @Test
  void wrongKey_returns401() throws ServletException, IOException {
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "nope");

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
  void unconfiguredKey_rejectsEverything() throws ServletException, IOException {
    filter = new ApiKeyAuthFilter(properties(""));
    request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "");

    filter.doFilterInternal(request, response, filterChain);

    assertThat(filterChainCalled).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void onlyAutomationPathsAreFiltered() {
    request.setRequestURI("/api/tasks/1");
    assertThat(filter.shouldNotFilter(request)).isTrue();

    request.setRequestURI("/mcp/tasks/1");
    assertThat(filter.shouldNotFilter(request)).isFalse();
  }

  private static IdentityProperties properties(String apiKey) {
    return new IdentityProperties(1L, apiKey, 100, Duration.ofMinutes(5));
  }
}
