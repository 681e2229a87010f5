package io.b2mash.workhub.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;

class StrictAuthenticationEntryPointTest {

  @Test
  void rejectedRequest_getsBearerChallenge() throws Exception {
    var request = new MockHttpServletRequest("GET", "/api/workspaces");
    var response = new MockHttpServletResponse();

    SecurityConfig.strictAuthenticationEntryPoint()
        .commence(
            request, response, new InsufficientAuthenticationException("Full authentication"));

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getHeader(HttpHeaders.WWW_AUTHENTICATE)).startsWith("Bearer");
  }
}
