package io.b2mash.workhub.security;

import io.b2mash.workhub.identity.IdentityProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Guards the automation surface ({@code /mcp/**}) with the shared API key. */
@Component
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

  public static final String API_KEY_HEADER = "X-API-KEY";

  private final byte[] expectedApiKey;

  public ApiKeyAuthFilter(IdentityProperties identityProperties) {
    String apiKey = identityProperties.apiKey();
    this.expectedApiKey =
        apiKey == null || apiKey.isBlank() ? null : apiKey.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String apiKey = request.getHeader(API_KEY_HEADER);

    if (matches(apiKey)) {
      var auth = new ApiKeyAuthenticationToken();
      SecurityContextHolder.getContext().setAuthentication(auth);
      filterChain.doFilter(request, response);
    } else {
      log.warn(
          "security.api_key_rejected: path={}, method={}, remote_addr={}",
          request.getRequestURI(),
          request.getMethod(),
          request.getRemoteAddr());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/mcp/");
  }

  private boolean matches(String apiKey) {
    // An unconfigured key locks the surface rather than opening it
    if (expectedApiKey == null || apiKey == null) {
      return false;
    }
    return MessageDigest.isEqual(expectedApiKey, apiKey.getBytes(StandardCharsets.UTF_8));
  }

  private static class ApiKeyAuthenticationToken extends AbstractAuthenticationToken {

    ApiKeyAuthenticationToken() {
      super(List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_AUTOMATION)));
      setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
      return null;
    }

    @Override
    public Object getPrincipal() {
      return "automation-client";
    }
  }
}
