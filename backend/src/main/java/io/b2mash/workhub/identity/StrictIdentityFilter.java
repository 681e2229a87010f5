package io.b2mash.workhub.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Binds the principal for {@code /api/**} requests from the verified bearer token. */
@Component
public class StrictIdentityFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(StrictIdentityFilter.class);

  private final PrincipalResolver principalResolver;

  public StrictIdentityFilter(PrincipalResolver principalResolver) {
    this.principalResolver = principalResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      // Unauthenticated requests are rejected by the authorization rules downstream
      filterChain.doFilter(request, response);
      return;
    }

    Principal principal;
    try {
      principal = principalResolver.resolveStrict(jwtAuth);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to resolve account for subject {}: {}",
          jwtAuth.getToken().getSubject(),
          e.getMessage());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Unable to resolve caller");
      return;
    }
    RequestScopes.runScoped(principal, Surface.STRICT, filterChain, request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }
}
