package io.b2mash.workhub.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the principal for {@code /mcp/**} requests from the optional {@code X-Mcp-User} email hint.
 * Never rejects a request because of the hint.
 */
@Component
public class SoftIdentityFilter extends OncePerRequestFilter {

  public static final String IDENTITY_HINT_HEADER = "X-Mcp-User";

  private final PrincipalResolver principalResolver;

  public SoftIdentityFilter(PrincipalResolver principalResolver) {
    this.principalResolver = principalResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Principal principal = principalResolver.resolveSoft(request.getHeader(IDENTITY_HINT_HEADER));
    RequestScopes.runScoped(principal, Surface.SOFT, filterChain, request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/mcp/");
  }
}
