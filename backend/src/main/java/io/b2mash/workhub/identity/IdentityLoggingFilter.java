package io.b2mash.workhub.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class IdentityLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_PRINCIPAL_ID = "principalId";
  private static final String MDC_SURFACE = "surface";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      Principal principal = RequestScopes.getPrincipalOrNull();
      if (principal != null) {
        MDC.put(MDC_PRINCIPAL_ID, String.valueOf(principal.accountId()));
      }

      Surface surface = RequestScopes.getSurfaceOrNull();
      if (surface != null) {
        MDC.put(MDC_SURFACE, surface.name().toLowerCase());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_SURFACE);
      MDC.remove(MDC_PRINCIPAL_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
