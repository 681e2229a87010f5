package io.b2mash.workhub.identity;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import java.io.IOException;

/**
 * Request-scoped identity. Bound by {@link StrictIdentityFilter} or {@link SoftIdentityFilter},
 * read by controllers, and always unbound when the filter chain returns.
 */
public final class RequestScopes {

  private static final ThreadLocal<Principal> PRINCIPAL = new ThreadLocal<>();
  private static final ThreadLocal<Surface> SURFACE = new ThreadLocal<>();

  private RequestScopes() {}

  /** Returns the current principal. Throws if no identity filter ran. */
  public static Principal requirePrincipal() {
    Principal principal = PRINCIPAL.get();
    if (principal == null) {
      throw new PrincipalNotBoundException();
    }
    return principal;
  }

  public static Principal getPrincipalOrNull() {
    return PRINCIPAL.get();
  }

  public static Surface getSurfaceOrNull() {
    return SURFACE.get();
  }

  /**
   * Binds the principal for the rest of the filter chain. Nested bindings restore the outer value
   * on exit.
   */
  public static void runScoped(
      Principal principal,
      Surface surface,
      FilterChain chain,
      ServletRequest request,
      ServletResponse response)
      throws ServletException, IOException {
    Principal previousPrincipal = PRINCIPAL.get();
    Surface previousSurface = SURFACE.get();
    PRINCIPAL.set(principal);
    SURFACE.set(surface);
    try {
      chain.doFilter(request, response);
    } finally {
      restore(PRINCIPAL, previousPrincipal);
      restore(SURFACE, previousSurface);
    }
  }

  private static <T> void restore(ThreadLocal<T> holder, T previous) {
    if (previous == null) {
      holder.remove();
    } else {
      holder.set(previous);
    }
  }
}
