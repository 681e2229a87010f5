package io.b2mash.workhub.security;

import io.b2mash.workhub.identity.IdentityLoggingFilter;
import io.b2mash.workhub.identity.SoftIdentityFilter;
import io.b2mash.workhub.identity.StrictIdentityFilter;
import io.b2mash.workhub.identity.Surface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

  private final WorkhubJwtAuthenticationConverter jwtAuthConverter;
  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final StrictIdentityFilter strictIdentityFilter;
  private final SoftIdentityFilter softIdentityFilter;
  private final IdentityLoggingFilter identityLoggingFilter;

  public SecurityConfig(
      WorkhubJwtAuthenticationConverter jwtAuthConverter,
      ApiKeyAuthFilter apiKeyAuthFilter,
      StrictIdentityFilter strictIdentityFilter,
      SoftIdentityFilter softIdentityFilter,
      IdentityLoggingFilter identityLoggingFilter) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.strictIdentityFilter = strictIdentityFilter;
    this.softIdentityFilter = softIdentityFilter;
    this.identityLoggingFilter = identityLoggingFilter;
  }

  /**
   * Automation surface ({@code /mcp/**}). Requires the shared API key; the caller identity is an
   * optional hint that falls back to the configured system account.
   */
  @Bean
  @Order(1)
  public SecurityFilterChain softFilterChain(HttpSecurity http) throws Exception {
    http.securityMatcher("/mcp/**")
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().authenticated())
        .addFilterBefore(apiKeyAuthFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterAfter(softIdentityFilter, ApiKeyAuthFilter.class)
        .addFilterAfter(identityLoggingFilter, SoftIdentityFilter.class);

    return http.build();
  }

  /** User-facing surface ({@code /api/**}). Every request needs a verified bearer JWT. */
  @Bean
  @Order(2)
  public SecurityFilterChain strictFilterChain(HttpSecurity http) throws Exception {
    var authEntryPoint = strictAuthenticationEntryPoint();
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(authEntryPoint))
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(authEntryPoint))
        .addFilterAfter(strictIdentityFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(identityLoggingFilter, StrictIdentityFilter.class);

    return http.build();
  }

  /**
   * Logs every rejected strict-surface request, noting whether a bearer token was sent at all, then
   * writes the standard bearer 401.
   */
  static AuthenticationEntryPoint strictAuthenticationEntryPoint() {
    var delegate = new BearerTokenAuthenticationEntryPoint();
    return (request, response, authException) -> {
      String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
      log.warn(
          "security.auth_failed: surface={}, path={}, method={}, bearer_present={}, reason={}",
          Surface.STRICT,
          request.getRequestURI(),
          request.getMethod(),
          authorization != null && authorization.startsWith("Bearer "),
          authException.getMessage());
      delegate.commence(request, response, authException);
    };
  }
}
