package io.b2mash.workhub.identity;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.workhub.account.Account;
import io.b2mash.workhub.account.AccountRepository;
import io.b2mash.workhub.exception.UnauthorizedException;
import io.b2mash.workhub.security.Roles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Turns request credentials into a {@link Principal}. The strict path fails closed; the soft path
 * never fails and degrades to the configured fallback account.
 */
@Component
@EnableConfigurationProperties(IdentityProperties.class)
public class PrincipalResolver {

  private static final Logger log = LoggerFactory.getLogger(PrincipalResolver.class);

  private static final String EMAIL_CLAIM = "email";
  private static final String NAME_CLAIM = "name";

  private final AccountRepository accountRepository;
  private final IdentityProperties properties;
  private final Cache<String, Long> accountCache;

  public PrincipalResolver(AccountRepository accountRepository, IdentityProperties properties) {
    this.accountRepository = accountRepository;
    this.properties = properties;
    this.accountCache =
        Caffeine.newBuilder()
            .maximumSize(properties.accountCacheSize())
            .expireAfterWrite(properties.accountCacheTtl())
            .build();
  }

  /** Resolves a verified bearer token, provisioning the account on first sight. */
  public Principal resolveStrict(JwtAuthenticationToken authentication) {
    Jwt jwt = authentication.getToken();
    String subject = jwt.getSubject();
    if (subject == null || subject.isBlank()) {
      throw new UnauthorizedException("Bearer token carries no subject");
    }
    Long accountId =
        accountCache.get(
            subject,
            k ->
                resolveOrCreateAccount(
                    subject, jwt.getClaimAsString(EMAIL_CLAIM), jwt.getClaimAsString(NAME_CLAIM)));
    boolean administrator =
        authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .anyMatch(Roles.AUTHORITY_ADMIN::equals);
    return new Principal(accountId, administrator);
  }

  /**
   * Resolves an unverified email hint. Absent, blank and unknown hints all yield the fallback
   * principal, as does a lookup that fails in storage.
   */
  public Principal resolveSoft(String hint) {
    if (hint == null || hint.isBlank()) {
      return fallbackPrincipal();
    }
    try {
      return accountRepository
          .findByEmailIgnoreCase(hint.trim())
          .map(account -> Principal.of(account.getId()))
          .orElseGet(
              () -> {
                log.debug("Identity hint {} matched no account, using fallback", hint);
                return fallbackPrincipal();
              });
    } catch (DataAccessException e) {
      log.warn("Identity hint lookup failed, using fallback: {}", e.getMessage());
      return fallbackPrincipal();
    }
  }

  public Principal fallbackPrincipal() {
    return Principal.of(properties.fallbackAccountId());
  }

  public void evictFromCache(String subject) {
    accountCache.invalidate(subject);
  }

  private Long resolveOrCreateAccount(String subject, String email, String name) {
    return accountRepository
        .findBySubject(subject)
        .map(Account::getId)
        .orElseGet(() -> lazyCreateAccount(subject, email, name));
  }

  private Long lazyCreateAccount(String subject, String email, String name) {
    String accountEmail = email != null && !email.isBlank() ? email : subject + "@placeholder.internal";
    try {
      var account = accountRepository.save(new Account(subject, accountEmail, name));
      log.info("Lazy-created account {} for subject {}", account.getId(), subject);
      return account.getId();
    } catch (DataIntegrityViolationException e) {
      // Race: another request provisioned the same subject first
      return accountRepository
          .findBySubject(subject)
          .map(Account::getId)
          .orElseThrow(
              () ->
                  new UnauthorizedException(
                      "Unable to provision an account for subject " + subject));
    }
  }
}
