package io.b2mash.workhub.identity;

/**
 * The resolved actor of a request. Produced once at the request boundary and consumed uniformly by
 * every service, whichever surface the request came in on.
 *
 * @param accountId the acting account, possibly the configured fallback account
 * @param administrator whether the actor may perform unscoped administrative reads
 */
public record Principal(long accountId, boolean administrator) {

  public static Principal of(long accountId) {
    return new Principal(accountId, false);
  }

  public boolean isAccount(Long otherAccountId) {
    return otherAccountId != null && otherAccountId == accountId;
  }
}
