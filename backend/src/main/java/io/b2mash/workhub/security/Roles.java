package io.b2mash.workhub.security;

public final class Roles {

  /** Role name carried in the JWT {@code roles} claim. */
  public static final String ADMIN = "workhub_admin";

  public static final String AUTHORITY_ADMIN = "ROLE_WORKHUB_ADMIN";
  public static final String AUTHORITY_AUTOMATION = "ROLE_AUTOMATION";

  private Roles() {}
}
