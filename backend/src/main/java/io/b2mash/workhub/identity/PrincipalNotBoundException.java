package io.b2mash.workhub.identity;

public class PrincipalNotBoundException extends RuntimeException {

  public PrincipalNotBoundException() {
    super("Principal not available: no identity filter bound one for this request");
  }
}
