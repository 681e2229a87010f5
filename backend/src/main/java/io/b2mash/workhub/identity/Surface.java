package io.b2mash.workhub.identity;

/** Which request surface bound the principal. Used for log context only. */
public enum Surface {
  STRICT,
  SOFT
}
