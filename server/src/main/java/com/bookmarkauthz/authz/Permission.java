package com.bookmarkauthz.authz;

/** An action a caller may perform on a resource. */
public enum Permission {
  READ,
  WRITE,
  DELETE,
  SHARE
}
