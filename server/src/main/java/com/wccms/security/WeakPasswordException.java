package com.wccms.security;

/** Thrown when a password is too weak to be hashed at all. */
public class WeakPasswordException extends IllegalArgumentException {

  public WeakPasswordException(String message) {
    super(message);
  }
}
