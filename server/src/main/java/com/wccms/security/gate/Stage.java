package com.wccms.security.gate;

/**
 * Position of a gate in the pipeline. Gates always run in declaration order of these constants,
 * whatever order a route lists them in.
 */
public enum Stage {
  CSRF,
  AUTHENTICATION,
  AUTHORIZATION,
  OWNERSHIP
}
