package com.wccms.security.gate;

/**
 * Decides whether a user owns a resource. Throwing means the answer is unknown, which the
 * ownership gate reports as a server error rather than a denial.
 */
@FunctionalInterface
public interface OwnershipCheck {
  boolean isOwner(String userId, String resourceId) throws Exception;
}
