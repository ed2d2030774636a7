package com.wccms.auth;

/**
 * Fields for creating an account.
 *
 * @param role wire name of the requested role
 */
public record RegistrationRequest(String username, String email, String password, String role) {}
