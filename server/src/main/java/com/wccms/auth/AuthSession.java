package com.wccms.auth;

import com.wccms.db.User;
import com.wccms.security.TokenPair;

/**
 * A successful login, registration or refresh: the account as currently stored and a fresh token
 * pair carrying its current role.
 */
public record AuthSession(User user, TokenPair tokens) {}
