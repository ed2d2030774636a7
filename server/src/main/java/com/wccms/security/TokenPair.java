package com.wccms.security;

/** An access token and the refresh token issued alongside it. */
public record TokenPair(String accessToken, String refreshToken) {}
