package com.wccms.rest.dto;

/** An anti-forgery token and the session it is bound to. */
public record CsrfTokenResponse(String csrfToken, String sessionId) {}
