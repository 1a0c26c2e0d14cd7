package com.nosota.bounty.api.model;

/**
 * HTTP headers carrying {@link CallerIdentity}. Set by the authentication gateway, never by end clients.
 */
public final class IdentityHeaders {
    public static final String USER_ID = "X-User-Id";
    public static final String EMAIL_VERIFIED = "X-Email-Verified";
    public static final String USER_ROLES = "X-User-Roles";
    public static final String ADMIN_ROLE = "ADMIN";

    private IdentityHeaders() {
    }
}
