package com.nosota.bounty.api.model;

import java.util.UUID;

/**
 * Identity of the user invoking an operation, as asserted by the authentication gateway.
 *
 * @param userId        authenticated user id
 * @param emailVerified whether the identity provider reports a verified email
 * @param admin         whether the caller holds the ADMIN role
 */
public record CallerIdentity(UUID userId, boolean emailVerified, boolean admin) {

    public static CallerIdentity verified(UUID userId) {
        return new CallerIdentity(userId, true, false);
    }

    public static CallerIdentity unverified(UUID userId) {
        return new CallerIdentity(userId, false, false);
    }

    public static CallerIdentity admin(UUID userId) {
        return new CallerIdentity(userId, true, true);
    }
}
