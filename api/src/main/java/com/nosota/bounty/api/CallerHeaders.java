package com.nosota.bounty.api;

import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.IdentityHeaders;
import org.springframework.http.HttpHeaders;

import java.util.function.Consumer;

/**
 * Writes a {@link CallerIdentity} into outgoing request headers.
 */
final class CallerHeaders {

    private CallerHeaders() {
    }

    static Consumer<HttpHeaders> of(CallerIdentity caller) {
        return headers -> {
            headers.set(IdentityHeaders.USER_ID, caller.userId().toString());
            headers.set(IdentityHeaders.EMAIL_VERIFIED, Boolean.toString(caller.emailVerified()));
            if (caller.admin()) {
                headers.set(IdentityHeaders.USER_ROLES, IdentityHeaders.ADMIN_ROLE);
            }
        };
    }
}
