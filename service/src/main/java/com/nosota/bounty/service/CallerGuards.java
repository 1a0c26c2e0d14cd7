package com.nosota.bounty.service;

import com.nosota.bounty.api.model.CallerIdentity;
import com.nosota.bounty.api.model.LifecycleErrorKind;
import com.nosota.bounty.error.BountyLifecycleException;
import com.nosota.bounty.model.Bounty;

import java.util.Objects;

/**
 * Server-side re-validation of caller claims. Client-side gating is never trusted.
 */
final class CallerGuards {

    private CallerGuards() {
    }

    static void requireVerifiedEmail(CallerIdentity caller) {
        if (!caller.emailVerified()) {
            throw new BountyLifecycleException(LifecycleErrorKind.EMAIL_NOT_VERIFIED,
                    "Unverified caller: userId=" + caller.userId());
        }
    }

    static void requirePoster(Bounty bounty, CallerIdentity caller) {
        if (bounty.getPosterId() == null || !Objects.equals(bounty.getPosterId(), caller.userId())) {
            throw new BountyLifecycleException(LifecycleErrorKind.NOT_BOUNTY_POSTER,
                    String.format("Caller is not the poster: bountyId=%s, callerId=%s", bounty.getId(), caller.userId()));
        }
    }

    static boolean isPoster(Bounty bounty, CallerIdentity caller) {
        return bounty.getPosterId() != null && bounty.getPosterId().equals(caller.userId());
    }

    static boolean isAcceptedHunter(Bounty bounty, CallerIdentity caller) {
        return bounty.getAcceptedHunterId() != null && bounty.getAcceptedHunterId().equals(caller.userId());
    }
}
