package com.nosota.bounty.api.model;

/**
 * Status of a hunter's application to a bounty.
 */
public enum RequestStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}
