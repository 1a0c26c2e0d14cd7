package com.nosota.bounty.api.model;

public enum DisputeStatus {
    OPEN,
    RESOLVED
}
