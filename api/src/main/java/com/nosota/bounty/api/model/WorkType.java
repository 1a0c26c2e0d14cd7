package com.nosota.bounty.api.model;

public enum WorkType {
    ONLINE,
    IN_PERSON
}
