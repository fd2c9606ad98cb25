package com.eh.digitalpathology.dicomrelay.model;

public enum RelayState {
    DISCOVERED,
    RETRIEVING,
    TRANSCODING,
    DELIVERING,
    DELIVERED,
    FAILED;

    public boolean isInFlight ( ) {
        return this == RETRIEVING || this == TRANSCODING || this == DELIVERING;
    }
}
