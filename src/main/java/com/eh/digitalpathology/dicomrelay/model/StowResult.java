package com.eh.digitalpathology.dicomrelay.model;

public record StowResult(int statusCode, int failedCount) {

    public boolean isFullyStored ( ) {
        return statusCode == 200 && failedCount == 0;
    }
}
