package com.eh.digitalpathology.dicomrelay.model;

public record CycleSummary(int listed, int discovered, int relayed, int failed, boolean listingFailed) {

    public static CycleSummary listingFailure ( ) {
        return new CycleSummary( 0, 0, 0, 0, true );
    }

    public boolean isClean ( ) {
        return !listingFailed && failed == 0;
    }
}
