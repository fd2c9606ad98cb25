package com.eh.digitalpathology.dicomrelay.model;

import java.util.List;

public record DeliveryOutcome(int attempted, int delivered, List< String > failures) {

    public DeliveryOutcome {
        failures = List.copyOf( failures );
    }

    public boolean isSuccess ( ) {
        return attempted > 0 && delivered == attempted && failures.isEmpty( );
    }
}
