package com.eh.digitalpathology.dicomrelay.model;

import java.util.List;

public record MultipartMessage(String boundary, List< ObjectPart > parts) {

    public MultipartMessage {
        parts = List.copyOf( parts );
    }

    public List< byte[] > payloads ( ) {
        return parts.stream( ).map( ObjectPart::payload ).toList( );
    }
}
