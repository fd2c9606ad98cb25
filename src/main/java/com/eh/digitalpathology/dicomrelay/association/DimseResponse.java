package com.eh.digitalpathology.dicomrelay.association;

import java.util.Map;

public record DimseResponse(int status, Map< String, String > identifier, int completed, int failed) {

    public DimseResponse {
        identifier = identifier == null ? Map.of( ) : Map.copyOf( identifier );
    }

    public static DimseResponse of ( int status ) {
        return new DimseResponse( status, Map.of( ), -1, -1 );
    }

    public static DimseResponse match ( int status, Map< String, String > identifier ) {
        return new DimseResponse( status, identifier, -1, -1 );
    }

    public static DimseResponse moveStatus ( int status, int completed, int failed ) {
        return new DimseResponse( status, Map.of( ), completed, failed );
    }

    public boolean isPending ( ) {
        return DimseStatus.isPending( status );
    }

    public String get ( String keyword ) {
        return identifier.get( keyword );
    }
}
