
package com.eh.digitalpathology.dicomrelay.exceptions;

public class DicomWebException extends RuntimeException {

    private final int statusCode;

    public DicomWebException ( String message ) {
        this( message, -1 );
    }

    public DicomWebException ( String message, int statusCode ) {
        super( message );
        this.statusCode = statusCode;
    }

    public DicomWebException ( String message, Throwable cause ) {
        super( message, cause );
        this.statusCode = -1;
    }

    public int getStatusCode ( ) {
        return statusCode;
    }
}
