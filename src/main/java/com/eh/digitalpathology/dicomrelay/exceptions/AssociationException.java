package com.eh.digitalpathology.dicomrelay.exceptions;

public class AssociationException extends RuntimeException{

    private final String errorCode;

    private final String errorMessage;

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public AssociationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.errorMessage = message;
    }
}
