package com.eh.digitalpathology.dicomrelay.model;

import com.eh.digitalpathology.dicomrelay.constants.RelayConstants;

public record MultipartBody(byte[] body, String boundary, String partContentType) {

    public String contentType ( ) {
        return String.format( "multipart/related; type=\"%s\"; boundary=%s", partContentType == null ? RelayConstants.APPLICATION_DICOM : partContentType, boundary );
    }
}
