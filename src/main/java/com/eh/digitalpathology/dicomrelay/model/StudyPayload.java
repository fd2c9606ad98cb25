package com.eh.digitalpathology.dicomrelay.model;

import java.util.List;

public final class StudyPayload {

    private final PayloadForm form;
    private final byte[] body;
    private final String contentType;
    private final List< byte[] > instances;

    private StudyPayload ( PayloadForm form, byte[] body, String contentType, List< byte[] > instances ) {
        this.form = form;
        this.body = body;
        this.contentType = contentType;
        this.instances = instances;
    }

    public static StudyPayload multipart ( byte[] body, String contentType ) {
        return new StudyPayload( PayloadForm.MULTIPART, body, contentType, List.of( ) );
    }

    public static StudyPayload instances ( List< byte[] > instances ) {
        return new StudyPayload( PayloadForm.INSTANCES, null, null, List.copyOf( instances ) );
    }

    public PayloadForm getForm ( ) {
        return form;
    }

    public byte[] getBody ( ) {
        return body;
    }

    public String getContentType ( ) {
        return contentType;
    }

    public List< byte[] > getInstances ( ) {
        return instances;
    }

    public long sizeInBytes ( ) {
        if ( form == PayloadForm.MULTIPART ) {
            return body == null ? 0 : body.length;
        }
        return instances.stream( ).mapToLong( i -> i.length ).sum( );
    }
}
