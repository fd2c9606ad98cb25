package com.eh.digitalpathology.dicomrelay.constants;

public class RelayConstants {

    private RelayConstants ( ) {
        throw new UnsupportedOperationException( "This is a utility class and cannot be instantiated" );
    }

    public static final String UNKNOWN = "Unknown";

    public static final String DICOM_FILE_EXTENSION = ".dcm";

    public static final String SYNTHETIC_INSTANCE_PREFIX = "instance_";

    public static final String APPLICATION_DICOM = "application/dicom";

    public static final String APPLICATION_DICOM_JSON = "application/dicom+json";

    public static final String MULTIPART_RELATED_DICOM = "multipart/related; type=\"application/dicom\"";

    public static final String STUDY_LEVEL = "STUDY";

}
