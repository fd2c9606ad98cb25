package com.eh.digitalpathology.dicomrelay.association;

import com.eh.digitalpathology.dicomrelay.constants.RelayConstants;

public record RetrieveQuery(String queryRetrieveLevel, String studyInstanceUid) {

    public static RetrieveQuery study ( String studyInstanceUid ) {
        return new RetrieveQuery( RelayConstants.STUDY_LEVEL, studyInstanceUid );
    }

    public static RetrieveQuery allStudies ( ) {
        return new RetrieveQuery( RelayConstants.STUDY_LEVEL, "" );
    }
}
