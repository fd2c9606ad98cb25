package com.eh.digitalpathology.dicomrelay.service.retrieve;

import com.eh.digitalpathology.dicomrelay.api.DicomWebClient;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;

public class WadoRsStudyRetriever implements StudyRetriever {

    private final DicomWebClient source;

    public WadoRsStudyRetriever ( DicomWebClient source ) {
        this.source = source;
    }

    @Override
    public StudyPayload retrieve ( String studyInstanceUid ) {
        return source.retrieveStudy( studyInstanceUid );
    }
}
