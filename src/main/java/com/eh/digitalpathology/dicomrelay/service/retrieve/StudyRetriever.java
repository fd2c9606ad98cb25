package com.eh.digitalpathology.dicomrelay.service.retrieve;

import com.eh.digitalpathology.dicomrelay.model.StudyPayload;

import java.io.IOException;

public interface StudyRetriever {

    StudyPayload retrieve ( String studyInstanceUid ) throws IOException, InterruptedException;
}
