package com.eh.digitalpathology.dicomrelay.service.retrieve;

import com.eh.digitalpathology.dicomrelay.api.DicomWebClient;
import com.eh.digitalpathology.dicomrelay.exceptions.DicomWebException;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WadoRsStudyRetrieverTest {

    @Mock
    private DicomWebClient dicomWebClient;

    @InjectMocks
    private WadoRsStudyRetriever retriever;

    @Test
    void retrieve_ReturnsWhatTheSourceAnswered() {
        StudyPayload payload = StudyPayload.multipart(new byte[] {1}, "multipart/related; boundary=B");
        when(dicomWebClient.retrieveStudy("1.2")).thenReturn(payload);

        assertSame(payload, retriever.retrieve("1.2"));
    }

    @Test
    void retrieve_PropagatesSourceErrors() {
        when(dicomWebClient.retrieveStudy("1.2")).thenThrow(new DicomWebException("missing", 404));

        assertThrows(DicomWebException.class, () -> retriever.retrieve("1.2"));
    }
}
