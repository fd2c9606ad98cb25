package com.eh.digitalpathology.dicomrelay.service.deliver;

import com.eh.digitalpathology.dicomrelay.model.DeliveryOutcome;
import com.eh.digitalpathology.dicomrelay.model.PayloadForm;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;

import java.io.IOException;

public interface StudyDeliverer {

    PayloadForm acceptedForm ( );

    DeliveryOutcome deliver ( String studyInstanceUid, StudyPayload payload ) throws IOException, InterruptedException;
}
