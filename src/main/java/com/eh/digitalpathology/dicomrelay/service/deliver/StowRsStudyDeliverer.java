package com.eh.digitalpathology.dicomrelay.service.deliver;

import com.eh.digitalpathology.dicomrelay.api.DicomWebClient;
import com.eh.digitalpathology.dicomrelay.model.DeliveryOutcome;
import com.eh.digitalpathology.dicomrelay.model.PayloadForm;
import com.eh.digitalpathology.dicomrelay.model.StowResult;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;
import com.eh.digitalpathology.dicomrelay.multipart.MultipartTranscoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class StowRsStudyDeliverer implements StudyDeliverer {

    private static final Logger log = LoggerFactory.getLogger( StowRsStudyDeliverer.class );

    private final DicomWebClient destination;
    private final MultipartTranscoder transcoder;

    public StowRsStudyDeliverer ( DicomWebClient destination, MultipartTranscoder transcoder ) {
        this.destination = destination;
        this.transcoder = transcoder;
    }

    @Override
    public PayloadForm acceptedForm ( ) {
        return PayloadForm.MULTIPART;
    }

    @Override
    public DeliveryOutcome deliver ( String studyInstanceUid, StudyPayload payload ) {
        int attempted = MultipartTranscoder.boundaryOf( payload.getContentType( ) ).map( boundary -> transcoder.countParts( payload.getBody( ), boundary ) ).orElse( 0 );
        if ( attempted == 0 ) {
            log.warn( "deliver :: Study {} has no objects to store", studyInstanceUid );
            return new DeliveryOutcome( 0, 0, List.of( "no objects in multipart body" ) );
        }
        StowResult result = destination.storeStudy( payload.getBody( ), payload.getContentType( ) );
        if ( result.isFullyStored( ) ) {
            return new DeliveryOutcome( attempted, attempted, List.of( ) );
        }
        int delivered = Math.max( 0, attempted - result.failedCount( ) );
        return new DeliveryOutcome( attempted, delivered, List.of( "store answered " + result.statusCode( ) + " with " + result.failedCount( ) + " refused instances" ) );
    }
}
