package com.eh.digitalpathology.dicomrelay.service.deliver;

import com.eh.digitalpathology.dicomrelay.exceptions.DicomAttributesException;
import com.eh.digitalpathology.dicomrelay.model.DeliveryOutcome;
import com.eh.digitalpathology.dicomrelay.model.PayloadForm;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;
import com.eh.digitalpathology.dicomrelay.service.storescp.InboundObjectReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.util.ArrayList;
import java.util.List;

public class FolderStudyDeliverer implements StudyDeliverer {

    private static final Logger log = LoggerFactory.getLogger( FolderStudyDeliverer.class );

    private final InboundObjectReceiver receiver;

    public FolderStudyDeliverer ( InboundObjectReceiver receiver ) {
        this.receiver = receiver;
    }

    @Override
    public PayloadForm acceptedForm ( ) {
        return PayloadForm.INSTANCES;
    }

    @Override
    public DeliveryOutcome deliver ( String studyInstanceUid, StudyPayload payload ) {
        List< byte[] > instances = payload.getInstances( );
        List< String > failures = new ArrayList<>( );
        int delivered = 0;
        for ( int i = 0; i < instances.size( ); i++ ) {
            try {
                receiver.persist( instances.get( i ) );
                delivered++;
            } catch ( IOException | DicomAttributesException | InvalidPathException e ) {
                failures.add( "object " + ( i + 1 ) + ": " + e.getMessage( ) );
            } catch ( RuntimeException e ) {
                log.error( "deliver :: Unexpected failure persisting object {} of study {}", i + 1, studyInstanceUid, e );
                failures.add( "object " + ( i + 1 ) + ": " + e );
            }
        }
        return new DeliveryOutcome( instances.size( ), delivered, failures );
    }
}
