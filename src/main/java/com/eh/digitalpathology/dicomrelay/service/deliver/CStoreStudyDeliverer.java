package com.eh.digitalpathology.dicomrelay.service.deliver;

import com.eh.digitalpathology.dicomrelay.association.AssociationService;
import com.eh.digitalpathology.dicomrelay.association.DimseStatus;
import com.eh.digitalpathology.dicomrelay.association.RemoteNode;
import com.eh.digitalpathology.dicomrelay.model.DeliveryOutcome;
import com.eh.digitalpathology.dicomrelay.model.PayloadForm;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class CStoreStudyDeliverer implements StudyDeliverer {

    private static final Logger log = LoggerFactory.getLogger( CStoreStudyDeliverer.class );

    private final AssociationService associationService;
    private final RemoteNode destination;

    public CStoreStudyDeliverer ( AssociationService associationService, RemoteNode destination ) {
        this.associationService = associationService;
        this.destination = destination;
    }

    @Override
    public PayloadForm acceptedForm ( ) {
        return PayloadForm.INSTANCES;
    }

    @Override
    public DeliveryOutcome deliver ( String studyInstanceUid, StudyPayload payload ) throws InterruptedException {
        List< byte[] > instances = payload.getInstances( );
        List< String > failures = new ArrayList<>( );
        int delivered = 0;
        for ( int i = 0; i < instances.size( ); i++ ) {
            try {
                int status = associationService.store( destination, instances.get( i ) );
                if ( DimseStatus.isSuccess( status ) || DimseStatus.isWarning( status ) ) {
                    delivered++;
                } else {
                    failures.add( "object " + ( i + 1 ) + " status " + DimseStatus.toHex( status ) );
                }
            } catch ( IOException e ) {
                failures.add( "object " + ( i + 1 ) + ": " + e.getMessage( ) );
            }
        }
        if ( !failures.isEmpty( ) ) {
            log.warn( "deliver :: Study {} to {}: {} of {} objects stored, failures {}", studyInstanceUid, destination, delivered, instances.size( ), failures );
        }
        return new DeliveryOutcome( instances.size( ), delivered, failures );
    }
}
