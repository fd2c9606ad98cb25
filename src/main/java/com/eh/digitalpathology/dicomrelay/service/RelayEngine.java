package com.eh.digitalpathology.dicomrelay.service;

import com.eh.digitalpathology.dicomrelay.constants.RelayConstants;
import com.eh.digitalpathology.dicomrelay.ledger.DedupLedger;
import com.eh.digitalpathology.dicomrelay.model.DeliveryOutcome;
import com.eh.digitalpathology.dicomrelay.model.DiscoveredStudy;
import com.eh.digitalpathology.dicomrelay.model.MultipartBody;
import com.eh.digitalpathology.dicomrelay.model.PayloadForm;
import com.eh.digitalpathology.dicomrelay.model.RelayState;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;
import com.eh.digitalpathology.dicomrelay.model.StudyRecord;
import com.eh.digitalpathology.dicomrelay.multipart.MultipartTranscoder;
import com.eh.digitalpathology.dicomrelay.service.deliver.StudyDeliverer;
import com.eh.digitalpathology.dicomrelay.service.retrieve.StudyRetriever;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Relays one study: retrieve, transcode when the delivery form differs, deliver, evaluate,
 * and commit to the ledger only after every attempted object was confirmed.
 * <p>
 * Nothing thrown by a strategy escapes {@link #relay}; a failed study stays out of the ledger
 * and is picked up again by the next discovery cycle.
 */
@Service
public class RelayEngine {

    private static final Logger log = LoggerFactory.getLogger( RelayEngine.class );

    private final StudyRetriever retriever;
    private final StudyDeliverer deliverer;
    private final MultipartTranscoder transcoder;
    private final DedupLedger ledger;
    private final RelayWorkingSet workingSet;

    public RelayEngine ( StudyRetriever retriever, StudyDeliverer deliverer, MultipartTranscoder transcoder, DedupLedger ledger, RelayWorkingSet workingSet ) {
        this.retriever = retriever;
        this.deliverer = deliverer;
        this.transcoder = transcoder;
        this.ledger = ledger;
        this.workingSet = workingSet;
    }

    public boolean relay ( DiscoveredStudy study ) {
        StudyRecord record = workingSet.track( study );
        String uid = record.getStudyInstanceUid( );
        record.startAttempt( );
        log.info( "relay :: Relaying study {} (source id {}, attempt {})", uid, record.getStudyIdentifier( ), record.getAttemptCount( ) );
        try {
            StudyPayload retrieved = retriever.retrieve( uid );
            log.debug( "relay :: Study {} retrieved as {} ({} bytes)", uid, retrieved.getForm( ), retrieved.sizeInBytes( ) );

            StudyPayload deliverable = retrieved;
            if ( retrieved.getForm( ) != deliverer.acceptedForm( ) ) {
                record.transitionTo( RelayState.TRANSCODING );
                deliverable = transcode( uid, retrieved, deliverer.acceptedForm( ) );
            }

            record.transitionTo( RelayState.DELIVERING );
            DeliveryOutcome outcome = deliverer.deliver( uid, deliverable );
            if ( !outcome.isSuccess( ) ) {
                return fail( record, String.format( "delivered %d/%d objects%s", outcome.delivered( ), outcome.attempted( ), outcome.failures( ).isEmpty( ) ? "" : " " + outcome.failures( ) ) );
            }

            ledger.commit( uid );
            record.markDelivered( );
            workingSet.remove( uid );
            log.info( "relay :: Study {} delivered {}/{} objects", uid, outcome.delivered( ), outcome.attempted( ) );
            return true;
        } catch ( InterruptedException e ) {
            Thread.currentThread( ).interrupt( );
            return fail( record, "interrupted" );
        } catch ( Exception e ) {
            log.debug( "relay :: Study {} failed", uid, e );
            return fail( record, e.getClass( ).getSimpleName( ) + ": " + e.getMessage( ) );
        } catch ( StackOverflowError e ) {
            log.error( "relay :: Study {} exhausted the stack", uid );
            return fail( record, "StackOverflowError" );
        }
    }

    private StudyPayload transcode ( String uid, StudyPayload payload, PayloadForm target ) {
        if ( target == PayloadForm.INSTANCES ) {
            Optional< String > boundary = MultipartTranscoder.boundaryOf( payload.getContentType( ) );
            if ( boundary.isEmpty( ) ) {
                log.warn( "transcode :: Study {} has no boundary in Content-Type '{}', 0 objects extracted", uid, payload.getContentType( ) );
                return StudyPayload.instances( List.of( ) );
            }
            List< byte[] > instances = transcoder.split( payload.getBody( ), boundary.get( ) );
            log.debug( "transcode :: Study {} split into {} objects", uid, instances.size( ) );
            return StudyPayload.instances( instances );
        }
        MultipartBody body = transcoder.join( payload.getInstances( ), RelayConstants.APPLICATION_DICOM );
        log.debug( "transcode :: Study {} joined {} objects under boundary {}", uid, payload.getInstances( ).size( ), body.boundary( ) );
        return StudyPayload.multipart( body.body( ), body.contentType( ) );
    }

    private boolean fail ( StudyRecord record, String error ) {
        record.markFailed( error );
        log.warn( "relay :: Study {} not delivered on attempt {}, will retry: {}", record.getStudyInstanceUid( ), record.getAttemptCount( ), error );
        return false;
    }
}
