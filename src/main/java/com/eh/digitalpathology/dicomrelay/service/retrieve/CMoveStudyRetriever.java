package com.eh.digitalpathology.dicomrelay.service.retrieve;

import com.eh.digitalpathology.dicomrelay.association.AssociationService;
import com.eh.digitalpathology.dicomrelay.association.DimseResponse;
import com.eh.digitalpathology.dicomrelay.association.DimseStatus;
import com.eh.digitalpathology.dicomrelay.association.RemoteNode;
import com.eh.digitalpathology.dicomrelay.association.RetrieveQuery;
import com.eh.digitalpathology.dicomrelay.exceptions.AssociationException;
import com.eh.digitalpathology.dicomrelay.model.StudyPayload;
import com.eh.digitalpathology.dicomrelay.service.InboundTransferTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Retrieves a study by asking the source to move it to the local identity. The objects reach
 * the inbound listener on its own thread; completion is observed through the transfer tracker.
 * <p>
 * A move succeeds only when its final status is Success with no failed sub-operations and at
 * least {@code max(1, completed)} objects were received before the timeout. Objects whose Study
 * Instance UID cannot be read are credited to this move because moves run one at a time.
 */
public class CMoveStudyRetriever implements StudyRetriever {

    private static final Logger log = LoggerFactory.getLogger( CMoveStudyRetriever.class );

    private final AssociationService associationService;
    private final InboundTransferTracker transferTracker;
    private final RemoteNode source;
    private final String localAeTitle;
    private final Duration quiescence;
    private final Duration timeout;

    public CMoveStudyRetriever ( AssociationService associationService, InboundTransferTracker transferTracker, RemoteNode source, String localAeTitle, Duration quiescence, Duration timeout ) {
        this.associationService = associationService;
        this.transferTracker = transferTracker;
        this.source = source;
        this.localAeTitle = localAeTitle;
        this.quiescence = quiescence;
        this.timeout = timeout;
    }

    @Override
    public StudyPayload retrieve ( String studyInstanceUid ) throws IOException, InterruptedException {
        transferTracker.begin( studyInstanceUid );
        try {
            DimseResponse last = null;
            try ( Stream< DimseResponse > responses = associationService.move( source, RetrieveQuery.study( studyInstanceUid ), localAeTitle ) ) {
                Iterator< DimseResponse > iterator = responses.iterator( );
                while ( iterator.hasNext( ) ) {
                    last = iterator.next( );
                    if ( last.isPending( ) ) {
                        log.debug( "retrieve :: Move of study {} pending, {} completed so far", studyInstanceUid, last.completed( ) );
                    }
                }
            }
            if ( last == null || last.isPending( ) ) {
                throw new AssociationException( "NO_FINAL_STATUS", "Move of study " + studyInstanceUid + " ended without a final status" );
            }
            if ( !DimseStatus.isSuccess( last.status( ) ) ) {
                throw new AssociationException( DimseStatus.toHex( last.status( ) ), "Move of study " + studyInstanceUid + " ended with status " + DimseStatus.toHex( last.status( ) ) );
            }
            if ( last.failed( ) > 0 ) {
                throw new AssociationException( DimseStatus.toHex( DimseStatus.WARNING_SUB_OPERATIONS_FAILED ), "Move of study " + studyInstanceUid + " reported " + last.failed( ) + " failed sub-operations" );
            }

            List< Path > received = transferTracker.awaitCompletion( studyInstanceUid, last.completed( ), quiescence, timeout );
            int required = Math.max( 1, last.completed( ) );
            if ( received.size( ) < required ) {
                throw new AssociationException( "INCOMPLETE_TRANSFER", "Move of study " + studyInstanceUid + " delivered " + received.size( ) + " of " + required + " objects" );
            }
            log.info( "retrieve :: Move of study {} complete, {} objects received", studyInstanceUid, received.size( ) );

            List< byte[] > instances = new ArrayList<>( received.size( ) );
            for ( Path path : received ) {
                instances.add( Files.readAllBytes( path ) );
            }
            return StudyPayload.instances( instances );
        } finally {
            transferTracker.end( studyInstanceUid );
        }
    }
}
