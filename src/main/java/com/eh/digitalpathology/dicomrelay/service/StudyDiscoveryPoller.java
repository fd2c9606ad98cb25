package com.eh.digitalpathology.dicomrelay.service;

import com.eh.digitalpathology.dicomrelay.config.RelayConfig;
import com.eh.digitalpathology.dicomrelay.ledger.DedupLedger;
import com.eh.digitalpathology.dicomrelay.model.CycleSummary;
import com.eh.digitalpathology.dicomrelay.model.DiscoveredStudy;
import com.eh.digitalpathology.dicomrelay.service.discovery.StudyLister;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Discovery loop: list the source, drop studies already in the ledger or in flight, relay the
 * rest, sleep. A failing cycle doubles the next sleep up to {@code relay.max-backoff}; a clean
 * cycle resets it to {@code relay.poll-interval}.
 */
@Service
public class StudyDiscoveryPoller implements Runnable {

    private static final Logger log = LoggerFactory.getLogger( StudyDiscoveryPoller.class );

    public enum PollerState { IDLE, QUERYING, DIFFING }

    private final StudyLister studyLister;
    private final DedupLedger ledger;
    private final RelayWorkingSet workingSet;
    private final RelayEngine relayEngine;
    private final RelayConfig relayConfig;

    private final CountDownLatch stopSignal = new CountDownLatch( 1 );
    private volatile PollerState state = PollerState.IDLE;
    private int consecutiveFailedCycles;

    public StudyDiscoveryPoller ( StudyLister studyLister, DedupLedger ledger, RelayWorkingSet workingSet, RelayEngine relayEngine, RelayConfig relayConfig ) {
        this.studyLister = studyLister;
        this.ledger = ledger;
        this.workingSet = workingSet;
        this.relayEngine = relayEngine;
        this.relayConfig = relayConfig;
    }

    @Override
    public void run ( ) {
        log.info( "run :: Discovery loop started, poll interval {}s, max backoff {}s", relayConfig.getPollInterval( ).toSeconds( ), relayConfig.getMaxBackoff( ).toSeconds( ) );
        while ( !isStopRequested( ) && !Thread.currentThread( ).isInterrupted( ) ) {
            CycleSummary summary;
            try {
                summary = pollOnce( null );
            } catch ( RuntimeException | Error e ) {
                log.error( "run :: Discovery cycle aborted, the loop keeps running", e );
                state = PollerState.IDLE;
                summary = CycleSummary.listingFailure( );
            }
            Duration delay = nextDelay( summary );
            if ( !summary.isClean( ) ) {
                log.info( "run :: Cycle had failures, next poll in {}s", delay.toSeconds( ) );
            }
            try {
                if ( stopSignal.await( delay.toMillis( ), TimeUnit.MILLISECONDS ) ) {
                    break;
                }
            } catch ( InterruptedException e ) {
                Thread.currentThread( ).interrupt( );
            }
        }
        state = PollerState.IDLE;
        log.info( "run :: Discovery loop stopped" );
    }

    /**
     * One discovery cycle followed by the relay of every newly discovered study.
     *
     * @param onlyStudyUid when not blank, every other study is ignored
     */
    public CycleSummary pollOnce ( String onlyStudyUid ) {
        List< DiscoveredStudy > listed;
        try {
            listed = listSource( );
        } catch ( InterruptedException e ) {
            Thread.currentThread( ).interrupt( );
            return CycleSummary.listingFailure( );
        } catch ( Exception e ) {
            log.warn( "pollOnce :: Unable to list studies at the source, treating as 0 studies: {}", e.getMessage( ) );
            state = PollerState.IDLE;
            return CycleSummary.listingFailure( );
        }

        List< DiscoveredStudy > fresh = discover( listed, onlyStudyUid );
        int relayed = 0;
        int failed = 0;
        for ( DiscoveredStudy study : fresh ) {
            if ( isStopRequested( ) || Thread.currentThread( ).isInterrupted( ) ) {
                log.info( "pollOnce :: Stop requested, {} studies left for a later run", fresh.size( ) - relayed - failed );
                break;
            }
            if ( relayEngine.relay( study ) ) {
                relayed++;
            } else {
                failed++;
            }
        }
        CycleSummary summary = new CycleSummary( listed.size( ), fresh.size( ), relayed, failed, false );
        if ( fresh.isEmpty( ) ) {
            log.debug( "pollOnce :: {} studies listed, nothing new", listed.size( ) );
        } else {
            log.info( "pollOnce :: Cycle summary: {} listed, {} discovered, {} relayed, {} failed", summary.listed( ), summary.discovered( ), summary.relayed( ), summary.failed( ) );
        }
        return summary;
    }

    /**
     * Studies from {@code listed} that are neither committed nor currently being relayed,
     * without duplicates, in listing order.
     */
    public List< DiscoveredStudy > discover ( List< DiscoveredStudy > listed, String onlyStudyUid ) {
        state = PollerState.DIFFING;
        Set< String > seen = new HashSet<>( );
        List< DiscoveredStudy > fresh = new ArrayList<>( );
        for ( DiscoveredStudy study : listed ) {
            String uid = study.studyInstanceUid( );
            if ( StringUtils.isBlank( uid ) || !seen.add( uid ) ) {
                continue;
            }
            if ( StringUtils.isNotBlank( onlyStudyUid ) && !onlyStudyUid.equals( uid ) ) {
                continue;
            }
            if ( ledger.contains( uid ) || workingSet.isInFlight( uid ) ) {
                continue;
            }
            fresh.add( study );
        }
        int evicted = workingSet.evictFailedNotIn( seen );
        if ( evicted > 0 ) {
            log.info( "discover :: Dropped {} failed studies no longer listed at the source", evicted );
        }
        state = PollerState.IDLE;
        return fresh;
    }

    public void stop ( ) {
        log.info( "stop :: Stop requested" );
        stopSignal.countDown( );
    }

    public boolean isStopRequested ( ) {
        return stopSignal.getCount( ) == 0;
    }

    public PollerState getState ( ) {
        return state;
    }

    Duration nextDelay ( CycleSummary summary ) {
        if ( summary.isClean( ) ) {
            consecutiveFailedCycles = 0;
        } else {
            consecutiveFailedCycles++;
        }
        return backoffDelay( consecutiveFailedCycles );
    }

    Duration backoffDelay ( int failedCycles ) {
        Duration interval = relayConfig.getPollInterval( );
        Duration cap = relayConfig.getMaxBackoff( ).compareTo( interval ) < 0 ? interval : relayConfig.getMaxBackoff( );
        if ( failedCycles <= 0 ) {
            return interval;
        }
        if ( failedCycles >= 30 ) {
            return cap;
        }
        Duration delay = interval.multipliedBy( 1L << failedCycles );
        return delay.compareTo( cap ) > 0 ? cap : delay;
    }

    private List< DiscoveredStudy > listSource ( ) throws IOException, InterruptedException {
        state = PollerState.QUERYING;
        return studyLister.listStudies( );
    }
}
