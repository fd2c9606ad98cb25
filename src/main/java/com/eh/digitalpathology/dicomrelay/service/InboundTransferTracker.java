package com.eh.digitalpathology.dicomrelay.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-study counters of objects pushed to the local listener while a move is in progress.
 * <p>
 * The listener thread only calls {@link #record}, which takes the lock briefly and never waits.
 * The orchestrator opens a transfer with {@link #begin}, blocks in {@link #awaitCompletion}
 * and closes it with {@link #end}. Objects for a study without an open transfer are not counted.
 * An object whose Study Instance UID could not be read (deflated transfer syntax) is counted
 * against the open transfer when exactly one is open, and dropped otherwise.
 */
@Service
public class InboundTransferTracker {

    private static final Logger log = LoggerFactory.getLogger( InboundTransferTracker.class );

    private final ReentrantLock lock = new ReentrantLock( );
    private final Condition arrived = lock.newCondition( );
    private final Map< String, Transfer > transfers = new HashMap<>( );

    public void begin ( String studyInstanceUid ) {
        lock.lock( );
        try {
            transfers.put( studyInstanceUid, new Transfer( System.nanoTime( ) ) );
        } finally {
            lock.unlock( );
        }
        log.debug( "begin :: Tracking inbound objects for study {}", studyInstanceUid );
    }

    /**
     * @return true when the object was counted against an open transfer
     */
    public boolean record ( String studyInstanceUid, Path storedAt ) {
        lock.lock( );
        try {
            Transfer transfer = studyInstanceUid == null ? soleOpenTransfer( storedAt ) : transfers.get( studyInstanceUid );
            if ( transfer == null ) {
                return false;
            }
            transfer.paths.add( storedAt );
            transfer.lastActivityNanos = System.nanoTime( );
            arrived.signalAll( );
            return true;
        } finally {
            lock.unlock( );
        }
    }

    public int receivedCount ( String studyInstanceUid ) {
        lock.lock( );
        try {
            Transfer transfer = transfers.get( studyInstanceUid );
            return transfer == null ? 0 : transfer.paths.size( );
        } finally {
            lock.unlock( );
        }
    }

    /**
     * Blocks until {@code expected} objects arrived (when {@code expected > 0}) or, when the
     * count is unknown, until no object arrived for {@code quiescence}. Never longer than
     * {@code timeout}.
     *
     * @return paths of the objects received so far, in arrival order
     */
    public List< Path > awaitCompletion ( String studyInstanceUid, int expected, Duration quiescence, Duration timeout ) throws InterruptedException {
        long deadline = System.nanoTime( ) + timeout.toNanos( );
        long quietNanos = quiescence.toNanos( );
        lock.lock( );
        try {
            Transfer transfer = transfers.get( studyInstanceUid );
            if ( transfer == null ) {
                return List.of( );
            }
            transfer.lastActivityNanos = Math.max( transfer.lastActivityNanos, System.nanoTime( ) );
            while ( true ) {
                long now = System.nanoTime( );
                if ( expected > 0 && transfer.paths.size( ) >= expected ) {
                    break;
                }
                long remaining = deadline - now;
                if ( remaining <= 0 ) {
                    log.warn( "awaitCompletion :: Timed out on study {} with {} of {} objects received", studyInstanceUid, transfer.paths.size( ), expected > 0 ? expected : "?" );
                    break;
                }
                if ( expected <= 0 ) {
                    long quietRemaining = transfer.lastActivityNanos + quietNanos - now;
                    if ( quietRemaining <= 0 ) {
                        break;
                    }
                    remaining = Math.min( remaining, quietRemaining );
                }
                arrived.awaitNanos( remaining );
            }
            return List.copyOf( transfer.paths );
        } finally {
            lock.unlock( );
        }
    }

    public List< Path > end ( String studyInstanceUid ) {
        lock.lock( );
        try {
            Transfer transfer = transfers.remove( studyInstanceUid );
            return transfer == null ? List.of( ) : List.copyOf( transfer.paths );
        } finally {
            lock.unlock( );
        }
    }

    private Transfer soleOpenTransfer ( Path storedAt ) {
        if ( transfers.size( ) != 1 ) {
            log.warn( "record :: Object {} has no readable study UID and {} transfers are open, not counted", storedAt.getFileName( ), transfers.size( ) );
            return null;
        }
        return transfers.values( ).iterator( ).next( );
    }

    private static final class Transfer {
        private final List< Path > paths = new ArrayList<>( );
        private long lastActivityNanos;

        private Transfer ( long startedNanos ) {
            this.lastActivityNanos = startedNanos;
        }
    }
}
