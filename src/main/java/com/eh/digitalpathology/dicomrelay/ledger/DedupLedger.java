package com.eh.digitalpathology.dicomrelay.ledger;

import com.eh.digitalpathology.dicomrelay.config.RelayConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Durable set of Study Instance UIDs that have been fully delivered.
 * <p>
 * The whole set is rewritten on every commit (temp file, then rename), so a crash leaves
 * either the previous or the new ledger on disk. All access is serialized on this instance;
 * the poller thread and the inbound listener may both touch it.
 */
@Component
public class DedupLedger {

    private static final Logger log = LoggerFactory.getLogger( DedupLedger.class );

    private final Path ledgerFile;
    private final ObjectMapper objectMapper;
    private final Set< String > delivered = new HashSet<>( );

    @Autowired
    public DedupLedger ( RelayConfig relayConfig ) {
        this( Paths.get( relayConfig.getLedgerFile( ) ) );
    }

    public DedupLedger ( Path ledgerFile ) {
        this.ledgerFile = ledgerFile.toAbsolutePath( );
        this.objectMapper = new ObjectMapper( ).enable( SerializationFeature.INDENT_OUTPUT );
    }

    @PostConstruct
    public void init ( ) {
        load( );
    }

    /**
     * Replaces the in-memory set with the persisted one. A missing or unreadable file yields
     * an empty ledger; startup is never blocked.
     */
    public synchronized Set< String > load ( ) {
        delivered.clear( );
        if ( !Files.exists( ledgerFile ) ) {
            log.info( "load :: No ledger at {}, starting empty", ledgerFile );
            return snapshot( );
        }
        try {
            List< String > uids = objectMapper.readValue( ledgerFile.toFile( ), new TypeReference< List< String > >( ) {
            } );
            if ( uids != null ) {
                uids.stream( ).filter( uid -> uid != null && !uid.isBlank( ) ).forEach( delivered::add );
            }
            log.info( "load :: Loaded {} previously delivered studies from {}", delivered.size( ), ledgerFile );
        } catch ( IOException e ) {
            log.error( "load :: Unable to read ledger {}, starting empty: {}", ledgerFile, e.getMessage( ) );
            delivered.clear( );
        }
        return snapshot( );
    }

    /**
     * Adds {@code studyInstanceUid} and rewrites the ledger file before returning.
     *
     * @return true when the ledger was persisted; false when only the in-memory set was updated
     */
    public synchronized boolean commit ( String studyInstanceUid ) {
        delivered.add( studyInstanceUid );
        try {
            persist( );
            log.debug( "commit :: Study {} committed, ledger size {}", studyInstanceUid, delivered.size( ) );
            return true;
        } catch ( IOException e ) {
            log.error( "commit :: Study {} committed in memory only; ledger {} could not be written: {}", studyInstanceUid, ledgerFile, e.getMessage( ) );
            return false;
        }
    }

    public synchronized boolean contains ( String studyInstanceUid ) {
        return delivered.contains( studyInstanceUid );
    }

    public synchronized int size ( ) {
        return delivered.size( );
    }

    public synchronized Set< String > snapshot ( ) {
        return Collections.unmodifiableSet( new TreeSet<>( delivered ) );
    }

    public Path getLedgerFile ( ) {
        return ledgerFile;
    }

    private void persist ( ) throws IOException {
        Path parent = ledgerFile.getParent( );
        if ( parent != null ) {
            Files.createDirectories( parent );
        }
        Path temp = ledgerFile.resolveSibling( ledgerFile.getFileName( ) + ".tmp" );
        objectMapper.writeValue( temp.toFile( ), new TreeSet<>( delivered ) );
        try {
            Files.move( temp, ledgerFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE );
        } catch ( AtomicMoveNotSupportedException e ) {
            Files.move( temp, ledgerFile, StandardCopyOption.REPLACE_EXISTING );
        }
    }
}
