package com.eh.digitalpathology.dicomrelay;

import com.eh.digitalpathology.dicomrelay.config.RelayConfig;
import com.eh.digitalpathology.dicomrelay.ledger.DedupLedger;
import com.eh.digitalpathology.dicomrelay.model.CycleSummary;
import com.eh.digitalpathology.dicomrelay.service.StudyDiscoveryPoller;
import com.eh.digitalpathology.dicomrelay.util.CommonUtils;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

import java.util.concurrent.ExecutorService;
import java.util.function.IntConsumer;

@SpringBootApplication
public class DicomRelayApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger( DicomRelayApplication.class.getName( ) );

    private final StudyDiscoveryPoller studyDiscoveryPoller;
    private final RelayConfig relayConfig;
    private final CommonUtils commonUtils;
    private final DedupLedger ledger;
    private final ExecutorService relayPollerExecutor;
    private final ApplicationContext applicationContext;
    private IntConsumer processExit = System::exit;

    @Autowired
    public DicomRelayApplication ( StudyDiscoveryPoller studyDiscoveryPoller, RelayConfig relayConfig, CommonUtils commonUtils, DedupLedger ledger, @Qualifier( "relayPollerExecutor" ) ExecutorService relayPollerExecutor, ApplicationContext applicationContext ) {
        this.studyDiscoveryPoller = studyDiscoveryPoller;
        this.relayConfig = relayConfig;
        this.commonUtils = commonUtils;
        this.ledger = ledger;
        this.relayPollerExecutor = relayPollerExecutor;
        this.applicationContext = applicationContext;
    }

    public static void main ( String[] args ) {
        SpringApplication.run( DicomRelayApplication.class, args );
    }

    @Override
    public void run ( String... args ) {
        log.info( "run :: receivedFiles :: {}", commonUtils.getLocalStoragePath( ) );
        log.info( "run :: ledger :: {} ({} studies already delivered)", ledger.getLedgerFile( ), ledger.size( ) );

        if ( relayConfig.isRunOnce( ) ) {
            log.info( "run :: ===========> Running a single relay cycle{}", relayConfig.getStudyUid( ) == null || relayConfig.getStudyUid( ).isBlank( ) ? "" : " for study " + relayConfig.getStudyUid( ) );
            CycleSummary summary = studyDiscoveryPoller.pollOnce( relayConfig.getStudyUid( ) );
            log.info( "run :: Single cycle finished: {} discovered, {} relayed, {} failed", summary.discovered( ), summary.relayed( ), summary.failed( ) );
            int exitCode = SpringApplication.exit( applicationContext, ( ) -> summary.isClean( ) ? 0 : 1 );
            log.info( "run :: Context closed, exiting with code {}", exitCode );
            processExit.accept( exitCode );
            return;
        }

        relayPollerExecutor.submit( ( ) -> {
            log.info( "run :: ===========> Starting study discovery poller..." );
            studyDiscoveryPoller.run( );
            log.info( "run :: Study discovery poller completed." );
        } );
    }

    @PreDestroy
    public void shutdown ( ) {
        studyDiscoveryPoller.stop( );
    }
}
