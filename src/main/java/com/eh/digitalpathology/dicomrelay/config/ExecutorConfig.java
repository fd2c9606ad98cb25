package com.eh.digitalpathology.dicomrelay.config;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger( ExecutorConfig.class );

    private ExecutorService relayPollerExecutor;

    @Bean( name = "relayPollerExecutor" )
    public ExecutorService relayPollerExecutor ( ) {
        // one logical thread: discovery and relay never run concurrently
        this.relayPollerExecutor = Executors.newSingleThreadExecutor( r -> new Thread( r, "RelayPoller-Thread" ) );
        return this.relayPollerExecutor;
    }

    @PreDestroy
    public void shutdownExecutors ( ) {
        shutdownExecutor( relayPollerExecutor, "Relay Poller ExecutorService" );
    }

    private void shutdownExecutor ( ExecutorService executor, String name ) {
        if ( executor != null ) {
            executor.shutdown( );
            try {
                if ( !executor.awaitTermination( 60, TimeUnit.SECONDS ) ) {
                    executor.shutdownNow( );
                    if ( !executor.awaitTermination( 60, TimeUnit.SECONDS ) ) {
                        log.error( "{} did not terminate", name );
                    }
                }
            } catch ( InterruptedException ex ) {
                executor.shutdownNow( );
                Thread.currentThread( ).interrupt( );
            }
        }
    }
}
