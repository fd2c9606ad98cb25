package com.eh.digitalpathology.dicomrelay.service;

import com.eh.digitalpathology.dicomrelay.association.AssociationService;
import com.eh.digitalpathology.dicomrelay.config.RelayConfig;
import com.eh.digitalpathology.dicomrelay.service.storescp.InboundObjectReceiver;
import com.eh.digitalpathology.dicomrelay.util.CommonUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class AssociationListenerRunner {

    private static final Logger log = LoggerFactory.getLogger( AssociationListenerRunner.class );

    private final ObjectProvider< AssociationService > associationServiceProvider;
    private final InboundObjectReceiver inboundObjectReceiver;
    private final CommonUtils commonUtils;
    private final RelayConfig relayConfig;

    private volatile AssociationService startedService;

    public AssociationListenerRunner ( ObjectProvider< AssociationService > associationServiceProvider, InboundObjectReceiver inboundObjectReceiver, CommonUtils commonUtils, RelayConfig relayConfig ) {
        this.associationServiceProvider = associationServiceProvider;
        this.inboundObjectReceiver = inboundObjectReceiver;
        this.commonUtils = commonUtils;
        this.relayConfig = relayConfig;
    }

    @PostConstruct
    public void startListener ( ) {
        if ( !relayConfig.isListenerEnabled( ) ) {
            log.info( "startListener :: Inbound listener disabled" );
            return;
        }
        AssociationService associationService = associationServiceProvider.getIfAvailable( );
        if ( associationService == null ) {
            log.info( "startListener :: No association service available, inbound listener not started" );
            return;
        }
        associationService.registerInboundHandler( inboundObjectReceiver );
        startedService = associationService;
        new Thread( ( ) -> {
            try {
                log.debug( "startListener :: Starting inbound listener as {} on port {}", commonUtils.getAeName( ), commonUtils.getPort( ) );
                associationService.startListener( commonUtils.getAeName( ), commonUtils.getPort( ) );
                log.info( "startListener :: Inbound listener started as {} on port {}", commonUtils.getAeName( ), commonUtils.getPort( ) );
            } catch ( IOException e ) {
                log.error( "startListener :: Failed to start inbound listener", e );
            }
        }, "AssociationListener-Thread" ).start( );
    }

    @PreDestroy
    public void stopListener ( ) {
        AssociationService associationService = startedService;
        if ( associationService != null ) {
            log.info( "stopListener :: Stopping inbound listener" );
            associationService.stopListener( );
            startedService = null;
        }
    }
}
