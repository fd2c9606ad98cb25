package com.eh.digitalpathology.dicomrelay.config;

import com.eh.digitalpathology.dicomrelay.api.DicomWebClient;
import com.eh.digitalpathology.dicomrelay.api.OrthancRestClient;
import com.eh.digitalpathology.dicomrelay.association.AssociationService;
import com.eh.digitalpathology.dicomrelay.association.RemoteNode;
import com.eh.digitalpathology.dicomrelay.multipart.MultipartTranscoder;
import com.eh.digitalpathology.dicomrelay.service.InboundTransferTracker;
import com.eh.digitalpathology.dicomrelay.service.deliver.CStoreStudyDeliverer;
import com.eh.digitalpathology.dicomrelay.service.deliver.FolderStudyDeliverer;
import com.eh.digitalpathology.dicomrelay.service.deliver.StowRsStudyDeliverer;
import com.eh.digitalpathology.dicomrelay.service.deliver.StudyDeliverer;
import com.eh.digitalpathology.dicomrelay.service.discovery.CFindStudyLister;
import com.eh.digitalpathology.dicomrelay.service.discovery.OrthancRestStudyLister;
import com.eh.digitalpathology.dicomrelay.service.discovery.QidoRsStudyLister;
import com.eh.digitalpathology.dicomrelay.service.discovery.StudyLister;
import com.eh.digitalpathology.dicomrelay.service.retrieve.CMoveStudyRetriever;
import com.eh.digitalpathology.dicomrelay.service.retrieve.StudyRetriever;
import com.eh.digitalpathology.dicomrelay.service.retrieve.WadoRsStudyRetriever;
import com.eh.digitalpathology.dicomrelay.service.storescp.InboundObjectReceiver;
import com.eh.digitalpathology.dicomrelay.util.CommonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the discovery, retrieval and delivery strategies from {@code relay.source.*} and
 * {@code relay.destination.*}.
 */
@Configuration
public class RelayStrategyConfig {

    private static final Logger log = LoggerFactory.getLogger( RelayStrategyConfig.class );

    @Bean
    public DicomWebClient sourceDicomWebClient ( CloseableHttpClient dicomWebHttpClient, ObjectMapper objectMapper, RelayConfig relayConfig ) {
        return new DicomWebClient( dicomWebHttpClient, objectMapper, relayConfig.getSource( ).getDicomWebUrl( ) );
    }

    @Bean
    public DicomWebClient destinationDicomWebClient ( CloseableHttpClient dicomWebHttpClient, ObjectMapper objectMapper, RelayConfig relayConfig ) {
        return new DicomWebClient( dicomWebHttpClient, objectMapper, relayConfig.getDestination( ).getDicomWebUrl( ) );
    }

    @Bean
    public StudyLister studyLister ( RelayConfig relayConfig, @Qualifier( "sourceDicomWebClient" ) DicomWebClient source, OrthancRestClient orthancRestClient, ObjectProvider< AssociationService > associationService ) {
        RelayConfig.DiscoveryMode mode = relayConfig.getSource( ).getDiscovery( );
        log.info( "studyLister :: Discovery mode {}", mode );
        return switch ( mode ) {
            case QIDO_RS -> new QidoRsStudyLister( source );
            case ORTHANC_REST -> new OrthancRestStudyLister( orthancRestClient );
            case C_FIND -> new CFindStudyLister( requireAssociationService( associationService, "discovery " + mode ), sourceNode( relayConfig ) );
        };
    }

    @Bean
    public StudyRetriever studyRetriever ( RelayConfig relayConfig, @Qualifier( "sourceDicomWebClient" ) DicomWebClient source, InboundTransferTracker transferTracker, CommonUtils commonUtils, ObjectProvider< AssociationService > associationService ) {
        RelayConfig.RetrievalMode mode = relayConfig.getSource( ).getRetrieval( );
        log.info( "studyRetriever :: Retrieval mode {}", mode );
        return switch ( mode ) {
            case WADO_RS -> new WadoRsStudyRetriever( source );
            case C_MOVE -> moveRetriever( relayConfig, transferTracker, commonUtils, requireAssociationService( associationService, "retrieval " + mode ) );
        };
    }

    @Bean
    public StudyDeliverer studyDeliverer ( RelayConfig relayConfig, @Qualifier( "destinationDicomWebClient" ) DicomWebClient destination, MultipartTranscoder transcoder, InboundObjectReceiver inboundObjectReceiver, ObjectProvider< AssociationService > associationService ) {
        RelayConfig.DeliveryMode mode = relayConfig.getDestination( ).getDelivery( );
        log.info( "studyDeliverer :: Delivery mode {}", mode );
        return switch ( mode ) {
            case STOW_RS -> new StowRsStudyDeliverer( destination, transcoder );
            case C_STORE -> new CStoreStudyDeliverer( requireAssociationService( associationService, "delivery " + mode ), destinationNode( relayConfig ) );
            case FOLDER -> new FolderStudyDeliverer( inboundObjectReceiver );
        };
    }

    private static StudyRetriever moveRetriever ( RelayConfig relayConfig, InboundTransferTracker transferTracker, CommonUtils commonUtils, AssociationService associationService ) {
        if ( !relayConfig.isListenerEnabled( ) ) {
            log.warn( "studyRetriever :: Retrieval by move with the inbound listener disabled; moves will only succeed if another listener stores into {}", commonUtils.getLocalStoragePath( ) );
        }
        return new CMoveStudyRetriever( associationService, transferTracker, sourceNode( relayConfig ), commonUtils.getAeName( ), relayConfig.getMoveQuiescence( ), relayConfig.getMoveTimeout( ) );
    }

    static RemoteNode sourceNode ( RelayConfig relayConfig ) {
        RelayConfig.Source source = relayConfig.getSource( );
        return new RemoteNode( source.getAeTitle( ), source.getHost( ), source.getPort( ) );
    }

    static RemoteNode destinationNode ( RelayConfig relayConfig ) {
        RelayConfig.Destination destination = relayConfig.getDestination( );
        return new RemoteNode( destination.getAeTitle( ), destination.getHost( ), destination.getPort( ) );
    }

    private static AssociationService requireAssociationService ( ObjectProvider< AssociationService > provider, String usage ) {
        AssociationService associationService = provider.getIfAvailable( );
        if ( associationService == null ) {
            throw new IllegalStateException( "Configured " + usage + " needs an AssociationService bean, but none is available" );
        }
        return associationService;
    }
}
