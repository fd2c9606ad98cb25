package com.eh.digitalpathology.dicomrelay.api;

import com.eh.digitalpathology.dicomrelay.exceptions.DicomWebException;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
public class OrthancRestClient {

    private final WebClient webClient;

    public OrthancRestClient ( @Qualifier( "sourceRestWebClient" ) WebClient webClient ) {
        this.webClient = webClient;
    }

    public Mono< List< String > > listStudyIds ( ) {
        return webClient.get( ).uri( "/studies" ).retrieve( )
                .onStatus( HttpStatusCode::isError, response -> toError( response, "listing studies" ) )
                .bodyToMono( new ParameterizedTypeReference< List< String > >( ) {
                } )
                .defaultIfEmpty( List.of( ) )
                .onErrorMap( WebClientRequestException.class, e -> new DicomWebException( "Source REST endpoint unreachable while listing studies", e ) );
    }

    public Mono< String > findStudyInstanceUid ( String studyId ) {
        return webClient.get( ).uri( "/studies/{id}", studyId ).retrieve( )
                .onStatus( HttpStatusCode::isError, response -> toError( response, "reading study " + studyId ) )
                .bodyToMono( JsonNode.class )
                .map( node -> node.path( "MainDicomTags" ).path( "StudyInstanceUID" ).asText( "" ) )
                .filter( StringUtils::isNotBlank )
                .onErrorMap( WebClientRequestException.class, e -> new DicomWebException( "Source REST endpoint unreachable while reading study " + studyId, e ) );
    }

    private static Mono< Throwable > toError ( ClientResponse response, String action ) {
        int status = response.statusCode( ).value( );
        return response.bodyToMono( String.class ).defaultIfEmpty( "" )
                .flatMap( body -> Mono.error( new DicomWebException( "Source REST endpoint answered " + status + " while " + action, status ) ) );
    }
}
