package com.eh.digitalpathology.dicomrelay.service.discovery;

import com.eh.digitalpathology.dicomrelay.api.OrthancRestClient;
import com.eh.digitalpathology.dicomrelay.exceptions.DicomWebException;
import com.eh.digitalpathology.dicomrelay.model.DiscoveredStudy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class OrthancRestStudyLister implements StudyLister {

    private static final Logger log = LoggerFactory.getLogger( OrthancRestStudyLister.class );

    private final OrthancRestClient restClient;
    private final Map< String, String > uidById = new ConcurrentHashMap<>( );

    public OrthancRestStudyLister ( OrthancRestClient restClient ) {
        this.restClient = restClient;
    }

    @Override
    public List< DiscoveredStudy > listStudies ( ) {
        List< String > ids = restClient.listStudyIds( ).block( );
        if ( ids == null ) {
            ids = List.of( );
        }
        uidById.keySet( ).retainAll( new HashSet<>( ids ) );

        List< DiscoveredStudy > studies = new ArrayList<>( );
        for ( String id : ids ) {
            String uid = uidById.get( id );
            if ( uid == null ) {
                uid = resolve( id );
                if ( uid == null ) {
                    continue;
                }
                uidById.put( id, uid );
            }
            studies.add( new DiscoveredStudy( id, uid ) );
        }
        log.debug( "listStudies :: {} studies listed, {} ids cached", studies.size( ), uidById.size( ) );
        return studies;
    }

    int cachedIds ( ) {
        return uidById.size( );
    }

    private String resolve ( String id ) {
        try {
            String uid = restClient.findStudyInstanceUid( id ).block( );
            if ( uid == null ) {
                log.warn( "resolve :: Study {} has no StudyInstanceUID, skipped", id );
            }
            return uid;
        } catch ( DicomWebException e ) {
            log.warn( "resolve :: Unable to read study {}: {}", id, e.getMessage( ) );
            return null;
        }
    }
}
