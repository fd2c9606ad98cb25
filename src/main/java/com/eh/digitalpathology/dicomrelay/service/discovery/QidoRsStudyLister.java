package com.eh.digitalpathology.dicomrelay.service.discovery;

import com.eh.digitalpathology.dicomrelay.api.DicomWebClient;
import com.eh.digitalpathology.dicomrelay.model.DiscoveredStudy;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class QidoRsStudyLister implements StudyLister {

    private static final Logger log = LoggerFactory.getLogger( QidoRsStudyLister.class );

    static final String STUDY_INSTANCE_UID_TAG = "0020000D";
    static final String STUDY_INSTANCE_UID_KEYWORD = "StudyInstanceUID";

    private final DicomWebClient source;

    public QidoRsStudyLister ( DicomWebClient source ) {
        this.source = source;
    }

    @Override
    public List< DiscoveredStudy > listStudies ( ) {
        List< DiscoveredStudy > studies = new ArrayList<>( );
        for ( JsonNode match : source.searchStudies( ) ) {
            String uid = studyInstanceUid( match );
            if ( StringUtils.isBlank( uid ) ) {
                log.debug( "listStudies :: Skipping match without StudyInstanceUID" );
                continue;
            }
            studies.add( new DiscoveredStudy( uid, uid ) );
        }
        log.debug( "listStudies :: {} studies at {}", studies.size( ), source.getBaseUrl( ) );
        return studies;
    }

    static String studyInstanceUid ( JsonNode match ) {
        JsonNode tagged = match.path( STUDY_INSTANCE_UID_TAG ).path( "Value" ).path( 0 );
        if ( tagged.isTextual( ) ) {
            return tagged.asText( ).trim( );
        }
        // some servers answer with keyword keyed JSON instead of DICOM JSON
        JsonNode keyword = match.path( STUDY_INSTANCE_UID_KEYWORD );
        return keyword.isTextual( ) ? keyword.asText( ).trim( ) : null;
    }
}
