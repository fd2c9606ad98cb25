package com.eh.digitalpathology.dicomrelay.service.discovery;

import com.eh.digitalpathology.dicomrelay.association.AssociationService;
import com.eh.digitalpathology.dicomrelay.association.DimseResponse;
import com.eh.digitalpathology.dicomrelay.association.DimseStatus;
import com.eh.digitalpathology.dicomrelay.association.RemoteNode;
import com.eh.digitalpathology.dicomrelay.association.RetrieveQuery;
import com.eh.digitalpathology.dicomrelay.exceptions.AssociationException;
import com.eh.digitalpathology.dicomrelay.model.DiscoveredStudy;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

public class CFindStudyLister implements StudyLister {

    private static final Logger log = LoggerFactory.getLogger( CFindStudyLister.class );

    private final AssociationService associationService;
    private final RemoteNode source;

    public CFindStudyLister ( AssociationService associationService, RemoteNode source ) {
        this.associationService = associationService;
        this.source = source;
    }

    @Override
    public List< DiscoveredStudy > listStudies ( ) throws IOException, InterruptedException {
        List< DiscoveredStudy > studies = new ArrayList<>( );
        int finalStatus = -1;
        try ( Stream< DimseResponse > responses = associationService.find( source, RetrieveQuery.allStudies( ) ) ) {
            Iterator< DimseResponse > iterator = responses.iterator( );
            while ( iterator.hasNext( ) ) {
                DimseResponse response = iterator.next( );
                if ( response.isPending( ) ) {
                    String uid = response.get( "StudyInstanceUID" );
                    if ( StringUtils.isNotBlank( uid ) ) {
                        studies.add( new DiscoveredStudy( uid.trim( ), uid.trim( ) ) );
                    }
                } else {
                    finalStatus = response.status( );
                }
            }
        }
        if ( !DimseStatus.isSuccess( finalStatus ) ) {
            throw new AssociationException( finalStatus < 0 ? "NO_FINAL_STATUS" : DimseStatus.toHex( finalStatus ), "Study find at " + source + " did not complete successfully" );
        }
        log.debug( "listStudies :: {} studies at {}", studies.size( ), source );
        return studies;
    }
}
