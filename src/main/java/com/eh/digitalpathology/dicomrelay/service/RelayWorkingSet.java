package com.eh.digitalpathology.dicomrelay.service;

import com.eh.digitalpathology.dicomrelay.model.DiscoveredStudy;
import com.eh.digitalpathology.dicomrelay.model.RelayState;
import com.eh.digitalpathology.dicomrelay.model.StudyRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class RelayWorkingSet {

    private final Map< String, StudyRecord > records = new ConcurrentHashMap<>( );

    public StudyRecord track ( DiscoveredStudy study ) {
        return records.computeIfAbsent( study.studyInstanceUid( ), uid -> StudyRecord.of( study ) );
    }

    public boolean isInFlight ( String studyInstanceUid ) {
        StudyRecord record = records.get( studyInstanceUid );
        return record != null && record.getState( ).isInFlight( );
    }

    public Optional< StudyRecord > get ( String studyInstanceUid ) {
        return Optional.ofNullable( records.get( studyInstanceUid ) );
    }

    public void remove ( String studyInstanceUid ) {
        records.remove( studyInstanceUid );
    }

    public int evictFailedNotIn ( Set< String > listedUids ) {
        int before = records.size( );
        records.values( ).removeIf( record -> record.getState( ) == RelayState.FAILED && !listedUids.contains( record.getStudyInstanceUid( ) ) );
        return before - records.size( );
    }

    public List< StudyRecord > snapshot ( ) {
        return List.copyOf( records.values( ) );
    }

    public int size ( ) {
        return records.size( );
    }
}
