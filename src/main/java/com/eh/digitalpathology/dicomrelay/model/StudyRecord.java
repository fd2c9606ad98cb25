package com.eh.digitalpathology.dicomrelay.model;

import java.time.Instant;

public class StudyRecord {

    private final String studyIdentifier;
    private final String studyInstanceUid;
    private RelayState state;
    private int attemptCount;
    private String lastError;
    private Instant lastAttemptTime;

    public StudyRecord ( String studyIdentifier, String studyInstanceUid ) {
        this.studyIdentifier = studyIdentifier;
        this.studyInstanceUid = studyInstanceUid;
        this.state = RelayState.DISCOVERED;
    }

    public static StudyRecord of ( DiscoveredStudy study ) {
        return new StudyRecord( study.studyIdentifier( ), study.studyInstanceUid( ) );
    }

    public void startAttempt ( ) {
        attemptCount++;
        lastAttemptTime = Instant.now( );
        state = RelayState.RETRIEVING;
    }

    public void transitionTo ( RelayState next ) {
        this.state = next;
    }

    public void markFailed ( String error ) {
        this.lastError = error;
        this.state = RelayState.FAILED;
    }

    public void markDelivered ( ) {
        this.lastError = null;
        this.state = RelayState.DELIVERED;
    }

    public String getStudyIdentifier ( ) {
        return studyIdentifier;
    }

    public String getStudyInstanceUid ( ) {
        return studyInstanceUid;
    }

    public RelayState getState ( ) {
        return state;
    }

    public int getAttemptCount ( ) {
        return attemptCount;
    }

    public String getLastError ( ) {
        return lastError;
    }

    public Instant getLastAttemptTime ( ) {
        return lastAttemptTime;
    }

    @Override
    public String toString ( ) {
        return "StudyRecord{" + "studyIdentifier='" + studyIdentifier + '\'' + ", studyInstanceUid='" + studyInstanceUid + '\'' + ", state=" + state + ", attemptCount=" + attemptCount + ", lastError='" + lastError + '\'' + ", lastAttemptTime=" + lastAttemptTime + '}';
    }
}
