package com.eh.digitalpathology.dicomrelay.association;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Contract of the external association protocol engine. The relay only consumes it; the
 * engine owns connection establishment, negotiation, framing and its own listener threads.
 */
public interface AssociationService {

    int store ( RemoteNode destination, byte[] encoded ) throws IOException, InterruptedException;

    /**
     * Runs a find at {@code source}. Pending responses carry matches; the last element carries
     * the final status.
     */
    Stream< DimseResponse > find ( RemoteNode source, RetrieveQuery query ) throws IOException, InterruptedException;

    /**
     * Asks {@code source} to send the matching objects to {@code destinationAeTitle}. Pending
     * responses report progress; the last element carries the final status and sub-operation counts.
     */
    Stream< DimseResponse > move ( RemoteNode source, RetrieveQuery query, String destinationAeTitle ) throws IOException, InterruptedException;

    void registerInboundHandler ( InboundHandler handler );

    void startListener ( String aeTitle, int port ) throws IOException;

    void stopListener ( );
}
