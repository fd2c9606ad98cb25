package com.eh.digitalpathology.dicomrelay.association;

@FunctionalInterface
public interface InboundHandler {

    int onObjectReceived ( byte[] encoded );
}
