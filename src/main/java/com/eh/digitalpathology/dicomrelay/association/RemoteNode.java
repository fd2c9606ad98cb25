package com.eh.digitalpathology.dicomrelay.association;

public record RemoteNode(String aeTitle, String host, int port) {

    @Override
    public String toString ( ) {
        return aeTitle + "@" + host + ":" + port;
    }
}
