package com.eh.digitalpathology.dicomrelay.model;

public record InboundObject(String patientId, String studyInstanceUid, String seriesInstanceUid, String sopInstanceUid, byte[] rawBytes) {}
