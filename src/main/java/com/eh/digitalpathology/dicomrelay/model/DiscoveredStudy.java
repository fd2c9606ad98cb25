package com.eh.digitalpathology.dicomrelay.model;

public record DiscoveredStudy(String studyIdentifier, String studyInstanceUid) {}
