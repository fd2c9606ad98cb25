package com.eh.digitalpathology.dicomrelay.model;

public enum PayloadForm {
    MULTIPART,
    INSTANCES
}
