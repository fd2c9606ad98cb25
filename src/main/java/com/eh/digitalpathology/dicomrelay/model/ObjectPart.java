package com.eh.digitalpathology.dicomrelay.model;

public record ObjectPart(String headerBlock, byte[] payload) {}
