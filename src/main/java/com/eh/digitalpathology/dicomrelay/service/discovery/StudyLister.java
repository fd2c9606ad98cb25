package com.eh.digitalpathology.dicomrelay.service.discovery;

import com.eh.digitalpathology.dicomrelay.model.DiscoveredStudy;

import java.io.IOException;
import java.util.List;

public interface StudyLister {

    List< DiscoveredStudy > listStudies ( ) throws IOException, InterruptedException;
}
