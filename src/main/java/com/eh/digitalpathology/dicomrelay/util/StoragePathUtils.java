package com.eh.digitalpathology.dicomrelay.util;

import com.eh.digitalpathology.dicomrelay.constants.RelayConstants;
import com.eh.digitalpathology.dicomrelay.model.InboundObject;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Storage layout of received objects:
 * {@code root/<patientID>/<studyInstanceUID>/<seriesInstanceUID>/<sopInstanceUID>.dcm}.
 * Missing patient, study or series values become {@value RelayConstants#UNKNOWN}; a missing
 * SOP Instance UID becomes a time based synthetic name so unnamed objects never overwrite each other.
 * Separators and control characters inside a value are replaced with {@code _}.
 */
public class StoragePathUtils {

    private StoragePathUtils ( ) {
    }

    public static Path resolve ( Path root, InboundObject object ) {
        String patient = segment( object.patientId( ) );
        String study = segment( object.studyInstanceUid( ) );
        String series = segment( object.seriesInstanceUid( ) );
        String sop = StringUtils.isBlank( object.sopInstanceUid( ) ) ? syntheticInstanceName( ) : sanitize( object.sopInstanceUid( ).trim( ) );
        return root.resolve( patient ).resolve( study ).resolve( series ).resolve( sop + RelayConstants.DICOM_FILE_EXTENSION );
    }

    public static String sanitize ( String value ) {
        StringBuilder builder = new StringBuilder( value.length( ) );
        for ( char c : value.toCharArray( ) ) {
            boolean unsafe = c == '/' || c == '\\' || c < 0x20 || c == 0x7F;
            builder.append( unsafe ? '_' : c );
        }
        String cleaned = builder.toString( );
        if ( cleaned.equals( "." ) || cleaned.equals( ".." ) ) {
            return "_";
        }
        return cleaned;
    }

    static String syntheticInstanceName ( ) {
        return RelayConstants.SYNTHETIC_INSTANCE_PREFIX + System.currentTimeMillis( ) + "_" + UUID.randomUUID( ).toString( ).substring( 0, 8 );
    }

    private static String segment ( String value ) {
        return StringUtils.isBlank( value ) ? RelayConstants.UNKNOWN : sanitize( value.trim( ) );
    }
}
