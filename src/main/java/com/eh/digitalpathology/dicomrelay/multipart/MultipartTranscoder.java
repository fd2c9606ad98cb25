package com.eh.digitalpathology.dicomrelay.multipart;

import com.eh.digitalpathology.dicomrelay.constants.RelayConstants;
import com.eh.digitalpathology.dicomrelay.model.MultipartBody;
import com.eh.digitalpathology.dicomrelay.model.MultipartMessage;
import com.eh.digitalpathology.dicomrelay.model.ObjectPart;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Converts between a multipart/related body and the individual objects it frames.
 * <p>
 * Splitting follows the framing rules of multipart bodies: the segment before the first
 * boundary marker and the segment after the last one are framing and are discarded, the
 * payload of every other segment starts after its first blank line, and the line break that
 * precedes the next boundary marker belongs to that marker, not to the payload.
 * Malformed input never throws; it simply yields fewer (possibly zero) objects.
 */
@Component
public class MultipartTranscoder {

    private static final Logger log = LoggerFactory.getLogger( MultipartTranscoder.class );

    private static final byte[] CRLF = "\r\n".getBytes( StandardCharsets.US_ASCII );
    private static final byte[] LF = "\n".getBytes( StandardCharsets.US_ASCII );
    private static final byte[] CRLF_SEPARATOR = "\r\n\r\n".getBytes( StandardCharsets.US_ASCII );
    private static final byte[] LF_SEPARATOR = "\n\n".getBytes( StandardCharsets.US_ASCII );
    private static final int MAX_BOUNDARY_ATTEMPTS = 10;

    private final Supplier< String > boundaryGenerator;

    public MultipartTranscoder ( ) {
        this( MultipartTranscoder::randomBoundary );
    }

    MultipartTranscoder ( Supplier< String > boundaryGenerator ) {
        this.boundaryGenerator = boundaryGenerator;
    }

    public List< byte[] > split ( byte[] body, String boundary ) {
        return parse( body, boundary ).payloads( );
    }

    public MultipartMessage parse ( byte[] body, String boundary ) {
        if ( body == null || body.length == 0 || StringUtils.isBlank( boundary ) ) {
            log.warn( "parse :: Empty body or missing boundary, 0 objects extracted" );
            return new MultipartMessage( boundary, List.of( ) );
        }
        byte[] delimiter = ( "--" + boundary ).getBytes( StandardCharsets.US_ASCII );
        List< Integer > markers = findAll( body, delimiter );
        if ( markers.isEmpty( ) ) {
            log.warn( "parse :: Boundary '{}' not found in {} byte body, 0 objects extracted", boundary, body.length );
            return new MultipartMessage( boundary, List.of( ) );
        }

        List< ObjectPart > parts = new ArrayList<>( );
        for ( int i = 0; i < markers.size( ) - 1; i++ ) {
            int start = markers.get( i ) + delimiter.length;
            int end = markers.get( i + 1 );
            int[] range = payloadRange( body, start, end );
            if ( range != null ) {
                String headers = new String( body, start, range[ 0 ] - start, StandardCharsets.ISO_8859_1 ).strip( );
                parts.add( new ObjectPart( headers, Arrays.copyOfRange( body, range[ 1 ], range[ 2 ] ) ) );
            }
        }
        if ( parts.isEmpty( ) ) {
            log.warn( "parse :: No part with a header/body separator in {} byte body, 0 objects extracted", body.length );
        } else {
            log.debug( "parse :: Extracted {} objects from multipart body", parts.size( ) );
        }
        return new MultipartMessage( boundary, parts );
    }

    /**
     * Frames {@code objects} into one multipart/related body under a freshly generated boundary
     * that does not occur inside any payload.
     */
    public MultipartBody join ( List< byte[] > objects, String partContentType ) {
        String contentType = StringUtils.defaultIfBlank( partContentType, RelayConstants.APPLICATION_DICOM );
        String boundary = chooseBoundary( objects );
        byte[] delimiter = ( "--" + boundary ).getBytes( StandardCharsets.US_ASCII );
        byte[] partHeader = ( "\r\nContent-Type: " + contentType + "\r\n\r\n" ).getBytes( StandardCharsets.US_ASCII );

        ByteArrayOutputStream out = new ByteArrayOutputStream( );
        for ( byte[] object : objects ) {
            out.writeBytes( delimiter );
            out.writeBytes( partHeader );
            out.writeBytes( object );
            out.writeBytes( CRLF );
        }
        out.writeBytes( delimiter );
        out.writeBytes( "--\r\n".getBytes( StandardCharsets.US_ASCII ) );
        return new MultipartBody( out.toByteArray( ), boundary, contentType );
    }

    public static Optional< String > boundaryOf ( String contentType ) {
        if ( StringUtils.isBlank( contentType ) ) {
            return Optional.empty( );
        }
        for ( String parameter : contentType.split( ";" ) ) {
            String trimmed = parameter.trim( );
            if ( StringUtils.startsWithIgnoreCase( trimmed, "boundary=" ) ) {
                String value = StringUtils.strip( trimmed.substring( "boundary=".length( ) ).trim( ), "\"" );
                return StringUtils.isBlank( value ) ? Optional.empty( ) : Optional.of( value );
            }
        }
        return Optional.empty( );
    }

    public static boolean isMultipart ( String contentType ) {
        return StringUtils.startsWithIgnoreCase( StringUtils.trimToEmpty( contentType ), "multipart/" );
    }

    public int countParts ( byte[] body, String boundary ) {
        if ( body == null || body.length == 0 || StringUtils.isBlank( boundary ) ) {
            return 0;
        }
        byte[] delimiter = ( "--" + boundary ).getBytes( StandardCharsets.US_ASCII );
        List< Integer > markers = findAll( body, delimiter );
        int count = 0;
        for ( int i = 0; i < markers.size( ) - 1; i++ ) {
            if ( payloadRange( body, markers.get( i ) + delimiter.length, markers.get( i + 1 ) ) != null ) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return {separator offset, payload start, payload end} of the segment, or null when it has
     * no header/body separator or an empty payload
     */
    private static int[] payloadRange ( byte[] body, int start, int end ) {
        int separator = indexOf( body, CRLF_SEPARATOR, start, end );
        int separatorLength = CRLF_SEPARATOR.length;
        if ( separator < 0 ) {
            separator = indexOf( body, LF_SEPARATOR, start, end );
            separatorLength = LF_SEPARATOR.length;
        }
        if ( separator < 0 ) {
            log.debug( "payloadRange :: Segment at offset {} has no header/body separator, skipped", start );
            return null;
        }
        int payloadStart = separator + separatorLength;
        int payloadEnd = end;
        if ( endsWith( body, payloadStart, payloadEnd, CRLF ) ) {
            payloadEnd -= CRLF.length;
        } else if ( endsWith( body, payloadStart, payloadEnd, LF ) ) {
            payloadEnd -= LF.length;
        }
        if ( payloadEnd <= payloadStart ) {
            return null;
        }
        return new int[] { separator, payloadStart, payloadEnd };
    }

    private String chooseBoundary ( List< byte[] > objects ) {
        for ( int attempt = 0; attempt < MAX_BOUNDARY_ATTEMPTS; attempt++ ) {
            String candidate = boundaryGenerator.get( );
            byte[] delimiter = ( "--" + candidate ).getBytes( StandardCharsets.US_ASCII );
            boolean collides = objects.stream( ).anyMatch( o -> indexOf( o, delimiter, 0, o.length ) >= 0 );
            if ( !collides ) {
                return candidate;
            }
            log.debug( "chooseBoundary :: Boundary {} occurs inside a payload, regenerating", candidate );
        }
        throw new IllegalStateException( "Unable to choose a multipart boundary that does not collide with the payloads" );
    }

    private static String randomBoundary ( ) {
        return "DICOMRelayBoundary" + UUID.randomUUID( ).toString( ).replace( "-", "" );
    }

    private static List< Integer > findAll ( byte[] data, byte[] pattern ) {
        List< Integer > positions = new ArrayList<>( );
        int from = 0;
        int found;
        while ( ( found = indexOf( data, pattern, from, data.length ) ) >= 0 ) {
            positions.add( found );
            from = found + pattern.length;
        }
        return positions;
    }

    static int indexOf ( byte[] data, byte[] pattern, int from, int to ) {
        int last = to - pattern.length;
        outer:
        for ( int i = from; i <= last; i++ ) {
            for ( int j = 0; j < pattern.length; j++ ) {
                if ( data[ i + j ] != pattern[ j ] ) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static boolean endsWith ( byte[] data, int from, int to, byte[] suffix ) {
        if ( to - from < suffix.length ) {
            return false;
        }
        return indexOf( data, suffix, to - suffix.length, to ) == to - suffix.length;
    }
}
