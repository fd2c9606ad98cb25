package com.eh.digitalpathology.dicomrelay.codec;

import com.eh.digitalpathology.dicomrelay.exceptions.DicomAttributesException;
import com.eh.digitalpathology.dicomrelay.model.InboundObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Identifier reader for DICOM Part 10 files and bare datasets.
 * <p>
 * Only the top level of the dataset is inspected and scanning stops after Series Instance UID
 * (0020,000E), so bulk data such as pixel data is never walked. Sequences are skipped whether
 * their length is defined or not.
 */
@Component
public class Part10ObjectCodec implements ObjectCodec {

    private static final Logger log = LoggerFactory.getLogger( Part10ObjectCodec.class );

    static final int TRANSFER_SYNTAX_UID = 0x00020010;
    static final int MEDIA_STORAGE_SOP_INSTANCE_UID = 0x00020003;
    static final int SPECIFIC_CHARACTER_SET = 0x00080005;
    static final int SOP_INSTANCE_UID = 0x00080018;
    static final int PATIENT_ID = 0x00100020;
    static final int STUDY_INSTANCE_UID = 0x0020000D;
    static final int SERIES_INSTANCE_UID = 0x0020000E;

    private static final int ITEM = 0xFFFEE000;
    private static final int ITEM_DELIMITATION = 0xFFFEE00D;
    private static final int SEQUENCE_DELIMITATION = 0xFFFEE0DD;
    private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;

    static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
    static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";
    static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";

    private static final int PREAMBLE_LENGTH = 128;
    static final int MAX_SEQUENCE_DEPTH = 64;

    @Override
    public InboundObject readIdentifiers ( byte[] encoded ) {
        if ( encoded == null || encoded.length == 0 ) {
            throw new DicomAttributesException( "EMPTY_OBJECT", "Encoded object is empty" );
        }
        try {
            Map< Integer, String > values = new HashMap<>( );
            int datasetStart = 0;
            String transferSyntax = null;
            if ( hasPreamble( encoded ) ) {
                DatasetReader meta = new DatasetReader( encoded, PREAMBLE_LENGTH + 4, true, false );
                meta.readFileMetaInformation( values );
                datasetStart = meta.pos;
                transferSyntax = values.get( TRANSFER_SYNTAX_UID );
            }

            if ( DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN.equals( transferSyntax ) ) {
                log.warn( "readIdentifiers :: Deflated dataset, identifying attributes not read" );
            } else if ( datasetStart < encoded.length ) {
                boolean explicitVr = transferSyntax == null ? looksExplicit( encoded, datasetStart ) : !IMPLICIT_VR_LITTLE_ENDIAN.equals( transferSyntax );
                boolean bigEndian = EXPLICIT_VR_BIG_ENDIAN.equals( transferSyntax );
                new DatasetReader( encoded, datasetStart, explicitVr, bigEndian ).readIdentifyingAttributes( values );
            }

            String sopInstanceUid = values.getOrDefault( SOP_INSTANCE_UID, values.get( MEDIA_STORAGE_SOP_INSTANCE_UID ) );
            return new InboundObject( values.get( PATIENT_ID ), values.get( STUDY_INSTANCE_UID ), values.get( SERIES_INSTANCE_UID ), sopInstanceUid, encoded );
        } catch ( IndexOutOfBoundsException | IllegalStateException e ) {
            throw new DicomAttributesException( "INVALID_DICOM", "Unable to read identifying attributes: " + e.getMessage( ), e );
        }
    }

    @Override
    public byte[] serialize ( InboundObject object ) {
        if ( object == null || object.rawBytes( ) == null ) {
            throw new DicomAttributesException( "EMPTY_OBJECT", "Nothing to serialize" );
        }
        return object.rawBytes( );
    }

    private static boolean hasPreamble ( byte[] data ) {
        return data.length >= PREAMBLE_LENGTH + 4 && data[ PREAMBLE_LENGTH ] == 'D' && data[ PREAMBLE_LENGTH + 1 ] == 'I' && data[ PREAMBLE_LENGTH + 2 ] == 'C' && data[ PREAMBLE_LENGTH + 3 ] == 'M';
    }

    private static boolean looksExplicit ( byte[] data, int pos ) {
        return data.length >= pos + 6 && isUpper( data[ pos + 4 ] ) && isUpper( data[ pos + 5 ] );
    }

    private static boolean isUpper ( byte b ) {
        return b >= 'A' && b <= 'Z';
    }

    private static final class DatasetReader {
        private final byte[] data;
        private final boolean explicitVr;
        private final boolean bigEndian;
        private int pos;

        private int tag;
        private String vr;
        private long length;

        DatasetReader ( byte[] data, int pos, boolean explicitVr, boolean bigEndian ) {
            this.data = data;
            this.pos = pos;
            this.explicitVr = explicitVr;
            this.bigEndian = bigEndian;
        }

        void readFileMetaInformation ( Map< Integer, String > values ) {
            while ( pos + 8 <= data.length && uint16( pos ) == 0x0002 ) {
                readHeader( );
                if ( length == UNDEFINED_LENGTH ) {
                    throw new IllegalStateException( "Undefined length in file meta information" );
                }
                if ( tag == TRANSFER_SYNTAX_UID || tag == MEDIA_STORAGE_SOP_INSTANCE_UID ) {
                    values.put( tag, readString( (int) length, StandardCharsets.US_ASCII ) );
                }
                skip( length );
            }
        }

        void readIdentifyingAttributes ( Map< Integer, String > values ) {
            Charset charset = StandardCharsets.ISO_8859_1;
            while ( data.length - pos >= 8 ) {
                readHeader( );
                if ( Integer.compareUnsigned( tag, SERIES_INSTANCE_UID ) > 0 ) {
                    return;
                }
                if ( length == UNDEFINED_LENGTH ) {
                    skipUndefinedLengthValue( 1 );
                    continue;
                }
                switch ( tag ) {
                    case SPECIFIC_CHARACTER_SET -> {
                        String characterSet = readString( (int) length, StandardCharsets.US_ASCII );
                        charset = characterSet.contains( "ISO_IR 192" ) ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1;
                    }
                    case PATIENT_ID -> values.put( tag, readString( (int) length, charset ) );
                    case SOP_INSTANCE_UID, STUDY_INSTANCE_UID, SERIES_INSTANCE_UID -> values.put( tag, readString( (int) length, StandardCharsets.US_ASCII ) );
                    default -> {
                        // not an identifying attribute
                    }
                }
                skip( length );
            }
        }

        private void readHeader ( ) {
            tag = ( uint16( pos ) << 16 ) | uint16( pos + 2 );
            pos += 4;
            if ( ( tag >>> 16 ) == 0xFFFE ) {
                vr = null;
                length = uint32( pos );
                pos += 4;
            } else if ( explicitVr ) {
                vr = new String( data, pos, 2, StandardCharsets.US_ASCII );
                pos += 2;
                if ( hasLongLength( vr ) ) {
                    pos += 2;
                    length = uint32( pos );
                    pos += 4;
                } else {
                    length = uint16( pos );
                    pos += 2;
                }
            } else {
                vr = null;
                length = uint32( pos );
                pos += 4;
            }
        }

        private void skipUndefinedLengthValue ( int depth ) {
            if ( depth > MAX_SEQUENCE_DEPTH ) {
                throw new IllegalStateException( "Sequences nested deeper than " + MAX_SEQUENCE_DEPTH + " levels" );
            }
            if ( explicitVr && "UN".equals( vr ) ) {
                // UN with undefined length is always encoded implicit VR little endian
                DatasetReader implicit = new DatasetReader( data, pos, false, false );
                implicit.skipUndefinedLengthValue( depth );
                pos = implicit.pos;
                return;
            }
            while ( true ) {
                readHeader( );
                if ( tag == SEQUENCE_DELIMITATION ) {
                    return;
                }
                if ( tag != ITEM ) {
                    throw new IllegalStateException( String.format( "Unexpected tag %08X inside sequence", tag ) );
                }
                if ( length == UNDEFINED_LENGTH ) {
                    skipItemContent( depth );
                } else {
                    skip( length );
                }
            }
        }

        private void skipItemContent ( int depth ) {
            while ( true ) {
                readHeader( );
                if ( tag == ITEM_DELIMITATION ) {
                    return;
                }
                if ( length == UNDEFINED_LENGTH ) {
                    skipUndefinedLengthValue( depth + 1 );
                } else {
                    skip( length );
                }
            }
        }

        private void skip ( long bytes ) {
            long next = pos + bytes;
            if ( next > data.length ) {
                throw new IllegalStateException( "Value length " + bytes + " exceeds remaining " + ( data.length - pos ) + " bytes" );
            }
            pos = (int) next;
        }

        private String readString ( int len, Charset charset ) {
            if ( pos + len > data.length ) {
                throw new IllegalStateException( "Value length " + len + " exceeds remaining " + ( data.length - pos ) + " bytes" );
            }
            String value = new String( data, pos, len, charset );
            int end = value.length( );
            while ( end > 0 && ( value.charAt( end - 1 ) == '\0' || value.charAt( end - 1 ) == ' ' ) ) {
                end--;
            }
            return value.substring( 0, end ).trim( );
        }

        private int uint16 ( int at ) {
            int b0 = data[ at ] & 0xFF;
            int b1 = data[ at + 1 ] & 0xFF;
            return bigEndian ? ( b0 << 8 ) | b1 : ( b1 << 8 ) | b0;
        }

        private long uint32 ( int at ) {
            long b0 = data[ at ] & 0xFF;
            long b1 = data[ at + 1 ] & 0xFF;
            long b2 = data[ at + 2 ] & 0xFF;
            long b3 = data[ at + 3 ] & 0xFF;
            return bigEndian ? ( b0 << 24 ) | ( b1 << 16 ) | ( b2 << 8 ) | b3 : ( b3 << 24 ) | ( b2 << 16 ) | ( b1 << 8 ) | b0;
        }

        private static boolean hasLongLength ( String vr ) {
            return switch ( vr ) {
                case "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV" -> true;
                default -> false;
            };
        }
    }
}
