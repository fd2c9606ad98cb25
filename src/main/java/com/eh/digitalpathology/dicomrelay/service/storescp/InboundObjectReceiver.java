package com.eh.digitalpathology.dicomrelay.service.storescp;

import com.eh.digitalpathology.dicomrelay.association.DimseStatus;
import com.eh.digitalpathology.dicomrelay.association.InboundHandler;
import com.eh.digitalpathology.dicomrelay.codec.ObjectCodec;
import com.eh.digitalpathology.dicomrelay.exceptions.DicomAttributesException;
import com.eh.digitalpathology.dicomrelay.model.InboundObject;
import com.eh.digitalpathology.dicomrelay.service.InboundTransferTracker;
import com.eh.digitalpathology.dicomrelay.util.CommonUtils;
import com.eh.digitalpathology.dicomrelay.util.StoragePathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Persists objects pushed to the local identity under
 * {@code <storage root>/<patient>/<study>/<series>/<sop>.dcm} and answers with the store status.
 */
@Service
public class InboundObjectReceiver implements InboundHandler {

    private static final Logger log = LoggerFactory.getLogger( InboundObjectReceiver.class );

    private final ObjectCodec objectCodec;
    private final CommonUtils commonUtils;
    private final InboundTransferTracker transferTracker;

    public InboundObjectReceiver ( ObjectCodec objectCodec, CommonUtils commonUtils, InboundTransferTracker transferTracker ) {
        this.objectCodec = objectCodec;
        this.commonUtils = commonUtils;
        this.transferTracker = transferTracker;
    }

    @Override
    public int onObjectReceived ( byte[] encoded ) {
        try {
            InboundObject object = objectCodec.readIdentifiers( encoded );
            Path storedAt = write( object );
            if ( transferTracker.record( object.studyInstanceUid( ), storedAt ) ) {
                log.debug( "onObjectReceived :: Counted {} against study {}", storedAt.getFileName( ), object.studyInstanceUid( ) );
            }
            return DimseStatus.SUCCESS;
        } catch ( DicomAttributesException e ) {
            log.error( "onObjectReceived :: Unable to read received object [{}]: {}", e.getErrorCode( ), e.getMessage( ) );
            return DimseStatus.CANNOT_UNDERSTAND;
        } catch ( IOException | InvalidPathException e ) {
            log.error( "onObjectReceived :: Unable to store received object: {}", e.getMessage( ) );
            return DimseStatus.OUT_OF_RESOURCES;
        } catch ( RuntimeException e ) {
            log.error( "onObjectReceived :: Unexpected failure while storing received object", e );
            return DimseStatus.OUT_OF_RESOURCES;
        }
    }

    public Path persist ( byte[] encoded ) throws IOException {
        return write( objectCodec.readIdentifiers( encoded ) );
    }

    private Path write ( InboundObject object ) throws IOException {
        Path root = Paths.get( commonUtils.getLocalStoragePath( ) );
        Path target = StoragePathUtils.resolve( root, object );
        Files.createDirectories( target.getParent( ) );
        Files.write( target, objectCodec.serialize( object ) );
        log.info( "write :: Stored object {} ({} bytes)", root.relativize( target ), object.rawBytes( ).length );
        return target;
    }
}
