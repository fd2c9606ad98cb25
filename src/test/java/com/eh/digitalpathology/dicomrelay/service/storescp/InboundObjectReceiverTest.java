package com.eh.digitalpathology.dicomrelay.service.storescp;

import com.eh.digitalpathology.dicomrelay.association.DimseStatus;
import com.eh.digitalpathology.dicomrelay.codec.DicomTestObjects;
import com.eh.digitalpathology.dicomrelay.codec.ObjectCodec;
import com.eh.digitalpathology.dicomrelay.codec.Part10ObjectCodec;
import com.eh.digitalpathology.dicomrelay.exceptions.DicomAttributesException;
import com.eh.digitalpathology.dicomrelay.service.InboundTransferTracker;
import com.eh.digitalpathology.dicomrelay.util.CommonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InboundObjectReceiverTest {

    @TempDir
    Path tempDir;

    @Mock
    private CommonUtils commonUtils;

    @Mock
    private InboundTransferTracker transferTracker;

    private InboundObjectReceiver receiver;

    @BeforeEach
    void setUp() {
        receiver = new InboundObjectReceiver(new Part10ObjectCodec(), commonUtils, transferTracker);
    }

    @Test
    @DisplayName("Received object is written under patient/study/series/sop.dcm and counted")
    void testOnObjectReceived_StoresAndRecords() throws Exception {
        when(commonUtils.getLocalStoragePath()).thenReturn(tempDir.toString());
        byte[] encoded = DicomTestObjects.part10("P1", "S1", "SE1", "I1");

        int status = receiver.onObjectReceived(encoded);

        Path expected = tempDir.resolve("P1/S1/SE1/I1.dcm");
        assertEquals(DimseStatus.SUCCESS, status);
        assertArrayEquals(encoded, Files.readAllBytes(expected));
        verify(transferTracker).record("S1", expected);
    }

    @Test
    @DisplayName("Object without patient id is stored under Unknown")
    void testOnObjectReceived_UnknownPatient() {
        when(commonUtils.getLocalStoragePath()).thenReturn(tempDir.toString());

        int status = receiver.onObjectReceived(DicomTestObjects.part10(null, "S1", "SE1", "I1"));

        assertEquals(DimseStatus.SUCCESS, status);
        assertTrue(Files.exists(tempDir.resolve("Unknown/S1/SE1/I1.dcm")));
    }

    @Test
    @DisplayName("Two objects without SOP Instance UID do not overwrite each other")
    void testOnObjectReceived_MissingSopDoesNotOverwrite() throws Exception {
        when(commonUtils.getLocalStoragePath()).thenReturn(tempDir.toString());
        byte[] noSop = DicomTestObjects.part10("P1", "S1", "SE1", null);

        receiver.onObjectReceived(noSop);
        receiver.onObjectReceived(noSop);

        try (Stream<Path> files = Files.list(tempDir.resolve("P1/S1/SE1"))) {
            assertEquals(2, files.count());
        }
    }

    @Test
    @DisplayName("Unreadable object answers with a cannot-understand status")
    void testOnObjectReceived_CodecFailure() {
        ObjectCodec failingCodec = mock(ObjectCodec.class);
        when(failingCodec.readIdentifiers(any())).thenThrow(new DicomAttributesException("INVALID_DICOM", "bad"));
        InboundObjectReceiver failing = new InboundObjectReceiver(failingCodec, commonUtils, transferTracker);

        assertEquals(DimseStatus.CANNOT_UNDERSTAND, failing.onObjectReceived(new byte[]{1}));
        verifyNoInteractions(transferTracker);
    }

    @Test
    @DisplayName("I/O failure answers with an out-of-resources status and does not throw")
    void testOnObjectReceived_IoFailure() throws Exception {
        Path notADirectory = tempDir.resolve("file.txt");
        Files.writeString(notADirectory, "x");
        when(commonUtils.getLocalStoragePath()).thenReturn(notADirectory.toString());

        int status = receiver.onObjectReceived(DicomTestObjects.part10("P1", "S1", "SE1", "I1"));

        assertEquals(DimseStatus.OUT_OF_RESOURCES, status);
        verify(transferTracker, never()).record(eq("S1"), any());
    }

    @Test
    @DisplayName("persist writes the object without counting it")
    void testPersist_DoesNotRecord() throws Exception {
        when(commonUtils.getLocalStoragePath()).thenReturn(tempDir.toString());

        Path written = receiver.persist(DicomTestObjects.part10("P1", "S1", "SE1", "I1"));

        assertEquals(tempDir.resolve("P1/S1/SE1/I1.dcm"), written);
        verifyNoInteractions(transferTracker);
    }

    @Test
    @DisplayName("Deflated object is stored under Unknown and handed to the tracker without a study UID")
    void testOnObjectReceived_DeflatedObjectStillRecorded() {
        when(commonUtils.getLocalStoragePath()).thenReturn(tempDir.toString());
        byte[] deflated = DicomTestObjects.explicitLittleEndian()
                .raw(new byte[]{1, 2, 3, 4, 5, 6, 7, 8})
                .buildPart10("1.2.840.10008.1.2.1.99", "6.6.6");

        assertEquals(DimseStatus.SUCCESS, receiver.onObjectReceived(deflated));

        verify(transferTracker).record(isNull(), eq(tempDir.resolve("Unknown/Unknown/Unknown/6.6.6.dcm")));
    }

    @Test
    @DisplayName("Deeply nested sequences answer with a cannot-understand status and do not throw")
    void testOnObjectReceived_DeeplyNestedSequences() {
        int status = assertDoesNotThrow(() -> receiver.onObjectReceived(DicomTestObjects.nestedSequences(200_000)));

        assertEquals(DimseStatus.CANNOT_UNDERSTAND, status);
        verifyNoInteractions(transferTracker);
    }

    @Test
    @DisplayName("Patient id with an embedded NUL is stored under a sanitized folder")
    void testOnObjectReceived_NulInPatientId() {
        when(commonUtils.getLocalStoragePath()).thenReturn(tempDir.toString());

        int status = receiver.onObjectReceived(DicomTestObjects.part10("P\u0000X", "S1", "SE1", "I1"));

        assertEquals(DimseStatus.SUCCESS, status);
        assertTrue(Files.exists(tempDir.resolve("P_X/S1/SE1/I1.dcm")));
    }

    @Test
    @DisplayName("Invalid storage root answers with an out-of-resources status and does not throw")
    void testOnObjectReceived_InvalidPath() {
        when(commonUtils.getLocalStoragePath()).thenReturn("bad\u0000root");

        int status = assertDoesNotThrow(() -> receiver.onObjectReceived(DicomTestObjects.part10("P1", "S1", "SE1", "I1")));

        assertEquals(DimseStatus.OUT_OF_RESOURCES, status);
        verifyNoInteractions(transferTracker);
    }

    @Test
    @DisplayName("Unexpected runtime failure answers with an out-of-resources status")
    void testOnObjectReceived_UnexpectedRuntimeFailure() {
        ObjectCodec failingCodec = mock(ObjectCodec.class);
        when(failingCodec.readIdentifiers(any())).thenThrow(new IllegalStateException("boom"));
        InboundObjectReceiver failing = new InboundObjectReceiver(failingCodec, commonUtils, transferTracker);

        assertEquals(DimseStatus.OUT_OF_RESOURCES, failing.onObjectReceived(new byte[]{1}));
    }
}
