package com.eh.digitalpathology.dicomrelay.codec;

import com.eh.digitalpathology.dicomrelay.exceptions.DicomAttributesException;
import com.eh.digitalpathology.dicomrelay.model.InboundObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class Part10ObjectCodecTest {

    private final Part10ObjectCodec codec = new Part10ObjectCodec();

    @Test
    @DisplayName("Explicit VR little endian Part 10 file: all identifying attributes are read")
    void testReadIdentifiers_ExplicitLittleEndianPart10() {
        byte[] encoded = DicomTestObjects.part10("P1", "1.2.3", "1.2.3.4", "1.2.3.4.5");

        InboundObject object = codec.readIdentifiers(encoded);

        assertEquals("P1", object.patientId());
        assertEquals("1.2.3", object.studyInstanceUid());
        assertEquals("1.2.3.4", object.seriesInstanceUid());
        assertEquals("1.2.3.4.5", object.sopInstanceUid());
        assertSame(encoded, object.rawBytes());
    }

    @Test
    @DisplayName("Implicit VR little endian dataset after the meta group")
    void testReadIdentifiers_ImplicitLittleEndian() {
        byte[] encoded = DicomTestObjects.implicitLittleEndian()
                .element(0x00080018, "UI", "9.8.7")
                .element(0x00100020, "LO", "PAT-2")
                .element(0x0020000D, "UI", "9.8")
                .element(0x0020000E, "UI", "9.8.1")
                .buildPart10(Part10ObjectCodec.IMPLICIT_VR_LITTLE_ENDIAN, "9.8.7");

        InboundObject object = codec.readIdentifiers(encoded);

        assertEquals("PAT-2", object.patientId());
        assertEquals("9.8", object.studyInstanceUid());
        assertEquals("9.8.1", object.seriesInstanceUid());
        assertEquals("9.8.7", object.sopInstanceUid());
    }

    @Test
    @DisplayName("Explicit VR big endian dataset after the meta group")
    void testReadIdentifiers_ExplicitBigEndian() {
        byte[] encoded = DicomTestObjects.explicitBigEndian()
                .element(0x00080018, "UI", "5.5.5")
                .element(0x00100020, "LO", "BE")
                .element(0x0020000D, "UI", "5.5")
                .element(0x0020000E, "UI", "5.5.1")
                .buildPart10(Part10ObjectCodec.EXPLICIT_VR_BIG_ENDIAN, "5.5.5");

        InboundObject object = codec.readIdentifiers(encoded);

        assertEquals("BE", object.patientId());
        assertEquals("5.5", object.studyInstanceUid());
        assertEquals("5.5.1", object.seriesInstanceUid());
        assertEquals("5.5.5", object.sopInstanceUid());
    }

    @Test
    @DisplayName("Bare datasets without preamble are read in both VR encodings")
    void testReadIdentifiers_BareDatasets() {
        byte[] explicit = DicomTestObjects.explicitLittleEndian()
                .element(0x00100020, "LO", "EX")
                .element(0x0020000D, "UI", "1.1")
                .buildDataset();
        byte[] implicit = DicomTestObjects.implicitLittleEndian()
                .element(0x00100020, "LO", "IM")
                .element(0x0020000D, "UI", "2.2")
                .buildDataset();

        assertEquals("EX", codec.readIdentifiers(explicit).patientId());
        assertEquals("1.1", codec.readIdentifiers(explicit).studyInstanceUid());
        assertEquals("IM", codec.readIdentifiers(implicit).patientId());
        assertEquals("2.2", codec.readIdentifiers(implicit).studyInstanceUid());
    }

    @Test
    @DisplayName("Missing SOP Instance UID falls back to the Media Storage SOP Instance UID")
    void testReadIdentifiers_SopFallsBackToMediaStorage() {
        byte[] encoded = DicomTestObjects.explicitLittleEndian()
                .element(0x00100020, "LO", "P1")
                .buildPart10(DicomTestObjects.EXPLICIT_VR_LITTLE_ENDIAN, "7.7.7");

        assertEquals("7.7.7", codec.readIdentifiers(encoded).sopInstanceUid());
    }

    @Test
    @DisplayName("Absent attributes are reported as null")
    void testReadIdentifiers_AbsentAttributesAreNull() {
        InboundObject object = codec.readIdentifiers(DicomTestObjects.part10(null, "1.2", null, null));

        assertNull(object.patientId());
        assertEquals("1.2", object.studyInstanceUid());
        assertNull(object.seriesInstanceUid());
        assertNull(object.sopInstanceUid());
    }

    @Test
    @DisplayName("Undefined length sequences are skipped and nested values are ignored")
    void testReadIdentifiers_SkipsUndefinedLengthSequence() {
        byte[] encoded = DicomTestObjects.explicitLittleEndian()
                .element(0x00080018, "UI", "3.3.3")
                .undefinedLengthSequence(0x00081115, item -> item
                        .element(0x00100020, "LO", "NESTED")
                        .undefinedLengthSequence(0x00081199, inner -> inner.element(0x00081155, "UI", "4.4")))
                .element(0x00100020, "LO", "TOP")
                .element(0x0020000D, "UI", "3.3")
                .buildPart10(DicomTestObjects.EXPLICIT_VR_LITTLE_ENDIAN, "3.3.3");

        InboundObject object = codec.readIdentifiers(encoded);

        assertEquals("TOP", object.patientId());
        assertEquals("3.3", object.studyInstanceUid());
    }

    @Test
    @DisplayName("Defined length sequences are skipped in implicit VR")
    void testReadIdentifiers_SkipsDefinedLengthSequenceImplicit() {
        byte[] encoded = DicomTestObjects.implicitLittleEndian()
                .definedLengthSequence(0x00081115, item -> item.element(0x00100020, "LO", "NESTED"))
                .element(0x00100020, "LO", "TOP")
                .buildDataset();

        assertEquals("TOP", codec.readIdentifiers(encoded).patientId());
    }

    @Test
    @DisplayName("Scanning stops after Series Instance UID, later garbage is never read")
    void testReadIdentifiers_StopsAfterSeriesInstanceUid() {
        byte[] encoded = DicomTestObjects.explicitLittleEndian()
                .element(0x0020000D, "UI", "1.2")
                .element(0x0020000E, "UI", "1.2.3")
                // pixel data header claiming far more bytes than present
                .raw(new byte[]{(byte) 0xE0, 0x7F, 0x10, 0x00, 'O', 'B', 0, 0, 0, 0, 0, 0x10})
                .buildPart10(DicomTestObjects.EXPLICIT_VR_LITTLE_ENDIAN, null);

        InboundObject object = codec.readIdentifiers(encoded);

        assertEquals("1.2.3", object.seriesInstanceUid());
    }

    @Test
    @DisplayName("UTF-8 patient id is decoded when the character set says ISO_IR 192")
    void testReadIdentifiers_Utf8PatientId() {
        byte[] encoded = DicomTestObjects.explicitLittleEndian()
                .element(0x00080005, "CS", "ISO_IR 192")
                .element(0x00100020, "LO", "Müller")
                .buildPart10(DicomTestObjects.EXPLICIT_VR_LITTLE_ENDIAN, null);

        assertEquals("Müller", codec.readIdentifiers(encoded).patientId());
    }

    @Test
    @DisplayName("Deflated transfer syntax: identifiers are absent but the object is still readable")
    void testReadIdentifiers_DeflatedReportsAbsent() {
        byte[] encoded = DicomTestObjects.explicitLittleEndian()
                .raw(new byte[]{1, 2, 3, 4, 5, 6, 7, 8})
                .buildPart10(Part10ObjectCodec.DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN, "6.6.6");

        InboundObject object = codec.readIdentifiers(encoded);

        assertNull(object.patientId());
        assertNull(object.studyInstanceUid());
        assertEquals("6.6.6", object.sopInstanceUid());
    }

    @Test
    @DisplayName("Truncated value throws DicomAttributesException")
    void testReadIdentifiers_TruncatedValueThrows() {
        byte[] complete = DicomTestObjects.part10("P1", "1.2.3", "1.2.3.4", "1.2.3.4.5");
        // cut inside the Patient ID value
        byte[] truncated = Arrays.copyOf(complete, indexOf(complete, "P1".getBytes()) + 1);

        DicomAttributesException ex = assertThrows(DicomAttributesException.class, () -> codec.readIdentifiers(truncated));
        assertEquals("INVALID_DICOM", ex.getErrorCode());
    }

    @Test
    @DisplayName("Sequences nested past the depth limit are rejected instead of overflowing the stack")
    void testReadIdentifiers_DeepNestingThrows() {
        byte[] encoded = DicomTestObjects.nestedSequences(200_000);

        DicomAttributesException ex = assertThrows(DicomAttributesException.class, () -> codec.readIdentifiers(encoded));
        assertEquals("INVALID_DICOM", ex.getErrorCode());
    }

    @Test
    @DisplayName("Nesting up to the depth limit is still skipped")
    void testReadIdentifiers_NestingWithinLimit() {
        DicomTestObjects.Builder builder = DicomTestObjects.explicitLittleEndian();
        builder.element(0x00080018, "UI", "3.3.3");
        builder.undefinedLengthSequence(0x00081115, nested(Part10ObjectCodec.MAX_SEQUENCE_DEPTH - 1));
        builder.element(0x0020000D, "UI", "3.3");

        InboundObject object = codec.readIdentifiers(builder.buildPart10(DicomTestObjects.EXPLICIT_VR_LITTLE_ENDIAN, null));

        assertEquals("3.3", object.studyInstanceUid());
    }

    private static Consumer<DicomTestObjects.Builder> nested(int remaining) {
        if (remaining == 0) {
            return item -> item.element(0x00081155, "UI", "4.4");
        }
        return item -> item.undefinedLengthSequence(0x00081115, nested(remaining - 1));
    }

    @Test
    @DisplayName("Empty input throws DicomAttributesException")
    void testReadIdentifiers_EmptyThrows() {
        assertThrows(DicomAttributesException.class, () -> codec.readIdentifiers(new byte[0]));
        assertThrows(DicomAttributesException.class, () -> codec.readIdentifiers(null));
    }

    @Test
    @DisplayName("serialize returns the encoded bytes unchanged")
    void testSerialize() {
        byte[] encoded = DicomTestObjects.part10("P1", "1.2", "1.2.3", "1.2.3.4");
        InboundObject object = codec.readIdentifiers(encoded);

        assertArrayEquals(encoded, codec.serialize(object));
        assertThrows(DicomAttributesException.class, () -> codec.serialize(new InboundObject("P", "S", "SE", "I", null)));
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
