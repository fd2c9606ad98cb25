package com.eh.digitalpathology.dicomrelay.util;

import com.eh.digitalpathology.dicomrelay.model.InboundObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class StoragePathUtilsTest {

    private final Path root = Paths.get("/data/root");

    @Test
    @DisplayName("Path is root/patient/study/series/sop.dcm")
    void testResolve_Deterministic() {
        InboundObject object = new InboundObject("P1", "S1", "SE1", "I1", new byte[0]);

        assertEquals(root.resolve("P1/S1/SE1/I1.dcm"), StoragePathUtils.resolve(root, object));
        assertEquals(StoragePathUtils.resolve(root, object), StoragePathUtils.resolve(root, object));
    }

    @Test
    @DisplayName("Missing patient, study and series become Unknown")
    void testResolve_UnknownDefaults() {
        InboundObject object = new InboundObject(null, " ", "", "I1", new byte[0]);

        assertEquals(root.resolve("Unknown/Unknown/Unknown/I1.dcm"), StoragePathUtils.resolve(root, object));
    }

    @Test
    @DisplayName("Missing SOP Instance UID gets a synthetic, unique file name")
    void testResolve_SyntheticInstanceName() {
        InboundObject object = new InboundObject("P1", "S1", "SE1", null, new byte[0]);

        Path first = StoragePathUtils.resolve(root, object);
        Path second = StoragePathUtils.resolve(root, object);

        assertTrue(first.getFileName().toString().matches("instance_\\d+_[0-9a-f]{8}\\.dcm"));
        assertNotEquals(first, second);
        assertEquals(root.resolve("P1/S1/SE1"), first.getParent());
    }

    @Test
    @DisplayName("Separators and dot segments cannot escape the storage root")
    void testSanitize() {
        assertEquals("a_b_c", StoragePathUtils.sanitize("a/b\\c"));
        assertEquals("_", StoragePathUtils.sanitize(".."));
        assertEquals("_", StoragePathUtils.sanitize("."));
        assertEquals("1.2.3", StoragePathUtils.sanitize("1.2.3"));

        InboundObject object = new InboundObject("../etc", "..", "SE1", "I1", new byte[0]);
        Path resolved = StoragePathUtils.resolve(root, object);
        assertTrue(resolved.normalize().startsWith(root));
        assertEquals(root.resolve(".._etc/_/SE1/I1.dcm"), resolved);
    }

    @Test
    @DisplayName("NUL and other control characters are replaced so the path stays valid")
    void testSanitize_ControlCharacters() {
        assertEquals("P_X", StoragePathUtils.sanitize("P\u0000X"));
        assertEquals("a_b_c", StoragePathUtils.sanitize("a\tb\u007Fc"));

        InboundObject object = new InboundObject("P\u0000X", "S\n1", "SE1", "I\u00011", new byte[0]);
        assertEquals(root.resolve("P_X/S_1/SE1/I_1.dcm"), StoragePathUtils.resolve(root, object));
    }
}
