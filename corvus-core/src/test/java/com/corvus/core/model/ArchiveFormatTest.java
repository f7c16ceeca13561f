package com.corvus.core.model;

import com.corvus.core.exception.UnsupportedArchiveFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArchiveFormatTest {

    @Test
    void fromTag_shouldResolveExactTags() {
        assertEquals(ArchiveFormat.ZIP, ArchiveFormat.fromTag("zip").orElseThrow());
        assertEquals(ArchiveFormat.TAR, ArchiveFormat.fromTag("tar").orElseThrow());
        assertEquals(ArchiveFormat.TAR_GZ, ArchiveFormat.fromTag("tar.gz").orElseThrow());
    }

    @Test
    void fromTag_shouldNotDefaultUnknownTags() {
        assertTrue(ArchiveFormat.fromTag("rar").isEmpty());
        assertTrue(ArchiveFormat.fromTag("ZIP").isEmpty());
        assertTrue(ArchiveFormat.fromTag("tgz").isEmpty());
        assertTrue(ArchiveFormat.fromTag(null).isEmpty());
    }

    @Test
    void requireTag_shouldThrowDescriptiveException() {
        UnsupportedArchiveFormatException e = assertThrows(UnsupportedArchiveFormatException.class,
            () -> ArchiveFormat.requireTag("7z"));
        
        assertEquals("Unsupported archive format: 7z", e.getMessage());
        assertEquals("7z", e.getFormat());
        assertEquals(UnsupportedArchiveFormatException.ERROR_CODE, e.getErrorCode());
    }

    @Test
    void extension_shouldIncludeLeadingDot() {
        assertEquals(".zip", ArchiveFormat.ZIP.extension());
        assertEquals(".tar", ArchiveFormat.TAR.extension());
        assertEquals(".tar.gz", ArchiveFormat.TAR_GZ.extension());
    }
}
