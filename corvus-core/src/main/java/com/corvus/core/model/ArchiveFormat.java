package com.corvus.core.model;

import com.corvus.core.exception.UnsupportedArchiveFormatException;

import java.util.Optional;

/**
 * Container formats the archive operation can produce.
 */
public enum ArchiveFormat {
    ZIP("zip", ".zip"),
    TAR("tar", ".tar"),
    TAR_GZ("tar.gz", ".tar.gz");

    private final String tag;
    private final String extension;

    ArchiveFormat(String tag, String extension) {
        this.tag = tag;
        this.extension = extension;
    }

    /**
     * Literal tag carried by {@link TaskKind.Archive#format()}.
     */
    public String tag() {
        return tag;
    }

    /**
     * File name suffix including the leading dot.
     */
    public String extension() {
        return extension;
    }

    /**
     * Look up a format by its exact tag. Matching is case-sensitive.
     */
    public static Optional<ArchiveFormat> fromTag(String tag) {
        for (ArchiveFormat format : values()) {
            if (format.tag.equals(tag)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Look up a format by its exact tag.
     *
     * @throws UnsupportedArchiveFormatException if no format has this tag
     */
    public static ArchiveFormat requireTag(String tag) throws UnsupportedArchiveFormatException {
        return fromTag(tag).orElseThrow(() -> new UnsupportedArchiveFormatException(tag));
    }
}
