package com.example.archivediff;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.apache.tika.mime.MediaTypeRegistry;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Classifies an input file before it is opened for random access.
 */
public class ArchiveTypeDetector {
    private final Tika tika;
    private final MediaTypeRegistry registry = MediaTypeRegistry.getDefaultRegistry();

    public ArchiveTypeDetector(Tika tika) {
        this.tika = tika;
    }

    public MediaType detect(Path archive) throws IOException {
        MediaType mediaType = MediaType.parse(tika.detect(archive));
        return mediaType == null ? MediaType.OCTET_STREAM : mediaType;
    }

    /**
     * Returns true for {@code application/zip} and its specializations (jar, OOXML, EPUB, ...).
     */
    public boolean isZip(MediaType mediaType) {
        MediaType base = mediaType.getBaseType();
        return base.equals(MediaType.APPLICATION_ZIP) || registry.isSpecializationOf(base, MediaType.APPLICATION_ZIP);
    }

    /**
     * Returns true for {@code text/*} content, which can never be a ZIP container.
     */
    public boolean isText(MediaType mediaType) {
        MediaType base = mediaType.getBaseType();
        return "text".equals(base.getType()) || registry.isSpecializationOf(base, MediaType.TEXT_PLAIN);
    }
}
