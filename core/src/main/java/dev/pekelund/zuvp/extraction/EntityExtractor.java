package dev.pekelund.zuvp.extraction;

import dev.pekelund.zuvp.permits.ExtractionResult;
import dev.pekelund.zuvp.permits.MediaKind;

/**
 * External capability that pulls loosely structured permit data out of a submitted document.
 *
 * <p>Implementations may return any key naming. Failures should be reported as
 * {@link ExtractionResult#failure(String)}; callers still guard against thrown runtime exceptions.
 */
public interface EntityExtractor {

    ExtractionResult extract(byte[] content, MediaKind mediaKind, String fileName);
}
