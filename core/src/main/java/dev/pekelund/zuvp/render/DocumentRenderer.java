package dev.pekelund.zuvp.render;

import dev.pekelund.zuvp.permits.CanonicalRecord;
import java.nio.file.Path;
import java.util.Map;

/**
 * Turns a validated, charged record into the documents a clerk reviews.
 */
public interface DocumentRenderer {

    /**
     * Renders every document for the request. Rendering the same request id again overwrites the previous files.
     *
     * @return document type ({@code consent}, {@code payment}) to the generated file
     * @throws RenderException when a document cannot be produced
     */
    Map<String, Path> render(CanonicalRecord record, String requestId);
}
