package dev.pekelund.zuvp.permits;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the external entity extractor: either a loosely structured field map or an error marker.
 *
 * @param fields      key/value pairs exactly as the extractor named them; empty for failures
 * @param rawResponse unmodified text returned by the extractor, if any
 * @param error       error description when the extraction failed, otherwise {@code null}
 */
public record ExtractionResult(Map<String, Object> fields, String rawResponse, String error) {

    public ExtractionResult {
        fields = fields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
            : Map.of();
    }

    public static ExtractionResult success(Map<String, Object> fields, String rawResponse) {
        return new ExtractionResult(fields, rawResponse, null);
    }

    public static ExtractionResult failure(String error) {
        return new ExtractionResult(Map.of(), null, error != null ? error : "Extraction failed");
    }

    public boolean failed() {
        return error != null;
    }
}
