package dev.pekelund.zuvp.permits;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a permit candidate.
 *
 * @param recognizedDocument whether the submission looks like a ZUVP application at all
 * @param complete           whether every required field is present
 * @param missingRequired    labels of missing required fields, in display order
 * @param missingOptional    labels of missing optional fields, in display order
 * @param foundFields        label to value for every field that was found, in display order
 * @param message            human-readable summary, {@code null} when there is nothing to report
 */
public record ValidationResult(
    boolean recognizedDocument,
    boolean complete,
    List<String> missingRequired,
    List<String> missingOptional,
    Map<String, Object> foundFields,
    String message
) {

    public ValidationResult {
        missingRequired = missingRequired != null ? List.copyOf(missingRequired) : List.of();
        missingOptional = missingOptional != null ? List.copyOf(missingOptional) : List.of();
        foundFields = foundFields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(foundFields))
            : Map.of();
    }
}
