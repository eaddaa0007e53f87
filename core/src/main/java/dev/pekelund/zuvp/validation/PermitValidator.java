package dev.pekelund.zuvp.validation;

import dev.pekelund.zuvp.permits.CanonicalField;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import dev.pekelund.zuvp.permits.ExtractionResult;
import dev.pekelund.zuvp.permits.PermitCandidate;
import dev.pekelund.zuvp.permits.ValidationResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a candidate is a ZUVP application at all and whether it is complete enough to process.
 *
 * <p>Recognition runs first: an extraction failure, a submission without a single usable canonical field,
 * or an explicit "not this document type" marker ends validation with a fixed rejection message. Only
 * recognized documents are checked for completeness. Required fields are the applicant name, the purpose of
 * use and the location; company id, contact details, duration and area are optional.
 */
public class PermitValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PermitValidator.class);

    public static final String NOT_RECOGNIZED_MESSAGE =
        "Dokument neobsahuje žádné rozpoznatelné ZUVP údaje.";
    public static final String WRONG_DOCUMENT_TYPE_MESSAGE =
        "Nahraný dokument není ZUVP žádost. Nahrajte prosím správný formulář žádosti o zvláštní užívání "
            + "veřejného prostranství.";
    static final String MISSING_REQUIRED_PREFIX = "Chybí povinné údaje: ";
    static final String MISSING_OPTIONAL_PREFIX = "Chybí nepovinné údaje: ";

    private static final List<String> WRONG_TYPE_MARKERS = List.of("not a zuvp", "není zuvp", "neni zuvp");
    private static final List<String> DOCUMENT_FLAG_KEYS = List.of("is_zuvp_document", "is_zuvp");

    public ValidationResult validate(PermitCandidate candidate) {
        ExtractionResult extraction = candidate.extraction();
        CanonicalRecord record = candidate.record();

        if (extraction.failed()) {
            LOGGER.info("Extraction reported an error ({}); document not recognized", extraction.error());
            return notRecognized(NOT_RECOGNIZED_MESSAGE);
        }
        if (flaggedAsOtherDocument(extraction)) {
            LOGGER.info("Extractor marked the submission as a different document type");
            return notRecognized(WRONG_DOCUMENT_TYPE_MESSAGE);
        }

        List<String> missingRequired = new ArrayList<>();
        List<String> missingOptional = new ArrayList<>();
        Map<String, Object> found = new LinkedHashMap<>();
        for (CanonicalField field : CanonicalField.values()) {
            Object value = record.valueOf(field);
            if (value != null) {
                found.put(field.label(), value);
            } else if (field.required()) {
                missingRequired.add(field.label());
            } else {
                missingOptional.add(field.label());
            }
        }

        if (found.isEmpty()) {
            LOGGER.info("No canonical field could be resolved from {} extracted keys", extraction.fields().size());
            return notRecognized(NOT_RECOGNIZED_MESSAGE);
        }

        boolean complete = missingRequired.isEmpty();
        String message = null;
        if (!complete) {
            message = MISSING_REQUIRED_PREFIX + String.join(", ", missingRequired);
        } else if (!missingOptional.isEmpty()) {
            message = MISSING_OPTIONAL_PREFIX + String.join(", ", missingOptional);
        }
        return new ValidationResult(true, complete, missingRequired, missingOptional, found, message);
    }

    private boolean flaggedAsOtherDocument(ExtractionResult extraction) {
        for (String key : DOCUMENT_FLAG_KEYS) {
            Object flag = extraction.fields().get(key);
            if (Boolean.FALSE.equals(flag) || "false".equalsIgnoreCase(String.valueOf(flag))) {
                return true;
            }
        }
        if (containsMarker(extraction.fields().get("raw_response"))) {
            return true;
        }
        // The raw reply is only consulted when it could not be parsed into fields.
        return extraction.fields().isEmpty() && containsMarker(extraction.rawResponse());
    }

    private boolean containsMarker(Object text) {
        if (text == null) {
            return false;
        }
        String normalized = text.toString().toLowerCase(Locale.ROOT);
        return WRONG_TYPE_MARKERS.stream().anyMatch(normalized::contains);
    }

    private static ValidationResult notRecognized(String message) {
        return new ValidationResult(false, false, labels(true), labels(false), Map.of(), message);
    }

    private static List<String> labels(boolean required) {
        return Arrays.stream(CanonicalField.values())
            .filter(field -> field.required() == required)
            .map(CanonicalField::label)
            .toList();
    }
}
