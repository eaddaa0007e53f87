package dev.pekelund.zuvp.validation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.zuvp.normalization.FieldNormalizer;
import dev.pekelund.zuvp.permits.ExtractionResult;
import dev.pekelund.zuvp.permits.PermitCandidate;
import dev.pekelund.zuvp.permits.ValidationResult;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PermitValidatorTest {

    private final FieldNormalizer normalizer = new FieldNormalizer(7);
    private final PermitValidator validator = new PermitValidator();

    @Test
    void completeSubmissionListsMissingOptionalFields() {
        ValidationResult result = validate(ExtractionResult.success(Map.of(
            "applicant_name", "Jan Novák",
            "purpose_of_use", "Lešení",
            "location", "Husova 12"), "{}"));

        assertThat(result.recognizedDocument()).isTrue();
        assertThat(result.complete()).isTrue();
        assertThat(result.missingRequired()).isEmpty();
        assertThat(result.missingOptional())
            .containsExactly("IČO", "Kontaktní údaje", "Doba užívání", "Výměra");
        assertThat(result.foundFields())
            .containsEntry("Jméno žadatele", "Jan Novák")
            .containsEntry("Účel užívání", "Lešení")
            .containsEntry("Místo/lokace", "Husova 12");
        assertThat(result.message()).startsWith(PermitValidator.MISSING_OPTIONAL_PREFIX);
    }

    @Test
    void missingRequiredFieldsAreReportedInDisplayOrder() {
        ValidationResult result = validate(ExtractionResult.success(Map.of("area_sqm", 10), "{}"));

        assertThat(result.recognizedDocument()).isTrue();
        assertThat(result.complete()).isFalse();
        assertThat(result.missingRequired()).containsExactly("Jméno žadatele", "Účel užívání", "Místo/lokace");
        assertThat(result.message())
            .isEqualTo(PermitValidator.MISSING_REQUIRED_PREFIX + "Jméno žadatele, Účel užívání, Místo/lokace");
    }

    @Test
    void fullySpecifiedSubmissionHasNoMessage() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("applicant_name", "Jan Novák");
        fields.put("company_id", "12345678");
        fields.put("contact_details", "jan@example.cz");
        fields.put("purpose_of_use", "Stánek");
        fields.put("location", "Masarykovo nám.");
        fields.put("duration", "01.07.2025 - 05.07.2025");
        fields.put("area_sqm", "6");

        ValidationResult result = validate(ExtractionResult.success(fields, "{}"));

        assertThat(result.complete()).isTrue();
        assertThat(result.missingOptional()).isEmpty();
        assertThat(result.message()).isNull();
    }

    @Test
    void extractionErrorIsNotRecognized() {
        ValidationResult result = validate(ExtractionResult.failure("Gemini request failed"));

        assertThat(result.recognizedDocument()).isFalse();
        assertThat(result.complete()).isFalse();
        assertThat(result.message()).isEqualTo(PermitValidator.NOT_RECOGNIZED_MESSAGE);
        assertThat(result.foundFields()).isEmpty();
        assertThat(result.missingRequired()).containsExactly("Jméno žadatele", "Účel užívání", "Místo/lokace");
    }

    @Test
    void submissionWithoutAnyKnownFieldIsNotRecognized() {
        ValidationResult result = validate(ExtractionResult.success(Map.of("invoice_number", "2025-001"), "{}"));

        assertThat(result.recognizedDocument()).isFalse();
        assertThat(result.message()).isEqualTo(PermitValidator.NOT_RECOGNIZED_MESSAGE);
    }

    @Test
    void explicitWrongDocumentFlagIsRejected() {
        ValidationResult result = validate(ExtractionResult.success(
            Map.of("is_zuvp_document", false, "applicant_name", "Jan"), "{\"is_zuvp_document\": false}"));

        assertThat(result.recognizedDocument()).isFalse();
        assertThat(result.message()).isEqualTo(PermitValidator.WRONG_DOCUMENT_TYPE_MESSAGE);
    }

    @Test
    void wrongDocumentMarkerInRawResponseIsRejected() {
        ValidationResult result = validate(ExtractionResult.success(Map.of(),
            "This is not a ZUVP application, it looks like an invoice."));

        assertThat(result.recognizedDocument()).isFalse();
        assertThat(result.message()).isEqualTo(PermitValidator.WRONG_DOCUMENT_TYPE_MESSAGE);
    }

    @Test
    void markerInRawTextOfParsedApplicationIsIgnored() {
        ValidationResult result = validate(ExtractionResult.success(Map.of(
            "applicant_name", "Jan Novák",
            "purpose_of_use", "Lešení",
            "location", "Husova 12"), "Poznámka: stavba není ZUVP povinná, přesto žádáme o zábor."));

        assertThat(result.recognizedDocument()).isTrue();
        assertThat(result.complete()).isTrue();
    }

    @Test
    void markerInRawResponseFieldIsRejectedEvenWithOtherFields() {
        ValidationResult result = validate(ExtractionResult.success(
            Map.of("applicant_name", "Jan", "raw_response", "Not a ZUVP form"), "{}"));

        assertThat(result.recognizedDocument()).isFalse();
        assertThat(result.message()).isEqualTo(PermitValidator.WRONG_DOCUMENT_TYPE_MESSAGE);
    }

    private ValidationResult validate(ExtractionResult extraction) {
        return validator.validate(new PermitCandidate(extraction, normalizer.normalize(extraction)));
    }
}
