package dev.pekelund.zuvp.permits;

import java.util.List;

/**
 * Canonical permit fields together with the extractor keys accepted for each of them.
 *
 * <p>Aliases are listed in precedence order: legacy English labels produced by older prompts are
 * followed by the snake_case variants of the current prompt and a few loose spellings. The enum order
 * is the display order used for missing-field lists.
 */
public enum CanonicalField {

    APPLICANT_NAME("Jméno žadatele", true,
        List.of("Applicant name", "applicant_name", "applicant", "Applicant", "name", "zadatel", "žadatel")),
    PURPOSE_OF_USE("Účel užívání", true,
        List.of("Purpose of use", "purpose_of_use", "purpose", "Purpose", "ucel_uzivani", "účel užívání")),
    LOCATION("Místo/lokace", true,
        List.of("Location", "specific_location", "location", "Specific location", "address", "misto", "místo")),
    COMPANY_ID("IČO", false,
        List.of("Company ID (IČO)", "company_id", "Company ID", "ico", "IČO", "ič")),
    CONTACT_DETAILS("Kontaktní údaje", false,
        List.of("Contact details", "contact_details", "contact", "Contact", "kontakt")),
    DURATION("Doba užívání", false,
        List.of("Duration (dates)", "duration", "Duration", "dates", "period", "doba_uzivani")),
    AREA("Výměra", false,
        List.of("Area in square meters", "area_in_square_meters", "area_sqm", "area", "Area", "vymera", "výměra"));

    private final String label;
    private final boolean required;
    private final List<String> aliases;

    CanonicalField(String label, boolean required, List<String> aliases) {
        this.label = label;
        this.required = required;
        this.aliases = aliases;
    }

    /**
     * Human-readable (Czech) label shown to applicants and clerks.
     */
    public String label() {
        return label;
    }

    public boolean required() {
        return required;
    }

    public List<String> aliases() {
        return aliases;
    }
}
