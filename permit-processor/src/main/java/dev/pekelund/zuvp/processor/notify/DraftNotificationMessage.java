package dev.pekelund.zuvp.processor.notify;

import dev.pekelund.zuvp.drafts.Draft;
import dev.pekelund.zuvp.permits.CanonicalRecord;
import org.springframework.util.StringUtils;

/**
 * Clerk-facing text announcing a new draft.
 */
record DraftNotificationMessage(String subject, String body) {

    static DraftNotificationMessage forDraft(Draft draft) {
        CanonicalRecord record = draft.record();
        String applicant = record != null ? orPlaceholder(record.applicantName()) : "N/A";
        String subject = "Nový koncept ZUVP - " + applicant;
        StringBuilder body = new StringBuilder();
        body.append("Nový koncept žádosti o ZUVP byl vytvořen:\n\n");
        body.append("Žadatel: ").append(applicant).append('\n');
        if (record != null) {
            body.append("Místo: ").append(orPlaceholder(record.location())).append('\n');
            body.append("Účel: ").append(orPlaceholder(record.purposeOfUse())).append('\n');
            body.append("Poplatek: ").append(record.feeCzk()).append(" Kč\n");
            body.append("VS: ").append(orPlaceholder(record.variableSymbol())).append('\n');
        }
        body.append("\nProsím zkontrolujte a schvalte v systému.\n\n");
        body.append("ID žádosti: ").append(draft.id()).append('\n');
        return new DraftNotificationMessage(subject, body.toString());
    }

    private static String orPlaceholder(String value) {
        return StringUtils.hasText(value) ? value : "N/A";
    }
}
