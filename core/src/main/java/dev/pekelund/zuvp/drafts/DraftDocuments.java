package dev.pekelund.zuvp.drafts;

import java.util.List;

/**
 * Document types rendered for every draft.
 */
public final class DraftDocuments {

    public static final String CONSENT = "consent";
    public static final String PAYMENT = "payment";

    public static final List<String> REQUIRED = List.of(CONSENT, PAYMENT);

    private DraftDocuments() {
    }
}
