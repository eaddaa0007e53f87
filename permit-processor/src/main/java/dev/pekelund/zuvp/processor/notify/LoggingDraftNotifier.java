package dev.pekelund.zuvp.processor.notify;

import dev.pekelund.zuvp.drafts.Draft;
import dev.pekelund.zuvp.notify.DraftNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier that writes the clerk notification to the log instead of sending it.
 */
public class LoggingDraftNotifier implements DraftNotifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDraftNotifier.class);

    @Override
    public void draftCreated(Draft draft) {
        DraftNotificationMessage message = DraftNotificationMessage.forDraft(draft);
        LOGGER.info("""
            ========================================
            Draft notification for {}
            Subject: {}
            {}
            ========================================""", draft.id(), message.subject(), message.body());
    }
}
