package dev.pekelund.zuvp.notify;

import dev.pekelund.zuvp.drafts.Draft;

/**
 * Fire-and-forget notification that a draft awaits clerk approval.
 */
public interface DraftNotifier {

    void draftCreated(Draft draft);
}
