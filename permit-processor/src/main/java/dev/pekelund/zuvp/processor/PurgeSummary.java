package dev.pekelund.zuvp.processor;

/**
 * Counts of what {@link PermitPipeline#purge()} removed.
 */
public record PurgeSummary(int drafts, int documents, int cacheEntries, int uploads) {
}
