package org.mitoseeker.enrichment;

import org.mitoseeker.exceptions.MitoSeekerException;

/**
 * Thrown by an {@link ImpactLookup} that cannot answer at all (source offline, unreadable, timed out).
 * A lookup that simply has no data for a key returns an empty list instead.
 */
public class EnrichmentUnavailableException extends MitoSeekerException {
    private static final long serialVersionUID = 0L;

    public EnrichmentUnavailableException(final String msg) {
        super(msg);
    }

    public EnrichmentUnavailableException(final String message, final Throwable throwable) {
        super(message, throwable);
    }
}
