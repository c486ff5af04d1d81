package com.ivamare.callsession.model;

import java.util.List;

/**
 * One page of a session listing.
 *
 * @param total Number of sessions matching the filter, independent of the page window
 * @param limit Page size used
 * @param offset Rows skipped
 * @param sessions Sessions in the page
 */
public record SessionPage(long total, int limit, int offset, List<CallSession> sessions) {

    public SessionPage {
        sessions = sessions != null ? List.copyOf(sessions) : List.of();
    }
}
