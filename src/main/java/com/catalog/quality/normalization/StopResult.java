package com.catalog.quality.normalization;

import java.util.List;

/**
 * @param wasRunning      whether any matching session was running when stop was requested
 * @param sessionIds      sessions that were signalled
 */
public record StopResult(boolean wasRunning, List<String> sessionIds) {

    public StopResult {
        sessionIds = List.copyOf(sessionIds);
    }
}
