package com.catalog.quality.api;

import java.util.List;

/**
 * Stop never fails for lack of work; {@code wasRunning} tells whether anything was signalled.
 */
public record StopResponse(boolean success, String message, boolean wasRunning, List<String> sessionIds) {

    public StopResponse {
        sessionIds = List.copyOf(sessionIds);
    }
}
