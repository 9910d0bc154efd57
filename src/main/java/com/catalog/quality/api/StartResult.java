package com.catalog.quality.api;

import java.util.List;

public record StartResult(boolean success, String message, List<String> sessionIds) {

    public StartResult {
        sessionIds = List.copyOf(sessionIds);
    }
}
