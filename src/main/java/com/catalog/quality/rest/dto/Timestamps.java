package com.catalog.quality.rest.dto;

import java.time.Instant;

final class Timestamps {

    private Timestamps() {
    }

    static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
