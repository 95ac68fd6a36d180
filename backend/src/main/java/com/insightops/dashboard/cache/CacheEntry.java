package com.insightops.dashboard.cache;

import lombok.Value;

import java.time.Instant;

/**
 * A cached value and the instant after which it must no longer be served.
 */
@Value
class CacheEntry {

    Object value;

    Instant expiresAt;

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
