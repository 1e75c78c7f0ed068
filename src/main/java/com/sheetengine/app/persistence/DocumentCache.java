package com.sheetengine.app.persistence;

import java.time.Duration;
import java.util.Optional;

/**
 * Ephemeral copy of serialized workbooks, rewritten after each confirmed save.
 */
public interface DocumentCache {

    Optional<String> get(String key);

    void setWithTtl(String key, String value, Duration ttl);
}
