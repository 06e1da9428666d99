package com.afttsync.domain.merge;

import java.util.Map;

/**
 * Result of merging a record into a stored entity: the full stored values and whether the entity is new.
 */
public record MergedEntity(Map<String, Object> values, boolean inserted) {
}
