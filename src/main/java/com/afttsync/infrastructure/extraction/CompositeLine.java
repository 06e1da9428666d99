package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.model.Field;

/**
 * Parts of a {@code "id - full name - rank"} heading.
 */
public record CompositeLine(String id, Field<String> name, Field<String> rank) {
}
