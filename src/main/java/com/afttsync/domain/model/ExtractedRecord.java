package com.afttsync.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A typed record extracted from one upstream document.
 *
 * <p>Each subclass is the variant for one {@link EntityKind}. Identity attributes are plain values;
 * every other attribute is a {@link Field} so the store can apply its merge rule without guessing
 * whether an empty value means "unknown".
 */
public abstract class ExtractedRecord {

    private final EntityKind kind;
    private final Map<String, Object> identity = new LinkedHashMap<>();
    private final Map<String, Field<?>> attributes = new LinkedHashMap<>();

    protected ExtractedRecord(EntityKind kind) {
        this.kind = kind;
    }

    public EntityKind kind() {
        return kind;
    }

    /**
     * Natural key used as the stored document id. Composite identities are joined with {@code |}.
     */
    public abstract String naturalKey();

    /**
     * Whether the natural key is well-formed. Malformed keys are rejected by the store.
     */
    public abstract boolean hasValidKey();

    /** Identity attributes, stored as-is alongside the merged attributes. */
    public Map<String, Object> identity() {
        return Collections.unmodifiableMap(identity);
    }

    /** Non-identity attributes in declaration order. */
    public Map<String, Field<?>> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    protected void identity(String name, Object value) {
        identity.put(name, value);
    }

    protected void attribute(String name, Field<?> value) {
        attributes.put(name, value == null ? Field.absent() : value);
    }

    @SuppressWarnings("unchecked")
    protected <T> Field<T> attribute(String name) {
        Field<?> field = attributes.get(name);
        return field == null ? Field.absent() : (Field<T>) field;
    }

    @Override
    public String toString() {
        return kind + "[" + naturalKey() + "]";
    }
}
