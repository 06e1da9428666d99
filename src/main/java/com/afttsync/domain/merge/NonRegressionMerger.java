package com.afttsync.domain.merge;

import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.MergeMode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combines an incoming record with the stored entity of the same identity.
 *
 * <p>Rules for {@link MergeMode#NON_REGRESSION}:
 * <ul>
 *   <li>a present incoming value replaces the stored value;</li>
 *   <li>an absent incoming value keeps the stored value;</li>
 *   <li>when both are missing and a derivation exists for the attribute, the derived value is used;</li>
 *   <li>a new entity stores absent attributes as {@code null}.</li>
 * </ul>
 * {@link MergeMode#REPLACE} records overwrite the stored entity whole.
 *
 * <p>This class does no I/O. Stored values come in and go out in their stored shape
 * (see {@link StoredValues}); keys the store manages itself (names starting with {@code _}) are
 * carried over untouched.
 */
public class NonRegressionMerger {

    private final List<AttributeDerivation> derivations;

    public NonRegressionMerger(List<AttributeDerivation> derivations) {
        this.derivations = List.copyOf(derivations);
    }

    /**
     * Returns why the record cannot be stored, or empty when it can.
     */
    public Optional<String> rejectionReason(ExtractedRecord record) {
        if (!record.hasValidKey()) {
            return Optional.of("malformed natural key '" + record.naturalKey() + "'");
        }
        return Optional.empty();
    }

    /**
     * @param stored   stored values, or {@code null} when the entity does not exist yet
     * @param incoming the record to merge
     */
    public MergedEntity merge(Map<String, Object> stored, ExtractedRecord incoming) {
        boolean inserted = stored == null;
        Map<String, Object> merged = new LinkedHashMap<>();
        if (!inserted) {
            stored.forEach((name, value) -> {
                if (name.startsWith("_")) {
                    merged.put(name, value);
                }
            });
        }
        incoming.identity().forEach((name, value) -> merged.put(name, StoredValues.encode(value)));

        boolean replace = incoming.kind().getMergeMode() == MergeMode.REPLACE;
        for (Map.Entry<String, Field<?>> entry : incoming.attributes().entrySet()) {
            String name = entry.getKey();
            Field<?> field = entry.getValue();
            if (field.isPresent()) {
                merged.put(name, StoredValues.encode(field.get()));
                continue;
            }
            Object previous = replace || inserted ? null : stored.get(name);
            if (previous == null) {
                previous = derive(incoming, name).orElse(null);
            }
            merged.put(name, previous);
        }
        for (AttributeDerivation derivation : derivations) {
            if (derivation.kind() == incoming.kind() && merged.get(derivation.attribute()) == null) {
                Object previous = inserted ? null : stored.get(derivation.attribute());
                merged.put(derivation.attribute(), previous != null
                    ? previous
                    : derivation.derive(incoming).map(StoredValues::encode).orElse(null));
            }
        }

        if (!replace && !inserted) {
            // Attributes this record kind does not carry stay as they were.
            stored.forEach((name, value) -> merged.putIfAbsent(name, value));
        }
        return new MergedEntity(merged, inserted);
    }

    private Optional<Object> derive(ExtractedRecord record, String attribute) {
        return derivations.stream()
            .filter(derivation -> derivation.kind() == record.kind() && derivation.attribute().equals(attribute))
            .map(derivation -> derivation.derive(record))
            .flatMap(Optional::stream)
            .map(StoredValues::encode)
            .findFirst();
    }
}
