package com.afttsync.domain.merge;

import com.afttsync.domain.model.EntityKind;
import com.afttsync.domain.model.ExtractedRecord;

import java.util.Optional;

/**
 * Deterministic value for an attribute, computed from a record's identity.
 * Used only when the attribute is absent both in the incoming record and in the stored entity.
 */
public interface AttributeDerivation {

    EntityKind kind();

    String attribute();

    Optional<Object> derive(ExtractedRecord record);
}
