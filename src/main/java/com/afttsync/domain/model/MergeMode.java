package com.afttsync.domain.model;

/**
 * How an incoming record is combined with the stored entity of the same identity.
 */
public enum MergeMode {
    /** Present incoming values win, absent ones keep the stored value. */
    NON_REGRESSION,
    /** The incoming record replaces the stored one whole. */
    REPLACE
}
