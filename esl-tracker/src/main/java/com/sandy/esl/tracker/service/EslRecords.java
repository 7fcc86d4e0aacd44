package com.sandy.esl.tracker.service;

import com.sandy.esl.tracker.entity.EslRecord;
import com.sandy.esl.tracker.exception.MissingIdentityException;

/**
 * Argument checks shared by the store implementations.
 */
public final class EslRecords {

    private EslRecords() {
    }

    public static void requireSavable(EslRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        if (record.hasIdentity()) {
            throw new IllegalArgumentException("record already saved with objectId " + record.getIdentity());
        }
        if (record.isPrinted()) {
            throw new IllegalArgumentException("a new record must start unprinted");
        }
        requireSerial(record.getSerial());
        if (record.getLabelId() == null || record.getLabelId().isBlank()) {
            throw new IllegalArgumentException("eslId must be set before saving");
        }
    }

    public static void requireIdentity(EslRecord record) {
        if (record == null || !record.hasIdentity()) {
            throw new MissingIdentityException();
        }
    }

    public static void requireSerial(String serial) {
        if (serial == null || serial.isBlank()) {
            throw new IllegalArgumentException("serial must not be blank");
        }
    }
}
