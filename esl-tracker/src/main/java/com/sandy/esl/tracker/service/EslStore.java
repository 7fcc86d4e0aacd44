package com.sandy.esl.tracker.service;

import com.sandy.esl.tracker.entity.EslRecord;

import java.util.List;

/**
 * Persistence of ESL records, implemented once per backend.
 * <p>
 * Failures are reported as {@link com.sandy.esl.tracker.exception.EslStoreException}.
 * Precondition violations on the arguments raise {@link IllegalArgumentException} before any I/O.
 */
public interface EslStore {

    /**
     * Persists a new record and returns it with its identity and creation time set.
     * The record must have a serial and a label id, and no identity yet.
     */
    EslRecord save(EslRecord record);

    /**
     * All records of a device that have not been printed yet.
     */
    List<EslRecord> findUnprintedBySerial(String serial);

    /**
     * Flags a saved record as printed on the backend, then locally.
     *
     * @throws com.sandy.esl.tracker.exception.MissingIdentityException if the record was never saved
     */
    EslRecord markPrinted(EslRecord record);

    /**
     * Printed and unprinted records of a device created strictly between {@code start} and {@code end}.
     * Both bounds use the {@code yyyy-MM-dd HH:mm:ss:SSS} format.
     */
    List<EslRecord> findByDateRange(String serial, String start, String end);
}
