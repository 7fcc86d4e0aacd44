package com.sandy.esl.tracker.service;

import com.sandy.esl.tracker.entity.EslRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface EslRecordService {
    EslRecord save(EslRecord record);
    List<EslRecord> findUnprintedBySerial(String serial);
    EslRecord markPrinted(EslRecord record);
    List<EslRecord> findByDateRange(String serial, String start, String end);

    /**
     * Marks every unprinted record of a device as printed, stopping at the first failure.
     */
    List<EslRecord> printAll(String serial);

    CompletableFuture<EslRecord> saveAsync(EslRecord record);
    CompletableFuture<List<EslRecord>> findUnprintedBySerialAsync(String serial);
    CompletableFuture<EslRecord> markPrintedAsync(EslRecord record);
    CompletableFuture<List<EslRecord>> findByDateRangeAsync(String serial, String start, String end);
}
