package com.sandy.esl.tracker.service.impl;

import com.sandy.esl.tracker.entity.EslRecord;
import com.sandy.esl.tracker.service.EslRecordService;
import com.sandy.esl.tracker.service.EslStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for callers. Delegates to whichever {@link EslStore} is configured;
 * the async variants run on the {@code eslStoreExecutor} pool and never retry.
 */
@Service
@Slf4j
public class EslRecordServiceImpl implements EslRecordService {

    private final EslStore eslStore;
    private final Executor executor;

    public EslRecordServiceImpl(EslStore eslStore, @Qualifier("eslStoreExecutor") Executor executor) {
        this.eslStore = eslStore;
        this.executor = executor;
    }

    @Override
    public EslRecord save(EslRecord record) {
        log.debug("Saving ESL type={} serial={} eslId={}", record.getType(), record.getSerial(), record.getLabelId());
        return eslStore.save(record);
    }

    @Override
    public List<EslRecord> findUnprintedBySerial(String serial) {
        return eslStore.findUnprintedBySerial(serial);
    }

    @Override
    public EslRecord markPrinted(EslRecord record) {
        return eslStore.markPrinted(record);
    }

    @Override
    public List<EslRecord> findByDateRange(String serial, String start, String end) {
        return eslStore.findByDateRange(serial, start, end);
    }

    @Override
    public List<EslRecord> printAll(String serial) {
        List<EslRecord> pending = eslStore.findUnprintedBySerial(serial);
        log.info("Printing {} ESL for serial={}", pending.size(), serial);
        List<EslRecord> printed = new ArrayList<>(pending.size());
        for (EslRecord record : pending) {
            printed.add(eslStore.markPrinted(record));
        }
        return printed;
    }

    @Override
    public CompletableFuture<EslRecord> saveAsync(EslRecord record) {
        return CompletableFuture.supplyAsync(() -> save(record), executor);
    }

    @Override
    public CompletableFuture<List<EslRecord>> findUnprintedBySerialAsync(String serial) {
        return CompletableFuture.supplyAsync(() -> findUnprintedBySerial(serial), executor);
    }

    @Override
    public CompletableFuture<EslRecord> markPrintedAsync(EslRecord record) {
        return CompletableFuture.supplyAsync(() -> markPrinted(record), executor);
    }

    @Override
    public CompletableFuture<List<EslRecord>> findByDateRangeAsync(String serial, String start, String end) {
        return CompletableFuture.supplyAsync(() -> findByDateRange(serial, start, end), executor);
    }
}
