package com.sandy.esl.tracker.service.impl;

import com.sandy.esl.tracker.entity.EslRecord;
import com.sandy.esl.tracker.entity.EslType;
import com.sandy.esl.tracker.exception.EslErrorCode;
import com.sandy.esl.tracker.exception.EslStoreException;
import com.sandy.esl.tracker.exception.PlatformException;
import com.sandy.esl.tracker.service.EslStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EslRecordServiceImplTest {

    private EslStore store;
    private EslRecordServiceImpl service;

    @BeforeEach
    void init() {
        store = mock(EslStore.class);
        Executor direct = Runnable::run;
        service = new EslRecordServiceImpl(store, direct);
    }

    private static EslRecord saved(String objectId) {
        EslRecord record = EslRecord.builder().type(EslType.Pricer).serial("DEV-1").labelId("label-" + objectId).build();
        record.assignIdentity(objectId, LocalDateTime.now());
        return record;
    }

    @Test
    void printAllMarksEveryUnprintedRecord() {
        EslRecord a = saved("a");
        EslRecord b = saved("b");
        when(store.findUnprintedBySerial("DEV-1")).thenReturn(List.of(a, b));
        when(store.markPrinted(any())).thenAnswer(inv -> {
            EslRecord r = inv.getArgument(0);
            r.markPrinted();
            return r;
        });

        List<EslRecord> printed = service.printAll("DEV-1");

        assertEquals(List.of(a, b), printed);
        assertTrue(a.isPrinted());
        assertTrue(b.isPrinted());
        verify(store).markPrinted(a);
        verify(store).markPrinted(b);
    }

    @Test
    void printAllStopsAtFirstFailure() {
        EslRecord a = saved("a");
        EslRecord b = saved("b");
        when(store.findUnprintedBySerial("DEV-1")).thenReturn(List.of(a, b));
        when(store.markPrinted(a)).thenThrow(new PlatformException(404, "Object not found."));

        assertThrows(PlatformException.class, () -> service.printAll("DEV-1"));
        verify(store, never()).markPrinted(b);
    }

    @Test
    void printAllOfDeviceWithNothingPendingDoesNothing() {
        when(store.findUnprintedBySerial("DEV-1")).thenReturn(List.of());

        assertTrue(service.printAll("DEV-1").isEmpty());
        verify(store, never()).markPrinted(any());
    }

    @Test
    void asyncVariantsCompleteWithTheStoreResult() throws Exception {
        EslRecord a = saved("a");
        when(store.findUnprintedBySerial("DEV-1")).thenReturn(List.of(a));
        when(store.findByDateRange("DEV-1", "2024-01-01 00:00:00:000", "2024-12-31 00:00:00:000")).thenReturn(List.of(a));
        when(store.markPrinted(a)).thenReturn(a);

        assertEquals(List.of(a), service.findUnprintedBySerialAsync("DEV-1").get(5, TimeUnit.SECONDS));
        assertEquals(List.of(a), service.findByDateRangeAsync("DEV-1", "2024-01-01 00:00:00:000", "2024-12-31 00:00:00:000")
                .get(5, TimeUnit.SECONDS));
        assertSame(a, service.markPrintedAsync(a).get(5, TimeUnit.SECONDS));
    }

    @Test
    void asyncFailureCarriesTheStoreErrorAsCause() {
        EslRecord record = EslRecord.builder().type(EslType.Hanshow).serial("DEV-1").labelId("x").build();
        when(store.save(record)).thenThrow(EslStoreException.transport(new ConnectException("Connection refused")));

        CompletableFuture<EslRecord> future = service.saveAsync(record);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        EslStoreException cause = assertInstanceOf(EslStoreException.class, e.getCause());
        assertEquals(EslErrorCode.TRANSPORT, cause.getErrorCode());
        verify(store, times(1)).save(record);
    }
}
