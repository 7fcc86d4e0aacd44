package com.sandy.esl.tracker.service.impl;

import com.sandy.esl.tracker.client.ParseClient;
import com.sandy.esl.tracker.entity.EslRecord;
import com.sandy.esl.tracker.service.EslRecords;
import com.sandy.esl.tracker.service.EslStore;
import com.sandy.esl.tracker.tools.EslTimestamps;
import com.sandy.esl.tracker.vo.ParseCreated;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores records as objects of one Parse class. Identities and creation times come from the Parse server.
 */
@Slf4j
public class ParseEslStore implements EslStore {

    private final ParseClient parseClient;
    private final String collection;

    public ParseEslStore(ParseClient parseClient, String collection) {
        this.parseClient = parseClient;
        this.collection = collection;
    }

    @Override
    public EslRecord save(EslRecord record) {
        EslRecords.requireSavable(record);
        ParseCreated created = parseClient.save(collectionPath(), record);
        record.assignIdentity(created.getObjectId(), created.getCreatedAt());
        log.info("Saved ESL serial={} eslId={} objectId={}", record.getSerial(), record.getLabelId(), record.getIdentity());
        return record;
    }

    @Override
    public List<EslRecord> findUnprintedBySerial(String serial) {
        EslRecords.requireSerial(serial);
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("serial", serial);
        where.put("printed", false);
        List<EslRecord> records = parseClient.fetch(collectionPath(), where, EslRecord.class);
        log.debug("Found {} unprinted ESL for serial={}", records.size(), serial);
        return records;
    }

    @Override
    public EslRecord markPrinted(EslRecord record) {
        EslRecords.requireIdentity(record);
        parseClient.update(collectionPath() + "/" + record.getIdentity(), Map.of("printed", true));
        record.markPrinted();
        log.info("ESL objectId={} marked as printed", record.getIdentity());
        return record;
    }

    @Override
    public List<EslRecord> findByDateRange(String serial, String start, String end) {
        EslRecords.requireSerial(serial);
        LocalDateTime from = EslTimestamps.parseRangeBound(start);
        LocalDateTime to = EslTimestamps.parseRangeBound(end);
        Map<String, Object> createdAt = new LinkedHashMap<>();
        createdAt.put("$gt", parseDate(from));
        createdAt.put("$lt", parseDate(to));
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("serial", serial);
        where.put("createdAt", createdAt);
        List<EslRecord> records = parseClient.fetch(collectionPath(), where, EslRecord.class);
        log.debug("Found {} ESL for serial={} between {} and {}", records.size(), serial, start, end);
        return records;
    }

    private String collectionPath() {
        return "classes/" + collection;
    }

    /**
     * Parse only compares dates against its own Date type, bounds are taken as UTC.
     */
    private static Map<String, Object> parseDate(LocalDateTime value) {
        Map<String, Object> date = new LinkedHashMap<>();
        date.put("__type", "Date");
        date.put("iso", EslTimestamps.toParseIso(value));
        return date;
    }
}
