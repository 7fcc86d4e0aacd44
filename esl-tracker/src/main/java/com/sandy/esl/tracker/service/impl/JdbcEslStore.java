package com.sandy.esl.tracker.service.impl;

import com.sandy.esl.tracker.entity.EslRecord;
import com.sandy.esl.tracker.exception.EslErrorCode;
import com.sandy.esl.tracker.exception.EslStoreException;
import com.sandy.esl.tracker.service.EslRecords;
import com.sandy.esl.tracker.service.EslStore;
import com.sandy.esl.tracker.tools.EslTimestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Stores records in the {@code esl} table. Each statement borrows one pooled connection
 * and gives it back when done. Identities are random UUIDs and creation times are UTC,
 * both assigned here and written by the single INSERT of a save.
 */
@Slf4j
public class JdbcEslStore implements EslStore {

    static final String INSERT_SQL = "INSERT INTO esl"
            + " (objectId, nom, nomScientifique, plu, congelInfos, type, origine, serial, printed, eslId, prix, zone,"
            + " sousZone, engin, zoneCode, sousZoneCode, infosPrix, taille, production, allergenes, itemId, label,"
            + " tva, codeCategorie, prixAchat, createdAt)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    static final String FIND_UNPRINTED_SQL = "SELECT * FROM esl WHERE serial = ? AND printed = false";
    static final String MARK_PRINTED_SQL = "UPDATE esl SET printed = true WHERE objectId = ?";
    static final String FIND_BY_DATE_SQL = "SELECT * FROM esl WHERE serial = ? AND createdAt > ? AND createdAt < ?";

    private final JdbcTemplate jdbcTemplate;
    private final EslRecordRowMapper rowMapper = new EslRecordRowMapper();

    public JdbcEslStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public EslRecord save(EslRecord record) {
        EslRecords.requireSavable(record);
        String objectId = UUID.randomUUID().toString();
        // UTC, millisecond precision
        LocalDateTime createdAt = LocalDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        execute("save", () -> jdbcTemplate.update(INSERT_SQL,
                objectId, record.getName(), record.getScientificName(), record.getPlu(), record.getFreezingInfo(),
                record.getType() != null ? record.getType().name() : null, record.getOrigin(), record.getSerial(),
                false, record.getLabelId(), record.getPrice(), record.getZone(), record.getSubZone(),
                record.getFishingGear(), record.getZoneCode(), record.getSubZoneCode(), record.getPriceInfo(),
                record.getSize(), record.getProductionMethod(), record.getAllergens(), record.getItemId(),
                record.getLabel(), record.getVatRate(), record.getCategoryCode(), record.getPurchasePrice(),
                Timestamp.valueOf(createdAt)));
        record.assignIdentity(objectId, createdAt);
        log.info("Saved ESL serial={} eslId={} objectId={}", record.getSerial(), record.getLabelId(), objectId);
        return record;
    }

    @Override
    public List<EslRecord> findUnprintedBySerial(String serial) {
        EslRecords.requireSerial(serial);
        List<EslRecord> records = execute("findUnprintedBySerial",
                () -> jdbcTemplate.query(FIND_UNPRINTED_SQL, rowMapper, serial));
        log.debug("Found {} unprinted ESL for serial={}", records.size(), serial);
        return records;
    }

    @Override
    public EslRecord markPrinted(EslRecord record) {
        EslRecords.requireIdentity(record);
        int updated = execute("markPrinted", () -> jdbcTemplate.update(MARK_PRINTED_SQL, record.getIdentity()));
        if (updated == 0) {
            log.warn("No ESL row with objectId={} to mark as printed", record.getIdentity());
            throw new EslStoreException(EslErrorCode.DATABASE, "no row with objectId " + record.getIdentity());
        }
        record.markPrinted();
        log.info("ESL objectId={} marked as printed", record.getIdentity());
        return record;
    }

    @Override
    public List<EslRecord> findByDateRange(String serial, String start, String end) {
        EslRecords.requireSerial(serial);
        Timestamp from = Timestamp.valueOf(EslTimestamps.parseRangeBound(start));
        Timestamp to = Timestamp.valueOf(EslTimestamps.parseRangeBound(end));
        List<EslRecord> records = execute("findByDateRange",
                () -> jdbcTemplate.query(FIND_BY_DATE_SQL, rowMapper, serial, from, to));
        log.debug("Found {} ESL for serial={} between {} and {}", records.size(), serial, start, end);
        return records;
    }

    /**
     * Runs one database call, reporting any failure (pool timeout included) as a DATABASE error.
     */
    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Database error during {}: {}", operation, e.getMessage());
            throw EslStoreException.database(e);
        }
    }
}
