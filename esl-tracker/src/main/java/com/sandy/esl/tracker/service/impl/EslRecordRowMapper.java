package com.sandy.esl.tracker.service.impl;

import com.sandy.esl.tracker.entity.EslRecord;
import com.sandy.esl.tracker.entity.EslType;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Maps an {@code esl} row by column name.
 * Columns missing from older revisions of the table are read as null.
 */
public class EslRecordRowMapper implements RowMapper<EslRecord> {

    @Override
    public EslRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Set<String> columns = columnsOf(rs);
        Timestamp createdAt = columns.contains("createdat") ? rs.getTimestamp("createdAt") : null;
        return EslRecord.builder()
                .identity(text(rs, columns, "objectId"))
                .type(type(text(rs, columns, "type")))
                .serial(text(rs, columns, "serial"))
                .printed(columns.contains("printed") && rs.getBoolean("printed"))
                .labelId(text(rs, columns, "eslId"))
                .itemId(text(rs, columns, "itemId"))
                .name(text(rs, columns, "nom"))
                .scientificName(text(rs, columns, "nomScientifique"))
                .price(text(rs, columns, "prix"))
                .priceInfo(text(rs, columns, "infosPrix"))
                .fishingGear(text(rs, columns, "engin"))
                .zone(text(rs, columns, "zone"))
                .zoneCode(text(rs, columns, "zoneCode"))
                .subZone(text(rs, columns, "sousZone"))
                .subZoneCode(text(rs, columns, "sousZoneCode"))
                .plu(text(rs, columns, "plu"))
                .size(text(rs, columns, "taille"))
                .freezingInfo(text(rs, columns, "congelInfos"))
                .origin(text(rs, columns, "origine"))
                .allergens(text(rs, columns, "allergenes"))
                .label(text(rs, columns, "label"))
                .productionMethod(text(rs, columns, "production"))
                .vatRate(text(rs, columns, "tva"))
                .categoryCode(text(rs, columns, "codeCategorie"))
                .purchasePrice(text(rs, columns, "prixAchat"))
                .createdAt(createdAt != null ? createdAt.toLocalDateTime() : null)
                .build();
    }

    private static Set<String> columnsOf(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Set<String> names = new HashSet<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            names.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return names;
    }

    private static String text(ResultSet rs, Set<String> columns, String column) throws SQLException {
        return columns.contains(column.toLowerCase(Locale.ROOT)) ? rs.getString(column) : null;
    }

    private static EslType type(String value) throws SQLException {
        if (value == null) {
            return null;
        }
        try {
            return EslType.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new SQLDataException("Unknown ESL type '" + value + "'", e);
        }
    }
}
