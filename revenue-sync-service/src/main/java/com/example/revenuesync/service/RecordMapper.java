package com.example.revenuesync.service;

import com.example.revenuesync.dto.MappedRecord;
import com.example.revenuesync.exception.MappingException;
import com.example.revenuesync.model.SourceRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.example.revenuesync.repository.SourceJobQuery.COL_CURRENCY;
import static com.example.revenuesync.repository.SourceJobQuery.COL_CUSTOMER;
import static com.example.revenuesync.repository.SourceJobQuery.COL_ENTITY;
import static com.example.revenuesync.repository.SourceJobQuery.COL_GROSS_MARGIN;
import static com.example.revenuesync.repository.SourceJobQuery.COL_GROUP;
import static com.example.revenuesync.repository.SourceJobQuery.COL_JOB_CREATED;
import static com.example.revenuesync.repository.SourceJobQuery.COL_QUOTE;
import static com.example.revenuesync.repository.SourceJobQuery.COL_STATUS;

/**
 * Converts a raw source row into the webhook record shape.
 *
 * Stateless and side-effect free. Required fields: TJ, Date, Amount, Currency, Status.
 * Customer, Group, Entity and Margin come from outer joins or nullable columns and may be
 * absent, but must have the right type when present.
 */
@Component
public class RecordMapper {

    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    /**
     * @throws MappingException when a required field is missing or any field has the wrong type
     */
    public MappedRecord map(SourceRecord record) {
        long key = record.key();

        return MappedRecord.builder()
                .customer(optionalString(record, COL_CUSTOMER, "Customer"))
                .group(optionalString(record, COL_GROUP, "Group"))
                .entity(optionalString(record, COL_ENTITY, "Entity"))
                .transactionId(transactionId(key))
                .date(requiredDate(record, COL_JOB_CREATED, "Date"))
                .amount(requiredNumber(record, COL_QUOTE, "Amount"))
                .currency(currency(record))
                .status(requiredString(record, COL_STATUS, "Status"))
                .margin(optionalNumber(record, COL_GROSS_MARGIN, "Margin"))
                .build();
    }

    public static String transactionId(long key) {
        return "TJ" + key;
    }

    private String currency(SourceRecord record) {
        String raw = requiredString(record, COL_CURRENCY, "Currency");
        String code = raw.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY_CODE.matcher(code).matches()) {
            throw new MappingException(record.key(), "Currency", "is not a 3-letter currency code: [" + raw + "]");
        }
        return code;
    }

    private static String requiredString(SourceRecord record, String column, String field) {
        Object value = record.get(column);
        if (value == null) {
            throw new MappingException(record.key(), field, "is missing");
        }
        if (!(value instanceof String text)) {
            throw new MappingException(record.key(), field, "has type " + value.getClass().getSimpleName() + ", expected text");
        }
        if (text.isBlank()) {
            throw new MappingException(record.key(), field, "is blank");
        }
        return text;
    }

    private static String optionalString(SourceRecord record, String column, String field) {
        Object value = record.get(column);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new MappingException(record.key(), field, "has type " + value.getClass().getSimpleName() + ", expected text");
        }
        return text;
    }

    private static BigDecimal requiredNumber(SourceRecord record, String column, String field) {
        Object value = record.get(column);
        if (value == null) {
            throw new MappingException(record.key(), field, "is missing");
        }
        return toDecimal(record.key(), field, value);
    }

    private static BigDecimal optionalNumber(SourceRecord record, String column, String field) {
        Object value = record.get(column);
        return value == null ? null : toDecimal(record.key(), field, value);
    }

    private static BigDecimal toDecimal(long key, String field, Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new MappingException(key, field, "is not a finite number: " + value);
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        throw new MappingException(key, field, "has type " + value.getClass().getSimpleName() + ", expected a number");
    }

    private static LocalDateTime requiredDate(SourceRecord record, String column, String field) {
        Object value = record.get(column);
        if (value == null) {
            throw new MappingException(record.key(), field, "is missing");
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDateTime();
        }
        throw new MappingException(record.key(), field, "has type " + value.getClass().getSimpleName() + ", expected a date");
    }
}
