package com.example.revenuesync.repository;

import com.example.revenuesync.model.Watermark;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds keyset-paginated page queries against the bi_data jobs table.
 *
 * Full scans page on the primary key alone. Incremental scans page on
 * (changed_at, job_id) so rows sharing a timestamp keep a stable order across pages
 * and across runs. Neither uses OFFSET: each page starts strictly after the last row
 * of the previous one.
 */
public final class SourceJobQuery {

    public static final String COL_JOB_ID = "job_id";
    public static final String COL_CUSTOMER = "customer";
    public static final String COL_GROUP = "group_name";
    public static final String COL_ENTITY = "entity";
    public static final String COL_JOB_CREATED = "job_created";
    public static final String COL_QUOTE = "quote";
    public static final String COL_CURRENCY = "quote_currency";
    public static final String COL_STATUS = "job_status";
    public static final String COL_GROSS_MARGIN = "gross_margin";
    public static final String COL_CHANGED_AT = "changed_at";

    public static final LocalDateTime CHANGED_AT_FLOOR = LocalDateTime.of(1970, 1, 1, 0, 0);

    /** A job counts as changed when it is created and again when it is completed. Never NULL. */
    static final String CHANGED_AT_EXPR =
            "COALESCE(GREATEST(j.job_created, COALESCE(j.completed_date, j.job_created)), "
                    + "j.completed_date, TIMESTAMP('1970-01-01 00:00:00'))";

    private static final String SELECT = """
            SELECT
                j.job_id               AS job_id,
                c.client_name          AS customer,
                g.group_name           AS group_name,
                sg.straker_group_name  AS entity,
                j.job_created          AS job_created,
                j.quote                AS quote,
                j.quote_currency       AS quote_currency,
                j.job_status           AS job_status,
                j.gross_margin         AS gross_margin,
                %s AS changed_at
            FROM jobs j
            LEFT OUTER JOIN clients c
                ON c.client_uuid = j.client_uuid
            LEFT OUTER JOIN `groups` g
                ON g.group_uuid = j.group_uuid
            LEFT OUTER JOIN straker_groups sg
                ON sg.straker_group_uuid = g.entity_uuid
            """.formatted(CHANGED_AT_EXPR);

    private SourceJobQuery() {
    }

    /**
     * One page of a full scan, ordered by job_id.
     *
     * @param afterKey last key already read, or null for the first page
     */
    public static Page fullScanPage(Long afterKey, LocalDate createdSince, int limit) {
        List<String> conditions = new ArrayList<>();
        List<Object> args = new ArrayList<>();

        if (createdSince != null) {
            conditions.add("j.job_created >= ?");
            args.add(createdSince.atStartOfDay());
        }
        if (afterKey != null) {
            conditions.add("j.job_id > ?");
            args.add(afterKey);
        }
        args.add(limit);

        String sql = SELECT + where(conditions) + "ORDER BY j.job_id\nLIMIT ?";
        return new Page(sql, args);
    }

    /**
     * One page of an incremental scan, ordered by (changed_at, job_id).
     *
     * @param after last position already read or committed, or null to start from the beginning
     */
    public static Page incrementalPage(Watermark after, LocalDate createdSince, int limit) {
        List<String> conditions = new ArrayList<>();
        List<Object> args = new ArrayList<>();

        if (createdSince != null) {
            conditions.add("j.job_created >= ?");
            args.add(createdSince.atStartOfDay());
        }
        if (after != null) {
            conditions.add("(" + CHANGED_AT_EXPR + " > ? OR (" + CHANGED_AT_EXPR + " = ? AND j.job_id > ?))");
            args.add(after.changedAt());
            args.add(after.changedAt());
            args.add(after.key());
        }
        args.add(limit);

        String sql = SELECT + where(conditions) + "ORDER BY changed_at, j.job_id\nLIMIT ?";
        return new Page(sql, args);
    }

    private static String where(List<String> conditions) {
        if (conditions.isEmpty()) {
            return "";
        }
        return "WHERE " + String.join("\n  AND ", conditions) + "\n";
    }

    /**
     * SQL text plus positional arguments, LIMIT last.
     */
    public record Page(String sql, List<Object> args) {

        public Page {
            args = List.copyOf(args);
        }

        public Object[] argArray() {
            return args.toArray();
        }
    }
}
