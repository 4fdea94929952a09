package com.example.revenuesync.exception;

import com.example.revenuesync.model.RunStage;
import lombok.Getter;

/**
 * A single source record could not be mapped. The record is skipped; the run continues.
 */
@Getter
public class MappingException extends SyncException {

    private final long recordKey;
    private final String field;

    public MappingException(long recordKey, String field, String reason) {
        super("MAPPING_FAILED", RunStage.MAP,
                "Record TJ" + recordKey + " rejected: field '" + field + "' " + reason);
        this.recordKey = recordKey;
        this.field = field;
    }
}
