package com.harvestlink.provenance.lifecycle;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps ledger status codes to lifecycle stage names.
 *
 * Total: codes outside the table map to {@value #UNKNOWN}, since the table
 * can lag behind ledger upgrades.
 */
@Component
public class LifecycleStatusMapper {

    public static final String UNKNOWN = "Unknown";

    private final StatusTable table;

    public LifecycleStatusMapper(@Value("${provenance.lifecycle.status-table:HARVEST}") StatusTable table) {
        this.table = table;
    }

    public static LifecycleStatusMapper canonical() {
        return new LifecycleStatusMapper(StatusTable.HARVEST);
    }

    public String statusName(int code) {
        if (code < 0 || code >= table.getStageNames().size()) {
            return UNKNOWN;
        }
        return table.getStageNames().get(code);
    }

    public StatusTable getTable() {
        return table;
    }
}
