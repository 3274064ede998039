package com.harvestlink.provenance.lifecycle;

import java.util.List;

/**
 * Lifecycle stage tables known to have been deployed.
 *
 * HARVEST is the table used by the verification flow and the default.
 * LEGACY is the older six-stage table; select it only if the ledger being
 * mirrored still writes those codes.
 */
public enum StatusTable {
    HARVEST(List.of(
        "Harvested",
        "Processed",
        "Packed",
        "ForSale",
        "Sold",
        "Shipped",
        "Received",
        "Purchased"
    )),
    LEGACY(List.of(
        "Pending",
        "Harvested",
        "In Transit",
        "Processed",
        "Distributed",
        "Sold"
    ));

    private final List<String> stageNames;

    StatusTable(List<String> stageNames) {
        this.stageNames = stageNames;
    }

    public List<String> getStageNames() {
        return stageNames;
    }
}
