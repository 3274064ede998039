package com.harvestlink.provenance.ledger;

/**
 * Access-control roles defined by the ledger contract.
 * The contract identifies each role by the hash of its role id.
 */
public enum LedgerRole {
    FARMER("FARMER_ROLE"),
    DISTRIBUTOR("DISTRIBUTOR_ROLE"),
    RETAILER("RETAILER_ROLE"),
    CONSUMER("CONSUMER_ROLE");

    private final String roleId;

    LedgerRole(String roleId) {
        this.roleId = roleId;
    }

    public String getRoleId() {
        return roleId;
    }
}
