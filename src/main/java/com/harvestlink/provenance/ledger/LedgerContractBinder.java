package com.harvestlink.provenance.ledger;

/**
 * Creates the contract binding on top of a wallet provider.
 */
@FunctionalInterface
public interface LedgerContractBinder {

    LedgerContract bind(WalletProvider walletProvider);
}
