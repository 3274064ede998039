package com.harvestlink.provenance.ledger;

import java.util.List;
import java.util.Optional;

/**
 * The externally supplied wallet: account access and block lookups.
 */
public interface WalletProvider {

    /**
     * Whether a wallet is installed at all.
     */
    boolean isAvailable();

    /**
     * Asks the holder for account access.
     *
     * @throws com.harvestlink.provenance.ledger.exception.UserRejectedException if the holder declines
     */
    List<String> requestAccounts();

    /**
     * Accounts already authorized, without prompting.
     */
    List<String> listAccounts();

    Optional<BlockInfo> getBlock(long blockNumber);
}
