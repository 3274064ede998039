package com.harvestlink.provenance.ledger.local;

import com.harvestlink.provenance.ledger.BlockInfo;
import com.harvestlink.provenance.ledger.WalletProvider;
import com.harvestlink.provenance.ledger.exception.UserRejectedException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wallet backed by a fixed list of development accounts.
 *
 * Accounts are only listed after the first approved request, like a browser
 * wallet that has not yet been authorized for the site.
 */
public class LocalWalletProvider implements WalletProvider {

    private final List<String> accounts;
    private final InMemoryLedgerContract ledger;
    private final boolean approveRequests;
    private final AtomicBoolean authorized = new AtomicBoolean(false);

    public LocalWalletProvider(List<String> accounts, InMemoryLedgerContract ledger, boolean approveRequests) {
        this.accounts = List.copyOf(accounts);
        this.ledger = ledger;
        this.approveRequests = approveRequests;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<String> requestAccounts() {
        if (!approveRequests) {
            throw new UserRejectedException("Account access request was rejected");
        }
        authorized.set(true);
        return accounts;
    }

    @Override
    public List<String> listAccounts() {
        return authorized.get() ? accounts : List.of();
    }

    @Override
    public Optional<BlockInfo> getBlock(long blockNumber) {
        return ledger.block(blockNumber);
    }
}
