package com.harvestlink.provenance.config;

import com.harvestlink.provenance.ledger.LedgerContractBinder;
import com.harvestlink.provenance.ledger.LedgerRole;
import com.harvestlink.provenance.ledger.WalletProvider;
import com.harvestlink.provenance.ledger.local.InMemoryLedgerContract;
import com.harvestlink.provenance.ledger.local.LocalWalletProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Development ledger wiring.
 *
 * Active when provenance.ledger.mode is in-memory (the default). A chain
 * adapter replaces it by providing its own {@link WalletProvider} and
 * {@link LedgerContractBinder} beans with a different mode.
 */
@Configuration
@ConditionalOnProperty(name = "provenance.ledger.mode", havingValue = "in-memory", matchIfMissing = true)
@Slf4j
public class LedgerConfig {

    @Value("${provenance.ledger.local.accounts:0xf00d000000000000000000000000000000000001}")
    private List<String> accounts;

    @Value("${provenance.ledger.local.redelivery-window:10000}")
    private int redeliveryWindow;

    @Value("${provenance.ledger.local.approve-requests:true}")
    private boolean approveRequests;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService ledgerLogDeliveryExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ledger-log-delivery");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public InMemoryLedgerContract inMemoryLedgerContract(ExecutorService ledgerLogDeliveryExecutor) {
        InMemoryLedgerContract ledger = new InMemoryLedgerContract(
                Clock.systemUTC(), ledgerLogDeliveryExecutor, redeliveryWindow);
        // First configured account acts as the farmer, the rest as distributors
        ledger.grantRole(LedgerRole.FARMER, accounts.get(0));
        accounts.stream().skip(1).forEach(account -> ledger.grantRole(LedgerRole.DISTRIBUTOR, account));
        log.info("In-memory ledger ready with {} development account(s)", accounts.size());
        return ledger;
    }

    @Bean
    public WalletProvider localWalletProvider(InMemoryLedgerContract inMemoryLedgerContract) {
        return new LocalWalletProvider(accounts, inMemoryLedgerContract, approveRequests);
    }

    @Bean
    public LedgerContractBinder inMemoryContractBinder(InMemoryLedgerContract inMemoryLedgerContract) {
        return provider -> inMemoryLedgerContract;
    }
}
