package com.harvestlink.provenance.ledger;

import com.harvestlink.provenance.ledger.dto.PurchaseBatchRequest;
import com.harvestlink.provenance.ledger.dto.TransactionResponse;
import com.harvestlink.provenance.ledger.dto.UpdateLocationRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Wallet session and state-changing ledger calls. Errors are mapped by the
 * global exception handler.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerClient ledgerClient;
    private final CurrencyConverter currencyConverter;

    @PostMapping("/connect")
    public ResponseEntity<AccountHandle> connect() {
        return ResponseEntity.ok(ledgerClient.connect());
    }

    @GetMapping("/account")
    public ResponseEntity<AccountHandle> account() {
        return ledgerClient.getConnectedAccount()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/batches/{id}/location")
    public ResponseEntity<TransactionResponse> updateLocation(@PathVariable("id") long id,
                                                              @Valid @RequestBody UpdateLocationRequest request) {
        TransactionRef ref = ledgerClient.submit(new ContractCall.UpdateBatchLocation(id, request.getLocation()));
        return ResponseEntity.ok(TransactionResponse.from(ref));
    }

    @PostMapping("/batches/{id}/purchase")
    public ResponseEntity<TransactionResponse> purchase(@PathVariable("id") long id,
                                                        @Valid @RequestBody PurchaseBatchRequest request) {
        TransactionRef ref = ledgerClient.submit(
                new ContractCall.PurchaseBatch(id, currencyConverter.toWei(request.getAmount())));
        return ResponseEntity.ok(TransactionResponse.from(ref));
    }
}
