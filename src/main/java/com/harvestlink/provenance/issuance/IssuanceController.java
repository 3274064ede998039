package com.harvestlink.provenance.issuance;

import com.harvestlink.provenance.identifier.IssuedIdentifier;
import com.harvestlink.provenance.issuance.dto.AnchorRequest;
import com.harvestlink.provenance.issuance.dto.CreateLedgerBatchRequest;
import com.harvestlink.provenance.issuance.dto.CreateLedgerProductRequest;
import com.harvestlink.provenance.issuance.dto.IssueIdentifierRequest;
import com.harvestlink.provenance.issuance.dto.PurchaseRequest;
import com.harvestlink.provenance.issuance.dto.RegisterCropRequest;
import com.harvestlink.provenance.offchain.AnchoringRecord;
import com.harvestlink.provenance.offchain.OffChainDataStore;
import com.harvestlink.provenance.offchain.SupplyTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints that create identifiers: crop listings, public batch
 * identifiers, anchors and ledger registrations.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class IssuanceController {

    private final IdentifierIssuanceService issuanceService;
    private final OffChainDataStore offChainDataStore;

    @PostMapping("/identifiers")
    public ResponseEntity<IssuedIdentifier> issue(@Valid @RequestBody IssueIdentifierRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(issuanceService.issue(request.getKind(), request.getId()));
    }

    @PostMapping("/crops")
    public ResponseEntity<RegisteredCrop> registerCrop(@Valid @RequestBody RegisterCropRequest request) {
        log.info("Received crop registration: name={}, farmer={}", request.getName(), request.getFarmerName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(issuanceService.registerCrop(request.toRegistration()));
    }

    @PostMapping("/batches/{id}/public-identifier")
    public ResponseEntity<IssuedIdentifier> issuePublicIdentifier(@PathVariable("id") long id) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(issuanceService.issuePublicBatchIdentifier(id));
    }

    @PostMapping("/batches/{id}/anchors")
    public ResponseEntity<AnchoringRecord> anchor(@PathVariable("id") long id,
                                                  @Valid @RequestBody AnchorRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(issuanceService.anchor(id, request.getTransactionHash(), request.getBlockNumber()));
    }

    @PostMapping("/batches/{id}/purchases")
    public ResponseEntity<SupplyTransaction> purchase(@PathVariable("id") long id,
                                                      @Valid @RequestBody PurchaseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(offChainDataStore.recordPurchase(
                        id, request.getBuyer(), request.getQuantity(), request.getTransactionHash()));
    }

    @PostMapping("/ledger/products")
    public ResponseEntity<RegisteredProduct> createLedgerProduct(
            @Valid @RequestBody CreateLedgerProductRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(issuanceService.registerLedgerProduct(
                request.getName(), request.getDescription(), request.getContentHash(), request.getPrice()));
    }

    @PostMapping("/ledger/batches")
    public ResponseEntity<RegisteredBatch> createLedgerBatch(@Valid @RequestBody CreateLedgerBatchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(issuanceService.registerLedgerBatch(
                request.getProductIds(), request.getLocation(), request.getOffChainBatchId()));
    }
}
