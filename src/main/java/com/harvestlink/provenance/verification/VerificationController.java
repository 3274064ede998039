package com.harvestlink.provenance.verification;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Verification endpoints. Always 200: an unverifiable identifier is a
 * result with valid=false, not an error.
 */
@RestController
@RequestMapping("/api/verify")
@RequiredArgsConstructor
public class VerificationController {

    private final VerificationResolver resolver;

    @GetMapping
    public ResponseEntity<VerificationResult> verifyScan(@RequestParam("code") String code) {
        return ResponseEntity.ok(resolver.verifyScan(code));
    }

    @GetMapping("/products/{id}")
    public ResponseEntity<VerificationResult> verifyProduct(@PathVariable("id") long id) {
        return ResponseEntity.ok(resolver.verifyProduct(id));
    }

    @GetMapping("/batches/{id}")
    public ResponseEntity<VerificationResult> verifyBatch(@PathVariable("id") long id) {
        return ResponseEntity.ok(resolver.verifyBatch(id));
    }
}
