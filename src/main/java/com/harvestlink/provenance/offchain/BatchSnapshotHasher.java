package com.harvestlink.provenance.offchain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over the canonical JSON of a batch's registration data.
 *
 * Canonical form: keys sorted, decimals without trailing zeros, dates as
 * ISO strings. Only fields fixed at registration take part; quantity sold,
 * status and the issued QR code change legitimately and are left out.
 */
@Component
@RequiredArgsConstructor
public class BatchSnapshotHasher {

    private final ObjectMapper objectMapper;

    public String hash(OffChainBatch batch) {
        try {
            byte[] json = canonicalJson(batch).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    String canonicalJson(OffChainBatch batch) {
        OffChainBatch.CropDetails crop = batch.getCrop();
        Map<String, Object> snapshot = new TreeMap<>();
        snapshot.put("batchId", batch.getId());
        snapshot.put("batchNumber", batch.getBatchNumber());
        snapshot.put("unit", batch.getUnit());
        snapshot.put("pricePerUnit", decimal(batch.getPricePerUnit()));
        snapshot.put("crop", crop.getName());
        snapshot.put("description", crop.getDescription());
        snapshot.put("registeredQuantity", decimal(crop.getQuantity()));
        snapshot.put("harvestDate", crop.getHarvestDate() == null ? null : crop.getHarvestDate().toString());
        snapshot.put("location", crop.getLocation());
        snapshot.put("farmer", crop.getFarmerName());
        snapshot.put("certifications", crop.getCertifications() == null ? List.of() : crop.getCertifications());
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize snapshot of batch " + batch.getId(), e);
        }
    }

    private static String decimal(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }
}
