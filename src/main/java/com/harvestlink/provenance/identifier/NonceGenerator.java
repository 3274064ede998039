package com.harvestlink.provenance.identifier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Produces per-issuance nonces.
 *
 * Strong nonces are random version-4 UUIDs drawn from a {@link SecureRandom}
 * of the configured algorithm. If that source cannot be obtained, or fails
 * while generating, the nonce degrades to {@code <epochMillis>-<8 base36 chars>}
 * and is reported as {@link NonceAssurance#WEAK}.
 */
@Component
@Slf4j
public class NonceGenerator {

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int WEAK_SUFFIX_LENGTH = 8;

    private final SecureRandom strongSource;

    @Autowired
    public NonceGenerator(@Value("${provenance.identifier.nonce-algorithm:DRBG}") String algorithm) {
        this(loadStrongSource(algorithm));
    }

    NonceGenerator(SecureRandom strongSource) {
        this.strongSource = strongSource;
    }

    public Nonce next() {
        if (strongSource != null) {
            try {
                byte[] bytes = new byte[16];
                strongSource.nextBytes(bytes);
                return new Nonce(toRandomUuid(bytes).toString(), NonceAssurance.STRONG);
            } catch (ProviderException e) {
                log.warn("Strong random source failed, issuing lower-assurance nonce: {}", e.getMessage());
            }
        }
        return new Nonce(weakNonce(), NonceAssurance.WEAK);
    }

    public boolean hasStrongSource() {
        return strongSource != null;
    }

    private static SecureRandom loadStrongSource(String algorithm) {
        try {
            return SecureRandom.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            log.warn("Secure random algorithm {} unavailable; identifiers will carry lower-assurance nonces",
                    algorithm);
            return null;
        }
    }

    private static UUID toRandomUuid(byte[] bytes) {
        bytes[6] &= 0x0f;
        bytes[6] |= 0x40;  // version 4
        bytes[8] &= 0x3f;
        bytes[8] |= (byte) 0x80;  // IETF variant
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    private static String weakNonce() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(WEAK_SUFFIX_LENGTH);
        for (int i = 0; i < WEAK_SUFFIX_LENGTH; i++) {
            suffix.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return System.currentTimeMillis() + "-" + suffix;
    }

    /**
     * A generated nonce and its assurance level.
     */
    public record Nonce(String value, NonceAssurance assurance) {}
}
