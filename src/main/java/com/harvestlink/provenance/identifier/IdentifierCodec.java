package com.harvestlink.provenance.identifier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Encodes and decodes scan identifiers.
 *
 * Canonical form: {@code <base>/{p|b}/<id>/<nonce>}.
 * Legacy form (still accepted when parsing): {@code <base>/verify/{product|batch}/<id>}.
 *
 * Decoding is purely syntactic and needs no network round trip. The host
 * is not checked and any base path in front of the identifier segments is
 * tolerated, so codes printed under an older base URL keep resolving.
 */
@Component
@Slf4j
public class IdentifierCodec {

    private static final String LEGACY_MARKER = "verify";
    private static final Pattern ID_PATTERN = Pattern.compile("\\d{1,19}");
    private static final Pattern NONCE_PATTERN = Pattern.compile("[A-Za-z0-9._~-]{1,128}");

    private final String baseUrl;
    private final NonceGenerator nonceGenerator;

    public IdentifierCodec(@Value("${provenance.identifier.base-url:https://trace.harvestlink.example}") String baseUrl,
                           NonceGenerator nonceGenerator) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.nonceGenerator = nonceGenerator;
    }

    /**
     * Mints a new public identifier.
     *
     * @throws IllegalArgumentException if kind is null or id is negative
     */
    public IssuedIdentifier mint(IdentifierKind kind, long id) {
        NonceGenerator.Nonce nonce = nonceGenerator.next();
        Identifier identifier = Identifier.of(kind, id, nonce.value());
        IssuedIdentifier issued = new IssuedIdentifier(identifier, url(identifier), nonce.assurance(), Instant.now());

        if (issued.isLowerAssurance()) {
            log.warn("Issued lower-assurance {} identifier: id={}, nonce={}", kind, id, nonce.value());
        } else {
            log.info("Issued {} identifier: id={}", kind, id);
        }
        return issued;
    }

    /**
     * Renders an identifier as the URL printed on a code. Identifiers without
     * a nonce render in the legacy form.
     */
    public String url(Identifier identifier) {
        if (identifier.getNonce() == null) {
            return baseUrl + "/" + LEGACY_MARKER + "/" + identifier.getKind().getLegacySegment()
                    + "/" + identifier.getId();
        }
        return baseUrl + "/" + identifier.getKind().getShortSegment()
                + "/" + identifier.getId() + "/" + identifier.getNonce();
    }

    /**
     * Parses scanned text. Never throws.
     */
    public ParsedIdentifier parse(String text) {
        if (text == null || text.isBlank()) {
            return ParsedIdentifier.notAnIdentifier("empty payload");
        }

        URI uri;
        try {
            uri = new URI(text.trim());
        } catch (URISyntaxException e) {
            return ParsedIdentifier.notAnIdentifier("not a URI");
        }

        String scheme = uri.getScheme();
        if (scheme != null && !"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            return ParsedIdentifier.notAnIdentifier("unsupported scheme: " + scheme);
        }
        if (uri.getPath() == null) {
            return ParsedIdentifier.notAnIdentifier("no path");
        }

        List<String> segments = Arrays.stream(uri.getPath().split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
        if (segments.size() < 3) {
            return ParsedIdentifier.notAnIdentifier("unrecognized path");
        }

        String first = segments.get(segments.size() - 3);
        String second = segments.get(segments.size() - 2);
        String last = segments.get(segments.size() - 1);

        if (LEGACY_MARKER.equals(first)) {
            Optional<IdentifierKind> kind = IdentifierKind.fromLegacySegment(second);
            if (kind.isEmpty()) {
                return ParsedIdentifier.notAnIdentifier("unknown legacy kind: " + second);
            }
            Optional<Long> id = parseId(last);
            if (id.isEmpty()) {
                return ParsedIdentifier.notAnIdentifier("invalid id: " + last);
            }
            return ParsedIdentifier.legacy(Identifier.legacy(kind.get(), id.get()));
        }

        Optional<IdentifierKind> kind = IdentifierKind.fromShortSegment(first);
        if (kind.isEmpty()) {
            return ParsedIdentifier.notAnIdentifier("unrecognized path");
        }
        Optional<Long> id = parseId(second);
        if (id.isEmpty()) {
            return ParsedIdentifier.notAnIdentifier("invalid id: " + second);
        }
        if (!NONCE_PATTERN.matcher(last).matches()) {
            return ParsedIdentifier.notAnIdentifier("invalid nonce");
        }
        return ParsedIdentifier.canonical(Identifier.of(kind.get(), id.get(), last));
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private static Optional<Long> parseId(String text) {
        if (!ID_PATTERN.matcher(text).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // 19 digits can still overflow a long
            return Optional.empty();
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
