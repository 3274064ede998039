package com.harvestlink.provenance.identifier;

import java.util.Optional;

/**
 * Outcome of parsing scanned text.
 *
 * Parsing never throws: text that is not an identifier produces a
 * {@link #notAnIdentifier(String)} result carrying the reason.
 */
public final class ParsedIdentifier {

    public enum Form {
        CANONICAL,
        LEGACY
    }

    private final Identifier identifier;
    private final Form form;
    private final String reason;

    private ParsedIdentifier(Identifier identifier, Form form, String reason) {
        this.identifier = identifier;
        this.form = form;
        this.reason = reason;
    }

    public static ParsedIdentifier canonical(Identifier identifier) {
        return new ParsedIdentifier(identifier, Form.CANONICAL, null);
    }

    public static ParsedIdentifier legacy(Identifier identifier) {
        return new ParsedIdentifier(identifier, Form.LEGACY, null);
    }

    public static ParsedIdentifier notAnIdentifier(String reason) {
        return new ParsedIdentifier(null, null, reason);
    }

    public boolean isIdentifier() {
        return identifier != null;
    }

    public Optional<Identifier> getIdentifier() {
        return Optional.ofNullable(identifier);
    }

    public Optional<Form> getForm() {
        return Optional.ofNullable(form);
    }

    /**
     * Why the text was rejected; null for successful parses.
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isIdentifier()
                ? "ParsedIdentifier(" + identifier + ", form=" + form + ")"
                : "NotAnIdentifier(" + reason + ")";
    }
}
