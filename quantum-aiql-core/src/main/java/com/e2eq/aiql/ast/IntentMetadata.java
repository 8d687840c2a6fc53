package com.e2eq.aiql.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sigil markers attached to an intent. String fields hold the marker text after its
 * sigil ({@code $id:launch} becomes {@code id:launch}) and are {@code null} when absent.
 */
public record IntentMetadata(String identifier,
                             String groupIdentifier,
                             String sequenceNumber,
                             String temperature,
                             String entropy,
                             List<String> directives,
                             Provenance provenance) {

    public static final IntentMetadata EMPTY = new IntentMetadata(null, null, null, null, null, List.of(), Provenance.EMPTY);

    public IntentMetadata {
        directives = AstChecks.listCopy(directives);
        Objects.requireNonNull(provenance, "provenance");
    }

    public boolean isEmpty() {
        return this.equals(EMPTY);
    }

    public IntentMetadata withIdentifier(String value) {
        return new IntentMetadata(value, groupIdentifier, sequenceNumber, temperature, entropy, directives, provenance);
    }

    public IntentMetadata withGroupIdentifier(String value) {
        return new IntentMetadata(identifier, value, sequenceNumber, temperature, entropy, directives, provenance);
    }

    public IntentMetadata withSequenceNumber(String value) {
        return new IntentMetadata(identifier, groupIdentifier, value, temperature, entropy, directives, provenance);
    }

    public IntentMetadata withTemperature(String value) {
        return new IntentMetadata(identifier, groupIdentifier, sequenceNumber, value, entropy, directives, provenance);
    }

    public IntentMetadata withEntropy(String value) {
        return new IntentMetadata(identifier, groupIdentifier, sequenceNumber, temperature, value, directives, provenance);
    }

    public IntentMetadata withDirective(String directive) {
        List<String> all = new ArrayList<>(directives);
        all.add(directive);
        return new IntentMetadata(identifier, groupIdentifier, sequenceNumber, temperature, entropy, all, provenance);
    }

    public IntentMetadata withProvenance(Provenance value) {
        return new IntentMetadata(identifier, groupIdentifier, sequenceNumber, temperature, entropy, directives, value);
    }
}
