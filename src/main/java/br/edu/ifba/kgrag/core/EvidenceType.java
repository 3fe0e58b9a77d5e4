package br.edu.ifba.kgrag.core;

import java.util.Locale;

/**
 * Origin of an evidence item. HYBRID marks items merged from both channels.
 */
public enum EvidenceType {
    VECTOR,
    GRAPH,
    HYBRID;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
