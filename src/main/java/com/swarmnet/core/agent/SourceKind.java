package com.swarmnet.core.agent;

public enum SourceKind {
    PEER_REVIEWED,
    PREPRINT,
    EXPERIMENTAL,
    THEORETICAL,
    GOVERNMENT,
    EDUCATIONAL,
    NEWS,
    BOOK,
    CONFERENCE,
    OTHER;

    /** Lenient lookup for model output; unknown or blank values map to OTHER. */
    public static SourceKind fromText(String text) {
        if (text == null || text.isBlank()) return OTHER;
        String normalized = text.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (SourceKind kind : values()) {
            if (kind.name().equals(normalized)) return kind;
        }
        return OTHER;
    }
}
