package com.swarmnet.core.agent;

import java.util.Objects;

/**
 * A single source cited by a role. The url is the identity key when sources
 * from several roles are unified.
 *
 * Credibility and relevance are clamped into [0, 1] on construction, so a
 * misbehaving collaborator can never push a score out of range.
 */
public final class SourceRecord {

    private final String     url;
    private final String     title;
    private final SourceKind kind;
    private final double     credibility;
    private final double     relevance;

    public SourceRecord(String url, String title, SourceKind kind, double credibility, double relevance) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Source url cannot be empty");
        }
        this.url         = url.trim();
        this.title       = title != null ? title : "";
        this.kind        = kind != null ? kind : SourceKind.OTHER;
        this.credibility = clamp(credibility);
        this.relevance   = clamp(relevance);
    }

    public static SourceRecord of(String url, double credibility) {
        return new SourceRecord(url, url, SourceKind.OTHER, credibility, 0.5);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    public String     getUrl()         { return url; }
    public String     getTitle()       { return title; }
    public SourceKind getKind()        { return kind; }
    public double     getCredibility() { return credibility; }
    public double     getRelevance()   { return relevance; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRecord)) return false;
        SourceRecord that = (SourceRecord) o;
        return Double.compare(credibility, that.credibility) == 0
                && Double.compare(relevance, that.relevance) == 0
                && url.equals(that.url)
                && title.equals(that.title)
                && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title, kind, credibility, relevance);
    }

    @Override
    public String toString() {
        return String.format("SourceRecord{url=%s, kind=%s, credibility=%.2f}", url, kind, credibility);
    }
}
