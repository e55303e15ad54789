package com.swarmnet.core.synthesis;

import com.swarmnet.core.agent.Role;
import com.swarmnet.core.agent.SourceRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Synthesis - merged view over every role's result for one query.
 *
 * Value object: two syntheses built from equal inputs are equal, which is what
 * makes ResultSynthesizer checkably pure.
 */
public final class Synthesis {

    private final List<SourceRecord>        unifiedSources;
    private final Map<Role, List<String>>   keyInsights;
    private final List<String>              contradictions;
    private final List<String>              gaps;
    private final Map<Role, RoleSummary>    roleSummaries;
    private final List<String>              unifiedQuestions;

    public Synthesis(
            List<SourceRecord>      unifiedSources,
            Map<Role, List<String>> keyInsights,
            List<String>            contradictions,
            List<String>            gaps,
            Map<Role, RoleSummary>  roleSummaries,
            List<String>            unifiedQuestions
    ) {
        this.unifiedSources   = List.copyOf(unifiedSources);
        this.keyInsights      = immutableByRole(keyInsights);
        this.contradictions   = List.copyOf(contradictions);
        this.gaps             = List.copyOf(gaps);
        this.roleSummaries    = immutableByRole(roleSummaries);
        this.unifiedQuestions = List.copyOf(unifiedQuestions);
    }

    /** Placeholder carried by FAILED and CANCELLED results. */
    public static Synthesis empty() {
        return new Synthesis(List.of(), Map.of(), List.of(), List.of(), Map.of(), List.of());
    }

    private static <V> Map<Role, V> immutableByRole(Map<Role, V> source) {
        if (source.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }

    public List<SourceRecord>      getUnifiedSources()   { return unifiedSources; }
    public Map<Role, List<String>> getKeyInsights()      { return keyInsights; }
    public List<String>            getContradictions()   { return contradictions; }
    public List<String>            getGaps()             { return gaps; }
    public Map<Role, RoleSummary>  getRoleSummaries()    { return roleSummaries; }
    public List<String>            getUnifiedQuestions() { return unifiedQuestions; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Synthesis)) return false;
        Synthesis that = (Synthesis) o;
        return unifiedSources.equals(that.unifiedSources)
                && keyInsights.equals(that.keyInsights)
                && contradictions.equals(that.contradictions)
                && gaps.equals(that.gaps)
                && roleSummaries.equals(that.roleSummaries)
                && unifiedQuestions.equals(that.unifiedQuestions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unifiedSources, keyInsights, contradictions, gaps, roleSummaries, unifiedQuestions);
    }

    @Override
    public String toString() {
        return "Synthesis{sources=" + unifiedSources.size() + ", contradictions=" + contradictions
                + ", gaps=" + gaps + ", questions=" + unifiedQuestions.size() + "}";
    }
}
