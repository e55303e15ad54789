package com.swarmnet.config;

import com.swarmnet.core.agent.Role;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * SwarmSettings - resolves swarmnet.* properties into one RoleSettings per Role.
 *
 * Timeouts are role specific: shorter for SEARCH and ANALYSIS, longer for
 * MASTER, which may have to read every peer result before answering.
 */
@Component
public class SwarmSettings {

    private final Map<Role, RoleSettings> roles;

    @Autowired
    public SwarmSettings(
            @Value("${swarmnet.timeout.master:180}")       long   masterTimeoutSeconds,
            @Value("${swarmnet.timeout.search:120}")       long   searchTimeoutSeconds,
            @Value("${swarmnet.timeout.innovation:120}")   long   innovationTimeoutSeconds,
            @Value("${swarmnet.timeout.analysis:90}")      long   analysisTimeoutSeconds,
            @Value("${swarmnet.role.master.temperature:0.5}")     double masterTemperature,
            @Value("${swarmnet.role.search.temperature:0.3}")     double searchTemperature,
            @Value("${swarmnet.role.innovation.temperature:0.8}") double innovationTemperature,
            @Value("${swarmnet.role.analysis.temperature:0.7}")   double analysisTemperature,
            @Value("${swarmnet.role.master.max-tokens:3000}")     int    masterMaxTokens,
            @Value("${swarmnet.role.search.max-tokens:2000}")     int    searchMaxTokens,
            @Value("${swarmnet.role.innovation.max-tokens:2500}") int    innovationMaxTokens,
            @Value("${swarmnet.role.analysis.max-tokens:2000}")   int    analysisMaxTokens,
            @Value("${swarmnet.role.retry-attempts:2}")           int    retryAttempts
    ) {
        Map<Role, RoleSettings> resolved = new EnumMap<>(Role.class);
        resolved.put(Role.MASTER, new RoleSettings(Role.MASTER,
                Duration.ofSeconds(masterTimeoutSeconds), masterTemperature, masterMaxTokens, retryAttempts));
        resolved.put(Role.SEARCH, new RoleSettings(Role.SEARCH,
                Duration.ofSeconds(searchTimeoutSeconds), searchTemperature, searchMaxTokens, retryAttempts));
        resolved.put(Role.INNOVATION, new RoleSettings(Role.INNOVATION,
                Duration.ofSeconds(innovationTimeoutSeconds), innovationTemperature, innovationMaxTokens, retryAttempts));
        resolved.put(Role.ANALYSIS, new RoleSettings(Role.ANALYSIS,
                Duration.ofSeconds(analysisTimeoutSeconds), analysisTemperature, analysisMaxTokens, retryAttempts));
        this.roles = Collections.unmodifiableMap(resolved);
    }

    /** Direct construction, used where no Spring environment exists. Every Role must be present. */
    public SwarmSettings(Map<Role, RoleSettings> roles) {
        for (Role role : Role.values()) {
            if (!roles.containsKey(role)) {
                throw new IllegalArgumentException("Missing settings for role " + role);
            }
        }
        this.roles = Collections.unmodifiableMap(new EnumMap<>(roles));
    }

    /** Same timeout for every role; other values use the defaults above. */
    public static SwarmSettings withUniformTimeout(Duration timeout) {
        Map<Role, RoleSettings> roles = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            roles.put(role, new RoleSettings(role, timeout, 0.5, 2000, 1));
        }
        return new SwarmSettings(roles);
    }

    public RoleSettings forRole(Role role) {
        return roles.get(role);
    }

    public Map<Role, RoleSettings> all() {
        return roles;
    }
}
