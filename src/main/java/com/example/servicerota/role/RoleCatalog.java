package com.example.servicerota.role;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of who is qualified for which role, built once per run from one
 * qualification table per pool key.
 * <p>
 * A pool with no table (or an empty one) is a legitimate state: every role mapped to it
 * simply has nobody qualified.
 */
public final class RoleCatalog {

    private final RoleDefinitions definitions;
    private final Map<String, Set<String>> peopleByPool;

    public RoleCatalog(RoleDefinitions definitions, Map<String, ? extends Collection<String>> pools) {
        this.definitions = Objects.requireNonNull(definitions, "definitions");
        Map<String, Set<String>> copy = new HashMap<>();
        if (pools != null) {
            pools.forEach((key, people) -> {
                Set<String> members = new LinkedHashSet<>();
                if (people != null) {
                    for (String p : people) {
                        if (p != null && !p.isBlank()) members.add(p.trim());
                    }
                }
                copy.put(key, Collections.unmodifiableSet(members));
            });
        }
        this.peopleByPool = Collections.unmodifiableMap(copy);
    }

    public Set<String> qualifiedPeople(String role) {
        RoleDefinition def = definitions.find(role)
                .orElseThrow(() -> new IllegalArgumentException("unknown role: " + role));
        return peopleInPool(def.poolKey());
    }

    public Set<String> peopleInPool(String poolKey) {
        return peopleByPool.getOrDefault(poolKey, Set.of());
    }

    /**
     * Roles that can never be filled in this run because their pool is missing or empty.
     */
    public List<String> rolesWithEmptyPool() {
        return definitions.inPriorityOrder().stream()
                .filter(r -> peopleInPool(r.poolKey()).isEmpty())
                .map(RoleDefinition::name)
                .toList();
    }

    public RoleDefinitions definitions() {
        return definitions;
    }
}
