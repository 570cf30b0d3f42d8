package com.example.servicerota.role;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One logical role of the rota.
 * <p>
 * {@code poolKey} names the qualification table the role draws from; several roles may share a pool.
 * {@code exclusiveWith} lists roles whose same-day assignee may never fill this role.
 */
public record RoleDefinition(String name, String poolKey, Set<String> exclusiveWith) {

    public RoleDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("role name must not be blank");
        }
        if (poolKey == null || poolKey.isBlank()) {
            throw new IllegalArgumentException("pool key must not be blank for role " + name);
        }
        exclusiveWith = exclusiveWith == null
                ? Set.of()
                : java.util.Collections.unmodifiableSet(new LinkedHashSet<>(exclusiveWith));
        if (exclusiveWith.contains(name)) {
            throw new IllegalArgumentException("role " + name + " cannot exclude itself");
        }
    }

    public RoleDefinition(String name, String poolKey) {
        this(name, poolKey, Set.of());
    }

    public boolean excludes(String otherRole) {
        return exclusiveWith.contains(otherRole);
    }
}
