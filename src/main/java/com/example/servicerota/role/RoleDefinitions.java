package com.example.servicerota.role;

import com.example.servicerota.exception.BusinessException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable table of role definitions. List order is the priority order in which
 * the engine visits roles on each date.
 */
public final class RoleDefinitions {

    public static final String VOCAL_MAIN = "vocal_main";
    public static final String VOCAL_SUB1 = "vocal_sub1";
    public static final String VOCAL_SUB2 = "vocal_sub2";
    public static final String PIANO = "piano";
    public static final String DRUM = "drum";
    public static final String BASS = "bass";
    public static final String PA = "pa";
    public static final String PPT = "ppt";

    public static final String POOL_VOCAL_SUB = "vocal_sub";

    private final List<RoleDefinition> roles;
    private final Map<String, RoleDefinition> byName;

    public RoleDefinitions(List<RoleDefinition> roles) {
        if (roles == null || roles.isEmpty()) {
            throw new IllegalArgumentException("at least one role definition is required");
        }
        Map<String, RoleDefinition> index = new LinkedHashMap<>();
        for (RoleDefinition role : roles) {
            if (index.putIfAbsent(role.name(), role) != null) {
                throw new IllegalArgumentException("duplicate role definition: " + role.name());
            }
        }
        for (RoleDefinition role : roles) {
            for (String other : role.exclusiveWith()) {
                if (!index.containsKey(other)) {
                    throw new IllegalArgumentException("role " + role.name() + " excludes unknown role " + other);
                }
            }
        }
        this.roles = List.copyOf(roles);
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * The eight worship-team roles: lead vocal first, then the two backup vocal slots sharing
     * one pool, then instruments and support.
     */
    public static RoleDefinitions standard() {
        List<RoleDefinition> roles = new ArrayList<>();
        roles.add(new RoleDefinition(VOCAL_MAIN, VOCAL_MAIN));
        roles.add(new RoleDefinition(VOCAL_SUB1, POOL_VOCAL_SUB, Set.of(VOCAL_SUB2)));
        roles.add(new RoleDefinition(VOCAL_SUB2, POOL_VOCAL_SUB, Set.of(VOCAL_SUB1)));
        roles.add(new RoleDefinition(PIANO, PIANO));
        roles.add(new RoleDefinition(DRUM, DRUM));
        roles.add(new RoleDefinition(BASS, BASS));
        roles.add(new RoleDefinition(PA, PA));
        roles.add(new RoleDefinition(PPT, PPT));
        return new RoleDefinitions(roles);
    }

    public List<RoleDefinition> inPriorityOrder() {
        return roles;
    }

    public List<String> roleNames() {
        return roles.stream().map(RoleDefinition::name).toList();
    }

    public Set<String> poolKeys() {
        Set<String> keys = new LinkedHashSet<>();
        roles.forEach(r -> keys.add(r.poolKey()));
        return Collections.unmodifiableSet(keys);
    }

    public Optional<RoleDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public RoleDefinition require(String name) {
        return find(name).orElseThrow(() ->
                new BusinessException("UNKNOWN_ROLE", "未定義の役割です: " + name, name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public int size() {
        return roles.size();
    }
}
