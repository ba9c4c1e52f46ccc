package com.olympicsdata.domain.reconcile;

import com.olympicsdata.domain.service.NormalizationUtils;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups of country display names that denote the same NOC, e.g.
 * "United Kingdom" and "Great Britain". Lookups use normalized names.
 */
public class CountryAliasTable {

    private final Map<String, Set<String>> groupsByName = new HashMap<>();

    public CountryAliasTable(Collection<? extends Collection<String>> groups) {
        for (Collection<String> group : groups) {
            Set<String> normalized = new LinkedHashSet<>();
            group.stream()
                .map(NormalizationUtils::normalizeText)
                .filter(name -> !name.isEmpty())
                .forEach(normalized::add);
            for (String name : normalized) {
                groupsByName.computeIfAbsent(name, k -> new LinkedHashSet<>()).addAll(normalized);
            }
        }
    }

    public static CountryAliasTable empty() {
        return new CountryAliasTable(List.of());
    }

    /**
     * Other normalized names in the same group(s) as the given normalized name.
     */
    public Set<String> aliasesOf(String normalizedName) {
        Set<String> group = groupsByName.get(normalizedName);
        if (group == null) {
            return Set.of();
        }
        Set<String> aliases = new LinkedHashSet<>(group);
        aliases.remove(normalizedName);
        return aliases;
    }
}
