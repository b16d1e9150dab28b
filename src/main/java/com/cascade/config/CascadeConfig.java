package com.cascade.config;

import com.cascade.dsl.ParserMode;
import com.cascade.model.Rule;

import java.util.List;
import java.util.Set;

/**
 * Root configuration for Cascade.
 *
 * @param name        Configuration name
 * @param version     Configuration version
 * @param parserMode  How malformed condition/action chunks are treated
 * @param parentTypes Parent work item types to act on; empty means any
 * @param rules       Parsed rule book, in declaration order
 */
public record CascadeConfig(
        String name,
        String version,
        ParserMode parserMode,
        Set<String> parentTypes,
        List<Rule> rules
) {
    public CascadeConfig {
        parentTypes = parentTypes == null ? Set.of() : Set.copyOf(parentTypes);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Create a configuration for the given rules, acting on any parent type.
     */
    public static CascadeConfig of(List<Rule> rules) {
        return new CascadeConfig("default", "1.0", ParserMode.STRICT, Set.of(), rules);
    }
}
