package com.dexarena.tournament.strategy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata for a MatchDecider implementation found on the classpath.
 *
 * @param key                   key from the DeciderDescription annotation
 * @param className             fully-qualified class name
 * @param description           human-readable description
 * @param hasZeroArgConstructor whether the class has a public zero-argument constructor
 * @param hasStatConstructor    whether the class takes a stat lookup function
 */
public record DiscoveredDecider(
        @JsonProperty("key") String key,
        @JsonProperty("className") String className,
        @JsonProperty("description") String description,
        @JsonProperty("hasZeroArgConstructor") boolean hasZeroArgConstructor,
        @JsonProperty("hasStatConstructor") boolean hasStatConstructor
) {
    @JsonIgnore
    public boolean isInstantiable() {
        return hasZeroArgConstructor || hasStatConstructor;
    }
}
