package com.dexarena.tournament.strategy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers a {@link MatchDecider} under a short key, used by DeciderDiscoveryService
 * when scanning the classpath.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}DeciderDescription(key = "lower-lexical", value = "Alphabetically earlier competitor wins")
 * public class LowerLexicalDecider implements MatchDecider {
 *     // ...
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface DeciderDescription {
    /**
     * Short key used on the command line and in the API.
     */
    String key();

    /**
     * A human-readable description of the decision rule.
     */
    String value();
}
