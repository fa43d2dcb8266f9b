package dev.agora.result;

import org.jspecify.annotations.Nullable;

/**
 * One fact of an infobox.
 *
 * @param label human readable label ("Born", "Population")
 * @param entity optional machine identifier of the fact (e.g. a Wikidata property)
 * @param value the fact's value
 */
public record InfoboxAttribute(@Nullable String label, @Nullable String entity, String value) {}
