package dev.agora.result;

import org.jspecify.annotations.Nullable;

/**
 * A cross reference shown below an infobox.
 *
 * @param title link text
 * @param url link target
 * @param entity optional machine identifier of the referenced site
 */
public record InfoboxUrl(String title, String url, @Nullable String entity) {}
