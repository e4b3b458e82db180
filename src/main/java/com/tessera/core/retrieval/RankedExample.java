package com.tessera.core.retrieval;

/**
 * An example with its similarity to the query text.
 *
 * @param example the catalog entry
 * @param score   similarity in (0, 1]
 */
public record RankedExample(ActivityExample example, double score) {}
