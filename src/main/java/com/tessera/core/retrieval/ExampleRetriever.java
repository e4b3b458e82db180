package com.tessera.core.retrieval;

import java.util.List;

/**
 * Finds earlier activities similar to an intent. Results only enrich prompt text.
 */
public interface ExampleRetriever {

    /**
     * @param text the query, usually the activity intent
     * @param k    maximum number of results
     * @return best matches first; empty when nothing is similar
     */
    List<RankedExample> findSimilar(String text, int k);
}
