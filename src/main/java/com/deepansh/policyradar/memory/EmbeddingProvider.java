package com.deepansh.policyradar.memory;

import java.util.List;

/**
 * Turns texts into vectors, one per input and in input order.
 * Implementations throw on failure; retry and fallback live in {@link EmbeddingService}.
 */
public interface EmbeddingProvider {

    List<float[]> embed(List<String> texts);
}
