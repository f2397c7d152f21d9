package com.deepansh.policyradar.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic feature-hashing embedder. No network, no model download.
 * Word unigrams and bigrams are hashed into a signed bucket vector, then L2-normalized,
 * so texts sharing vocabulary land close together under cosine similarity.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimensions;

    public HashingEmbeddingProvider(int dimensions) {
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) out.add(embedOne(text));
        return out;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimensions];
        String[] tokens = TOKEN_SPLIT.split(text == null ? "" : text.toLowerCase(Locale.ROOT));
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty()) continue;
            add(vector, token, 1.0f);
            if (previous != null) add(vector, previous + " " + token, 0.5f);
            previous = token;
        }
        normalize(vector);
        return vector;
    }

    private void add(float[] vector, String feature, float weight) {
        int h = feature.hashCode() * 0x9E3779B1;
        int bucket = Math.floorMod(h, dimensions);
        vector[bucket] += ((h >>> 31) == 0) ? weight : -weight;
    }

    static void normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) norm += v * v;
        if (norm == 0) return;
        float inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) vector[i] *= inv;
    }
}
