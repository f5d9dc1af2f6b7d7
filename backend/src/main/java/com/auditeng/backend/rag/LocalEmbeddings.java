package com.auditeng.backend.rag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic hashed bag-of-words embedding used when the embedding API is unavailable.
 * Each token is spread over five dimensions, weighted by its position, and the vector is unit-normalized.
 */
public final class LocalEmbeddings {

    public static final String MODEL = "local-hash";

    private static final int SPREAD = 5;

    private LocalEmbeddings() {
    }

    public static List<Double> embed(String text, int dimensions) {
        double[] vector = new double[dimensions];
        String[] tokens = text.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", " ").split("\\s+");
        int position = 0;
        for (String token : tokens) {
            if (token.length() <= 2) {
                continue;
            }
            int hash = hash(token);
            double weight = 1.0 / Math.sqrt(position + 1);
            for (int j = 0; j < SPREAD; j++) {
                int index = (int) Math.floorMod((long) hash + (long) j * 127, (long) dimensions);
                vector[index] += weight;
            }
            position++;
        }

        double norm = Math.sqrt(Arrays.stream(vector).map(v -> v * v).sum());
        List<Double> embedding = new ArrayList<>(dimensions);
        for (double v : vector) {
            embedding.add(norm > 0 ? v / norm : 0.0);
        }
        return embedding;
    }

    private static int hash(String token) {
        int hash = 0;
        for (int i = 0; i < token.length(); i++) {
            hash = 31 * hash + token.charAt(i);
        }
        return Math.abs(hash == Integer.MIN_VALUE ? 0 : hash);
    }
}
