package dev.aparikh.semanticmail.embedding;

import java.util.List;

/**
 * Small vector helpers shared by the indexing and search paths.
 */
public final class Vectors {

    private Vectors() {
    }

    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Element-wise mean of the vectors, scaled to unit length. One email with several chunks
     * is represented by this single vector.
     */
    public static float[] meanNormalized(List<float[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("At least one vector is required");
        }
        int dim = vectors.get(0).length;
        double[] sum = new double[dim];
        for (float[] v : vectors) {
            if (v.length != dim) {
                throw new IllegalArgumentException("Dimension mismatch: " + dim + " vs " + v.length);
            }
            for (int i = 0; i < dim; i++) sum[i] += v[i];
        }
        double norm = 0;
        for (double s : sum) norm += s * s;
        norm = Math.sqrt(norm);
        float[] out = new float[dim];
        for (int i = 0; i < dim; i++) {
            out[i] = norm == 0 ? 0f : (float) (sum[i] / norm);
        }
        return out;
    }
}
