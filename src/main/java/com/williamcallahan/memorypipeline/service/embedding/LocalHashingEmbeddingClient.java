package com.williamcallahan.memorypipeline.service.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic, CPU-only embedding provider so the pipeline runs without remote calls.
 *
 * <p>Each block of 32 dimensions comes from a SHA-256 digest of the text salted with the block number,
 * so wide vectors do not simply repeat the first digest. Identical texts get identical vectors; anything
 * else is effectively random. Configure a remote provider for real retrieval quality.
 */
public class LocalHashingEmbeddingClient implements EmbeddingClient {
    public static final String PROVIDER_NAME = "local-hash";

    private static final int DIGEST_BYTES = 32;

    private final int dim;

    public LocalHashingEmbeddingClient(int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dim = dim;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(hashToVector(text == null ? "" : text));
        }
        return vectors;
    }

    @Override
    public int dimensions() { return dim; }

    @Override
    public String providerName() { return PROVIDER_NAME; }

    @Override
    public String modelName() { return "sha256-" + dim; }

    private float[] hashToVector(String text) {
        byte[] content = text.getBytes(StandardCharsets.UTF_8);
        float[] vector = new float[dim];
        byte[] block = new byte[0];
        for (int position = 0; position < dim; position++) {
            int offset = position % DIGEST_BYTES;
            if (offset == 0) {
                block = digest(position / DIGEST_BYTES, content);
            }
            vector[position] = ((block[offset] & 0xFF) - 128) / 128f;
        }
        return vector;
    }

    private static byte[] digest(int blockNumber, byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update((blockNumber + ":").getBytes(StandardCharsets.UTF_8));
            return digest.digest(content);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
