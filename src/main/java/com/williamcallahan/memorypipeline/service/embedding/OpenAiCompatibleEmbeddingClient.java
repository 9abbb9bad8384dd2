package com.williamcallahan.memorypipeline.service.embedding;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIRetryableException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.williamcallahan.memorypipeline.support.RetrySupport;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding provider speaking the OpenAI {@code /v1/embeddings} protocol.
 *
 * <p>Failures are translated for the pipeline: anything the provider may accept later (throttling, timeouts,
 * 5xx, broken connections, incomplete responses) becomes {@link EmbeddingServiceUnavailableException}; every
 * other HTTP error and a vector of the wrong size become {@link EmbeddingProviderRejectedException}.
 */
public class OpenAiCompatibleEmbeddingClient implements EmbeddingClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingClient.class);

    public static final String PROVIDER_NAME = "openai";

    private static final Set<Integer> RETRYABLE_CLIENT_ERRORS = Set.of(408, 409, 425, 429);
    private static final int FIRST_SERVER_ERROR = 500;

    private static final int IN_PROCESS_ATTEMPTS = 2;
    private static final Duration IN_PROCESS_BACKOFF = Duration.ofMillis(250);
    private static final RequestOptions REQUEST_OPTIONS = RequestOptions.builder()
            .timeout(Timeout.builder()
                    .connect(Duration.ofSeconds(10))
                    .read(Duration.ofSeconds(60))
                    .request(Duration.ofSeconds(60))
                    .build())
            .build();
    private static final int ERROR_DETAIL_LIMIT = 512;

    private final OpenAIClient client;
    private final String model;
    private final int dimensions;

    /**
     * Builds a client for a remote endpoint.
     *
     * @param baseUrl endpoint root; a trailing {@code /embeddings} or missing {@code /v1} is tolerated
     * @param dimensions vector size every response must have
     */
    public static OpenAiCompatibleEmbeddingClient create(String baseUrl, String apiKey, String model, int dimensions) {
        String key = requireText(apiKey, "Remote embedding API key is not configured");
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(key)
                .baseUrl(normalizeSdkBaseUrl(baseUrl))
                .build();
        return create(client, model, dimensions);
    }

    static OpenAiCompatibleEmbeddingClient create(OpenAIClient client, String model, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        return new OpenAiCompatibleEmbeddingClient(Objects.requireNonNull(client, "client"),
                requireText(model, "Remote embedding model is not configured"), dimensions);
    }

    private OpenAiCompatibleEmbeddingClient(OpenAIClient client, String model, int dimensions) {
        this.client = client;
        this.model = model;
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        EmbeddingCreateParams params = EmbeddingCreateParams.builder()
                .model(model)
                .inputOfArrayOfStrings(List.copyOf(texts))
                .build();
        return RetrySupport.executeWithRetry(() -> request(params, texts.size()),
                "[EMBEDDING] " + model + " batch of " + texts.size(), IN_PROCESS_ATTEMPTS, IN_PROCESS_BACKOFF);
    }

    private List<float[]> request(EmbeddingCreateParams params, int inputCount) {
        try {
            return toVectors(client.embeddings().create(params, REQUEST_OPTIONS), inputCount);
        } catch (OpenAIServiceException e) {
            String message = "Embedding provider answered HTTP " + e.statusCode() + ": " + detail(e);
            if (isRetryableStatus(e.statusCode())) {
                throw new EmbeddingServiceUnavailableException(message, e);
            }
            throw new EmbeddingProviderRejectedException(message, e);
        } catch (OpenAIRetryableException e) {
            throw new EmbeddingServiceUnavailableException("Embedding provider unreachable: " + detail(e), e);
        }
    }

    static boolean isRetryableStatus(int statusCode) {
        return statusCode >= FIRST_SERVER_ERROR || RETRYABLE_CLIENT_ERRORS.contains(statusCode);
    }

    /** Orders vectors by the response's {@code index} field, since providers may answer out of order. */
    private List<float[]> toVectors(CreateEmbeddingResponse response, int inputCount) {
        if (response == null || response.data().isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Embedding response carried no vectors");
        }
        float[][] ordered = new float[inputCount][];
        for (Embedding entry : response.data()) {
            long index = entry.index();
            if (index < 0 || index >= inputCount) {
                log.debug("[EMBEDDING] Dropping vector with out-of-range index {} ({} inputs)", index, inputCount);
                continue;
            }
            ordered[(int) index] = toArray(entry.embedding(), index);
        }
        for (int i = 0; i < inputCount; i++) {
            if (ordered[i] == null) {
                throw new EmbeddingServiceUnavailableException("Embedding response has no vector for input " + i);
            }
        }
        return Arrays.asList(ordered);
    }

    private float[] toArray(List<Float> values, long index) {
        if (values == null || values.isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Embedding response has an empty vector for input " + index);
        }
        if (values.size() != dimensions) {
            throw new EmbeddingProviderRejectedException("Embedding dimension mismatch: configured "
                    + dimensions + ", provider returned " + values.size());
        }
        float[] vector = new float[dimensions];
        int position = 0;
        for (Float value : values) {
            if (value == null) {
                throw new EmbeddingServiceUnavailableException("Embedding response has a null component for input " + index);
            }
            vector[position++] = value;
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String providerName() {
        return PROVIDER_NAME;
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public void close() {
        client.close();
    }

    static String normalizeSdkBaseUrl(String baseUrl) {
        String url = requireText(baseUrl, "Remote embedding base URL is not configured").trim();
        url = stripSuffix(stripSuffix(url, "/"), "/embeddings");
        return url.endsWith("/v1") ? url : url + "/v1";
    }

    private static String stripSuffix(String value, String suffix) {
        return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
    }

    private static String detail(RuntimeException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return "no details";
        }
        String singleLine = message.replaceAll("[\\r\\n]+", " ").trim();
        return singleLine.length() <= ERROR_DETAIL_LIMIT ? singleLine : singleLine.substring(0, ERROR_DETAIL_LIMIT) + "...";
    }

    private static String requireText(String value, String failureMessage) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(failureMessage);
        }
        return value;
    }
}
