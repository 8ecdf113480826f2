package fr.lapetina.llm.gateway.infrastructure.adapter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.gateway.domain.exception.CacheException;
import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.infrastructure.cache.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Embedding provider backed by an Ollama server's embeddings endpoint.
 *
 * Calls {@code POST {baseUrl}/api/embeddings} with {@code {"model", "prompt"}}
 * and reads the {@code embedding} array of the response.
 */
public final class OllamaEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String model;
    private final Duration requestTimeout;

    public OllamaEmbeddingProvider(String baseUrl, String model, Duration connectTimeout, Duration requestTimeout) {
        String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.endpoint = URI.create(base + "api/embeddings");
        this.model = model;
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public OllamaEmbeddingProvider(String baseUrl, String model) {
        this(baseUrl, model, Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    @Override
    public float[] embed(String text) {
        try {
            String body = objectMapper.writeValueAsString(Map.of("model", model, "prompt", text));
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("Embedding request failed: endpoint={}, model={}, status={}",
                        endpoint, model, response.statusCode());
                throw new CacheException(ErrorCode.EMBEDDING_FAILED,
                        "Embedding endpoint returned HTTP " + response.statusCode(), null);
            }
            return parseEmbedding(response.body());

        } catch (IOException e) {
            throw new CacheException(ErrorCode.EMBEDDING_FAILED, "Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException(ErrorCode.EMBEDDING_FAILED, "Embedding request interrupted", e);
        }
    }

    private float[] parseEmbedding(String body) throws IOException {
        JsonNode node = objectMapper.readTree(body).path("embedding");
        if (!node.isArray() || node.isEmpty()) {
            throw new CacheException(ErrorCode.EMBEDDING_FAILED, "Response has no embedding array", null);
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) node.get(i).asDouble();
        }
        log.debug("Embedding computed: model={}, dimensions={}", model, vector.length);
        return vector;
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
