package fr.lapetina.llm.gateway.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.llm.gateway.domain.model.Capability;
import fr.lapetina.llm.gateway.domain.model.GenerationParameters;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.LogicalPrompt;
import fr.lapetina.llm.gateway.domain.model.Message;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes deterministic SHA-256 fingerprints over normalized request content.
 *
 * Content is rendered as canonical JSON (sorted keys) before hashing, so two
 * requests with equal messages, system text, generation parameters and
 * required capabilities always share a fingerprint.
 */
public final class RequestFingerprinter {

    private final ObjectMapper canonicalMapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    /**
     * Fingerprint for exact-match lookup.
     */
    public String fingerprint(InferenceRequest request) {
        Map<String, Object> content = scopeContent(request);
        List<Map<String, String>> messages = request.prompt().messages().stream()
                .map(m -> {
                    Map<String, String> rendered = new LinkedHashMap<>();
                    rendered.put("role", m.role());
                    rendered.put("content", m.content());
                    return rendered;
                })
                .toList();
        content.put("messages", messages);
        content.put("system_prompt", request.prompt().systemPrompt());
        return sha256(content);
    }

    /**
     * Fingerprint of everything but the conversation text. Requests can only
     * match by similarity within the same scope.
     */
    public String scope(InferenceRequest request) {
        return sha256(scopeContent(request));
    }

    /**
     * Text fed to the embedding provider: system text followed by "role: content" lines.
     */
    public String embeddingText(InferenceRequest request) {
        LogicalPrompt prompt = request.prompt();
        StringBuilder text = new StringBuilder();
        if (prompt.systemPrompt() != null && !prompt.systemPrompt().isEmpty()) {
            text.append(prompt.systemPrompt()).append('\n');
        }
        for (Message message : prompt.messages()) {
            text.append(message.role()).append(": ").append(message.content()).append('\n');
        }
        return text.toString().trim();
    }

    private Map<String, Object> scopeContent(InferenceRequest request) {
        GenerationParameters parameters = request.prompt().parameters();
        Map<String, Object> content = new TreeMap<>();
        content.put("temperature", parameters.temperature());
        content.put("max_tokens", parameters.maxTokens());
        content.put("top_p", parameters.topP());
        content.put("capabilities", request.requirements().capabilities().stream()
                .map(Capability::getWireName)
                .sorted()
                .toList());
        return content;
    }

    private String sha256(Object content) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsBytes(content);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Request content is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
