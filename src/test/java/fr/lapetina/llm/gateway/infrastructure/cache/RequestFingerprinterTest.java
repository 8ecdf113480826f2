package fr.lapetina.llm.gateway.infrastructure.cache;

import fr.lapetina.llm.gateway.domain.model.Capability;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.Message;
import fr.lapetina.llm.gateway.domain.model.Requirements;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RequestFingerprinterTest {

    private final RequestFingerprinter fingerprinter = new RequestFingerprinter();

    @Test
    @DisplayName("should ignore request id, caller and timestamps")
    void shouldIgnoreIdentity() {
        InferenceRequest a = InferenceRequest.ofPrompt("team-a", "Hello");
        InferenceRequest b = InferenceRequest.ofPrompt("team-b", "Hello");

        assertThat(fingerprinter.fingerprint(a)).isEqualTo(fingerprinter.fingerprint(b)).hasSize(64);
    }

    @Test
    @DisplayName("should depend on message order and roles")
    void shouldDependOnMessages() {
        InferenceRequest ordered = InferenceRequest.ofChat("team-a",
                List.of(Message.user("Hi"), Message.assistant("Hello")));
        InferenceRequest swapped = InferenceRequest.ofChat("team-a",
                List.of(Message.assistant("Hello"), Message.user("Hi")));

        assertThat(fingerprinter.fingerprint(ordered)).isNotEqualTo(fingerprinter.fingerprint(swapped));
        assertThat(fingerprinter.scope(ordered)).isEqualTo(fingerprinter.scope(swapped));
    }

    @Test
    @DisplayName("should not depend on capability declaration order")
    void shouldNormalizeCapabilities() {
        InferenceRequest a = InferenceRequest.builder()
                .callerId("team-a")
                .messages(List.of(Message.user("Describe")))
                .requirements(Requirements.of(Capability.VISION, Capability.TOOL_USE))
                .build();
        InferenceRequest b = InferenceRequest.builder()
                .callerId("team-a")
                .messages(List.of(Message.user("Describe")))
                .requirements(Requirements.of(Capability.TOOL_USE, Capability.VISION))
                .build();

        assertThat(fingerprinter.fingerprint(a)).isEqualTo(fingerprinter.fingerprint(b));
        assertThat(fingerprinter.fingerprint(a))
                .isNotEqualTo(fingerprinter.fingerprint(InferenceRequest.ofPrompt("team-a", "Describe")));
    }

    @Test
    @DisplayName("should render system text and role-prefixed lines for embeddings")
    void shouldRenderEmbeddingText() {
        InferenceRequest request = InferenceRequest.builder()
                .callerId("team-a")
                .systemPrompt("You are terse.")
                .messages(List.of(Message.user("Capital of France?")))
                .build();

        assertThat(fingerprinter.embeddingText(request)).isEqualTo("You are terse.\nuser: Capital of France?");
    }
}
