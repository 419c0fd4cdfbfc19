package com.signalloop.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.signalloop.config.SignalLoopProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * OpenAI-compatible {@code /embeddings} client.
 */
@Component
@ConditionalOnProperty(prefix = "signalloop.embedding", name = "enabled", havingValue = "true")
public class HttpTopicEmbeddingClient implements TopicEmbeddingClient {

    private final RestClient embeddingRestClient;
    private final SignalLoopProperties properties;

    public HttpTopicEmbeddingClient(
            @Qualifier("embeddingRestClient") RestClient embeddingRestClient,
            SignalLoopProperties properties) {
        this.embeddingRestClient = embeddingRestClient;
        this.properties = properties;
    }

    @Override
    public List<double[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        EmbeddingResponse response = embeddingRestClient.post()
                .uri("/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new EmbeddingRequest(properties.getEmbedding().getModel(), texts))
                .retrieve()
                .body(EmbeddingResponse.class);
        if (response == null || response.data() == null || response.data().size() != texts.size()) {
            throw new IllegalStateException("Embedding response did not contain one vector per input");
        }
        List<EmbeddingData> ordered = new ArrayList<>(response.data());
        ordered.sort(Comparator.comparingInt(EmbeddingData::index));
        List<double[]> vectors = new ArrayList<>(ordered.size());
        for (EmbeddingData data : ordered) {
            if (data.embedding() == null || data.embedding().length == 0) {
                throw new IllegalStateException("Embedding response contained an empty vector");
            }
            vectors.add(data.embedding());
        }
        return vectors;
    }

    record EmbeddingRequest(String model, List<String> input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, double[] embedding) {
    }
}
