package com.signalloop.service;

import java.util.List;

/**
 * Text embedding boundary used for topic fit. Implementations carry their own
 * timeout and throw on failure; callers fall back to a neutral score.
 */
public interface TopicEmbeddingClient {

    /**
     * @param texts Inputs to embed, in order
     * @return One vector per input, in input order
     */
    List<double[]> embed(List<String> texts);
}
