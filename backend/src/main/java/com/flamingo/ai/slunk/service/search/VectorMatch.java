package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.elasticsearch.MessageDocument;

/**
 * A nearest-neighbour hit.
 *
 * @param document the matched document
 * @param distance cosine distance in [0, 2]; 0 is identical direction
 */
public record VectorMatch(MessageDocument document, double distance) {}
