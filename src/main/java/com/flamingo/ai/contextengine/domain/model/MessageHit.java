package com.flamingo.ai.contextengine.domain.model;

/**
 * A message returned by a store query together with the store's score.
 *
 * @param message the message
 * @param score cosine similarity for vector queries, raw text relevance for keyword queries
 */
public record MessageHit(Message message, double score) {}
