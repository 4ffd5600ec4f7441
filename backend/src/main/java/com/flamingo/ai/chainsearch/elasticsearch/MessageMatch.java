package com.flamingo.ai.chainsearch.elasticsearch;

/** A similarity hit: the message holding a matching chain embedding and its cosine similarity. */
public record MessageMatch(Long messageId, double similarity) {}
