package org.carball.sift.model.media;

/**
 * Raw output of a media classifier: a model label and its confidence in [0, 1].
 */
public record Classification(String label, double confidence) {}
