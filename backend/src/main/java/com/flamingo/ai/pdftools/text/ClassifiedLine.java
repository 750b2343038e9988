package com.flamingo.ai.pdftools.text;

/**
 * A line together with the role the {@link LineClassifier} assigned to it.
 *
 * @param text raw line text, untrimmed
 * @param role classification result
 */
public record ClassifiedLine(String text, LineRole role) {}
