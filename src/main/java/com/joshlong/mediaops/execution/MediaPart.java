package com.joshlong.mediaops.execution;

/**
 * one artifact of a multi-part output, like a single rendered page of a document.
 */
public record MediaPart(String name, String contentType, byte[] bytes) {
}
