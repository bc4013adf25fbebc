package com.apitool.model.openapi;

/**
 * Result of following a local {@code #/components/...} reference.
 *
 * @param <T> the swagger model type being resolved
 */
public sealed interface RefResolution<T> permits RefResolution.Resolved, RefResolution.Unresolved {

    /**
     * The target object. When the input was not a reference it is returned as-is.
     */
    record Resolved<T>(T value) implements RefResolution<T> {
    }

    record Unresolved<T>(String ref, String reason) implements RefResolution<T> {

        @Override
        public String toString() {
            return ref + " (" + reason + ")";
        }
    }
}
