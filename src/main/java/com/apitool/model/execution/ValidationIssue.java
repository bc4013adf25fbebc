package com.apitool.model.execution;

/**
 * One violated constraint.
 *
 * @param path Top-level parameter name, or a slash-separated pointer for nested values.
 */
public record ValidationIssue(String path, String message) {
}
