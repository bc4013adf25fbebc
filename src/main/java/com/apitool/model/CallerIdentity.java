package com.apitool.model;

/**
 * The user and organization on whose behalf a tool is invoked.
 */
public record CallerIdentity(String userId, String organizationId) {
}
