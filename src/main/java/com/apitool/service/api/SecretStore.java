package com.apitool.service.api;

import com.apitool.model.security.SecretKey;

/**
 * Stores caller secrets under a composite key.
 */
public interface SecretStore {

    /**
     * @param key The composite key.
     * @return The secret value, or {@code null} when nothing is stored under the key.
     */
    String getSecret(SecretKey key);

    void setSecret(SecretKey key, String value);
}
