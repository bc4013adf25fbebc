package com.apitool.service.impl;

import com.apitool.config.ToolEngineProperties;
import com.apitool.model.security.SecretKey;
import com.apitool.service.api.SecretStore;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;

/**
 * A file-based {@link SecretStore} that keeps every value encrypted with Jasypt.
 * <p>
 * Secrets are keyed by {@link SecretKey#toSecretId()} and written to {@code secrets.json} next to
 * the tool state. They are encrypted before they reach memory or disk and decrypted on read.
 */
@Service
@Slf4j
public class EncryptedSecretStore implements SecretStore {

    static final String SECRETS_FILE_NAME = "secrets.json";

    private final StringEncryptor encryptor;
    private final JsonStateFile secretsFile;
    private final Map<String, String> secrets = new ConcurrentHashMap<>();

    /**
     * Constructs the store with the {@link StringEncryptor} configured by the Jasypt Spring Boot starter.
     *
     * @param encryptor  The encryptor used for every secret value.
     * @param properties Supplies the state directory.
     */
    public EncryptedSecretStore(StringEncryptor encryptor, ToolEngineProperties properties) {
        this.encryptor = encryptor;
        this.secretsFile = new JsonStateFile(new File(properties.getState().getDirectory(), SECRETS_FILE_NAME));
    }

    @PostConstruct
    public void init() {
        secretsFile.read(new TypeReference<Map<String, String>>() {}).ifPresent(secrets::putAll);
    }

    /**
     * {@inheritDoc}
     * <p>
     * If decryption fails, which happens when the encryption password changed, an error is
     * logged and {@code null} is returned so the caller is asked for the secret again.
     */
    @Override
    public String getSecret(SecretKey key) {
        String secretId = key.toSecretId();
        String encrypted = secrets.get(secretId);
        if (encrypted == null) {
            return null;
        }
        try {
            return encryptor.decrypt(encrypted);
        } catch (RuntimeException e) {
            log.error("Could not decrypt secret '{}'. The encryption password may have changed.", secretId);
            return null;
        }
    }

    @Override
    public void setSecret(SecretKey key, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Secret value must not be empty.");
        }
        String secretId = key.toSecretId();
        log.info("Encrypting and saving secret '{}'", secretId);
        secrets.put(secretId, encryptor.encrypt(value));
        secretsFile.write(Map.copyOf(secrets));
    }
}
