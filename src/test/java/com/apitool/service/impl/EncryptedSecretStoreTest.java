package com.apitool.service.impl;

import com.apitool.config.ToolEngineProperties;
import com.apitool.model.CallerIdentity;
import com.apitool.model.security.SecretKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jasypt.encryption.StringEncryptor;
import org.jasypt.exceptions.EncryptionOperationNotPossibleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class EncryptedSecretStoreTest {

    private static final CallerIdentity CALLER = new CallerIdentity("user-1", "org-1");
    private static final SecretKey API_KEY = SecretKey.forClient(CALLER, "acme", "api key");

    @TempDir
    Path stateDir;

    @Mock
    private StringEncryptor encryptor;

    private ToolEngineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ToolEngineProperties();
        properties.getState().setDirectory(stateDir.toString());
        lenient().when(encryptor.encrypt(anyString())).thenAnswer(invocation -> "enc(" + invocation.getArgument(0) + ")");
        lenient().when(encryptor.decrypt(anyString())).thenAnswer(invocation -> {
            String value = invocation.getArgument(0);
            return value.substring("enc(".length(), value.length() - 1);
        });
    }

    @Test
    void setSecret_shouldWriteOnlyTheEncryptedValue() throws IOException {
        newStore().setSecret(API_KEY, "s3cret");

        String written = Files.readString(stateDir.resolve(EncryptedSecretStore.SECRETS_FILE_NAME));
        assertThat(written).contains("\"client:org-1:user-1:acme:api_key\"").contains("enc(s3cret)");
        assertThat(written).doesNotContain("\"s3cret\"");
    }

    @Test
    void getSecret_shouldDecryptValuesStoredBeforeARestart() {
        newStore().setSecret(API_KEY, "s3cret");

        assertThat(newStore().getSecret(API_KEY)).isEqualTo("s3cret");
    }

    @Test
    void getSecret_shouldBeScopedToTheCaller() {
        EncryptedSecretStore store = newStore();
        store.setSecret(API_KEY, "s3cret");

        assertThat(store.getSecret(SecretKey.forClient(new CallerIdentity("user-2", "org-1"), "acme", "api key"))).isNull();
        assertThat(store.getSecret(SecretKey.forClient(CALLER, "other", "api key"))).isNull();
    }

    @Test
    void getSecret_whenDecryptionFails_shouldReturnNull() {
        EncryptedSecretStore store = newStore();
        store.setSecret(API_KEY, "s3cret");
        doThrow(new EncryptionOperationNotPossibleException()).when(encryptor).decrypt(anyString());

        assertThat(store.getSecret(API_KEY)).isNull();
    }

    @Test
    void setSecret_withEmptyValue_shouldBeRejected() {
        EncryptedSecretStore store = newStore();

        assertThatThrownBy(() -> store.setSecret(API_KEY, ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Secret value must not be empty.");
    }

    private EncryptedSecretStore newStore() {
        EncryptedSecretStore store = new EncryptedSecretStore(encryptor, properties);
        store.init();
        return store;
    }
}
