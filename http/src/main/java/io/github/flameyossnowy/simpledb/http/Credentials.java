package io.github.flameyossnowy.simpledb.http;

import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

/**
 * Access key pair used to sign every request.
 */
public record Credentials(@NotNull String accessKeyId, @NotNull String secretKey) {

    public Credentials {
        if (accessKeyId == null || accessKeyId.isBlank()) {
            throw new ValidationException("Access key id cannot be blank");
        }
        if (secretKey == null || secretKey.isEmpty()) {
            throw new ValidationException("Secret key cannot be empty");
        }
    }

    @Override
    public String toString() {
        return "Credentials[accessKeyId=" + accessKeyId + ", secretKey=****]";
    }
}
