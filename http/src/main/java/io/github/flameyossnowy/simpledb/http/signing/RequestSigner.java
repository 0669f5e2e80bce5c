package io.github.flameyossnowy.simpledb.http.signing;

import io.github.flameyossnowy.simpledb.api.exceptions.SimpleDBException;
import io.github.flameyossnowy.simpledb.http.Credentials;
import io.github.flameyossnowy.simpledb.http.ServiceRequest;
import org.jetbrains.annotations.NotNull;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Signs requests with signature version 2.
 *
 * <p>The signature is an HMAC over
 * {@code METHOD \n host \n path \n sorted-parameters}, keyed with the secret
 * key and Base64 encoded. The result depends only on the request, the
 * credentials and the injected clock.</p>
 */
public final class RequestSigner {
    public static final String SIGNATURE_VERSION = "2";
    public static final String SIGNATURE = "Signature";

    static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final Credentials credentials;
    private final SignatureMethod method;
    private final Clock clock;

    public RequestSigner(@NotNull Credentials credentials, @NotNull SignatureMethod method, @NotNull Clock clock) {
        this.credentials = Objects.requireNonNull(credentials, "Credentials cannot be null");
        this.method = Objects.requireNonNull(method, "Signature method cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public SignatureMethod method() {
        return method;
    }

    /**
     * A copy of {@code request} carrying the authentication parameters and
     * its {@code Signature}.
     */
    public ServiceRequest sign(@NotNull ServiceRequest request) {
        Map<String, String> auth = new LinkedHashMap<>(4);
        auth.put("AWSAccessKeyId", credentials.accessKeyId());
        auth.put("SignatureVersion", SIGNATURE_VERSION);
        auth.put("SignatureMethod", method.algorithm());
        auth.put("Timestamp", TIMESTAMP_FORMAT.format(clock.instant()));

        ServiceRequest unsigned = request.withParameters(auth);
        return unsigned.withParameter(SIGNATURE, signature(baseString(unsigned)));
    }

    /**
     * The string the signature is computed over.
     */
    public static String baseString(@NotNull ServiceRequest request) {
        URI url = request.url();
        String host = url.getHost() == null ? "" : url.getHost().toLowerCase(Locale.ROOT);
        if (url.getPort() != -1) {
            host = host + ':' + url.getPort();
        }
        String path = url.getRawPath() == null || url.getRawPath().isEmpty() ? "/" : url.getRawPath();

        return request.method().toUpperCase(Locale.ROOT) + '\n'
            + host + '\n'
            + path + '\n'
            + normalizedParameters(request.parameters());
    }

    static String normalizedParameters(Map<String, String> parameters) {
        Map<String, String> sorted = new TreeMap<>(parameters);
        sorted.remove(SIGNATURE);

        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            joiner.add(UrlEncoding.encode(entry.getKey()) + '=' + UrlEncoding.encode(entry.getValue()));
        }
        return joiner.toString();
    }

    String signature(String baseString) {
        try {
            Mac mac = Mac.getInstance(method.algorithm());
            mac.init(new SecretKeySpec(credentials.secretKey().getBytes(StandardCharsets.UTF_8), method.algorithm()));
            byte[] digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new SimpleDBException("Cannot sign with " + method.algorithm(), e);
        }
    }
}
