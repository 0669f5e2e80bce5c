package io.github.flameyossnowy.simpledb.http;

import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.http.signing.RequestSigner;
import io.github.flameyossnowy.simpledb.http.signing.SignatureMethod;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.Objects;

@SuppressWarnings("unused")
public class SimpleDBClientBuilder {
    public static final String DEFAULT_HOST = "sdb.amazonaws.com";

    private Credentials credentials;
    private String host = DEFAULT_HOST;
    private boolean secure = true;
    private AttributeEncoder encoder = AttributeEncoder.identity();
    private RequestDispatcher dispatcher;
    private Clock clock = Clock.systemUTC();
    private SignatureMethod signatureMethod;

    public SimpleDBClientBuilder withCredentials(Credentials credentials) {
        this.credentials = credentials;
        return this;
    }

    public SimpleDBClientBuilder withCredentials(String accessKeyId, String secretKey) {
        return withCredentials(new Credentials(accessKeyId, secretKey));
    }

    /**
     * Host requests go to, e.g. {@code sdb.eu-west-1.amazonaws.com}.
     */
    public SimpleDBClientBuilder withHost(String host) {
        this.host = host;
        return this;
    }

    /**
     * {@code https} when true (the default), {@code http} otherwise.
     */
    public SimpleDBClientBuilder withSecure(boolean secure) {
        this.secure = secure;
        return this;
    }

    public SimpleDBClientBuilder withEncoder(AttributeEncoder encoder) {
        this.encoder = Objects.requireNonNull(encoder, "Encoder cannot be null");
        return this;
    }

    public SimpleDBClientBuilder withDispatcher(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        return this;
    }

    public SimpleDBClientBuilder withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        return this;
    }

    public SimpleDBClientBuilder withSignatureMethod(SignatureMethod signatureMethod) {
        this.signatureMethod = signatureMethod;
        return this;
    }

    public SimpleDBClient build() {
        if (this.credentials == null) throw new IllegalArgumentException("Credentials cannot be null");
        if (this.host == null || this.host.isBlank()) throw new ValidationException("Host cannot be blank");

        SignatureMethod method = this.signatureMethod != null ? this.signatureMethod : SignatureMethod.preferred();
        if (!method.isAvailable()) {
            throw new ValidationException(method.algorithm() + " is not available in this runtime");
        }

        return new SimpleDBClient(
            endpoint(),
            new RequestSigner(this.credentials, method, this.clock),
            this.dispatcher != null ? this.dispatcher : new JdkHttpDispatcher(),
            new ResponseParser(),
            this.encoder
        );
    }

    private URI endpoint() {
        try {
            return new URI(secure ? "https" : "http", host, "/", null, null).parseServerAuthority();
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid host: " + host);
        }
    }
}
