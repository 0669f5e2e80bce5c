package io.github.flameyossnowy.simpledb.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.flameyossnowy.simpledb.api.SimpleDBOperations;
import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.exceptions.ProtocolException;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.model.DomainMetadata;
import io.github.flameyossnowy.simpledb.api.model.Item;
import io.github.flameyossnowy.simpledb.api.model.ItemWrite;
import io.github.flameyossnowy.simpledb.api.model.ReplaceableAttribute;
import io.github.flameyossnowy.simpledb.api.utils.Logging;
import io.github.flameyossnowy.simpledb.http.batch.BatchWriter;
import io.github.flameyossnowy.simpledb.http.signing.RequestSigner;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Client for the 2009-04-15 API.
 *
 * <p>Every action is sent as a signed, form-encoded POST and its XML
 * response parsed before returning. Paged actions are exposed as
 * {@link PagedResults}, fetching the next page only when the previous one
 * has been consumed. Nothing is retried.</p>
 *
 * <pre>{@code
 * SimpleDBClient client = SimpleDBClient.builder()
 *     .withCredentials(new Credentials(accessKey, secretKey))
 *     .build();
 *
 * for (Item item : client.domain("users").filter("age__gte", 18)) {
 *     ...
 * }
 * }</pre>
 */
public final class SimpleDBClient implements SimpleDBOperations {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleDBClient.class);

    public static final String API_VERSION = "2009-04-15";
    public static final int MAX_DOMAINS_PER_PAGE = 100;

    private final URI endpoint;
    private final RequestSigner signer;
    private final RequestDispatcher dispatcher;
    private final ResponseParser parser;
    private final AttributeEncoder encoder;

    SimpleDBClient(
        @NotNull URI endpoint,
        @NotNull RequestSigner signer,
        @NotNull RequestDispatcher dispatcher,
        @NotNull ResponseParser parser,
        @NotNull AttributeEncoder encoder
    ) {
        this.endpoint = endpoint;
        this.signer = signer;
        this.dispatcher = dispatcher;
        this.parser = parser;
        this.encoder = encoder;
    }

    public static SimpleDBClientBuilder builder() {
        return new SimpleDBClientBuilder();
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public @NotNull AttributeEncoder encoder() {
        return encoder;
    }

    // ==================== Domains ====================

    @Override
    public void createDomain(@NotNull String domain) {
        send("CreateDomain", domainParameters(domain));
        LOGGER.info("Created domain {}", domain);
    }

    @Override
    public void deleteDomain(@NotNull String domain) {
        send("DeleteDomain", domainParameters(domain));
        LOGGER.info("Deleted domain {}", domain);
    }

    /**
     * Domain names, one page of up to {@value #MAX_DOMAINS_PER_PAGE} at a time.
     */
    public PagedResults<String> domains() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("MaxNumberOfDomains", String.valueOf(MAX_DOMAINS_PER_PAGE));

        return paged("ListDomains", parameters, response -> {
            JsonNode result = response.result("ListDomainsResult");
            List<String> names = ResponseParser.children(result, "DomainName").stream()
                .map(JsonNode::asText)
                .toList();
            return new Page<>(names, ResponseParser.text(result, "NextToken"));
        });
    }

    @Override
    public List<String> listDomains() {
        return domains().toList();
    }

    @Override
    public DomainMetadata domainMetadata(@NotNull String domain) {
        ServiceResponse response = send("DomainMetadata", domainParameters(domain));
        JsonNode result = response.result("DomainMetadataResult");
        if (result.isMissingNode() || !result.isObject()) {
            throw new ProtocolException("DomainMetadata response for " + domain + " has no DomainMetadataResult");
        }

        return new DomainMetadata(
            metadataLong(result, "ItemCount"),
            metadataLong(result, "ItemNamesSizeBytes"),
            metadataLong(result, "AttributeNameCount"),
            metadataLong(result, "AttributeNamesSizeBytes"),
            metadataLong(result, "AttributeValueCount"),
            metadataLong(result, "AttributeValuesSizeBytes"),
            Instant.ofEpochSecond(metadataLong(result, "Timestamp"))
        );
    }

    private static long metadataLong(JsonNode result, String element) {
        String text = ResponseParser.text(result, element);
        if (text == null) {
            throw new ProtocolException("DomainMetadataResult has no " + element);
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException(element + " is not a number: " + text, e);
        }
    }

    // ==================== Items ====================

    @Override
    public void putAttributes(@NotNull String domain, @NotNull String itemName, @NotNull List<ReplaceableAttribute> attributes) {
        Map<String, String> parameters = itemParameters(domain, itemName);
        appendAttributes(parameters, "", domain, attributes);
        send("PutAttributes", parameters);
    }

    @Override
    public void batchPutAttributes(@NotNull String domain, @NotNull List<ItemWrite> items) {
        sendBatch(domain, items);
    }

    /**
     * One {@code BatchPutAttributes} request for {@code items}, returning the
     * response. Splitting into allowed sizes is up to {@link BatchWriter}.
     */
    public ServiceResponse sendBatch(@NotNull String domain, @NotNull List<ItemWrite> items) {
        if (items.isEmpty()) {
            throw new ValidationException("Batch put needs at least one item");
        }

        Map<String, String> parameters = domainParameters(domain);
        for (int i = 0; i < items.size(); i++) {
            ItemWrite item = items.get(i);
            String prefix = "Item." + i + '.';
            parameters.put(prefix + "ItemName", item.itemName());
            appendAttributes(parameters, prefix, domain, item.attributes());
        }
        return send("BatchPutAttributes", parameters);
    }

    public BatchWriter batchWriter() {
        return new BatchWriter(this);
    }

    public BatchWriter batchWriter(int chunkSize) {
        return new BatchWriter(this, chunkSize);
    }

    @Override
    public void deleteAttributes(@NotNull String domain, @NotNull String itemName, @Nullable Map<String, ?> attributes) {
        Map<String, String> parameters = itemParameters(domain, itemName);
        if (attributes != null) {
            int index = 0;
            for (Map.Entry<String, ?> entry : attributes.entrySet()) {
                String name = entry.getKey();
                Object value = entry.getValue();

                if (value == null) {
                    parameters.put("Attribute." + index + ".Name", name);
                    index++;
                    continue;
                }

                for (Object each : valuesOf(value)) {
                    parameters.put("Attribute." + index + ".Name", name);
                    parameters.put("Attribute." + index + ".Value", encode(domain, name, each));
                    index++;
                }
            }
        }
        send("DeleteAttributes", parameters);
    }

    @Override
    public Item getAttributes(@NotNull String domain, @NotNull String itemName, String... attributeNames) {
        Map<String, String> parameters = itemParameters(domain, itemName);
        for (int i = 0; i < attributeNames.length; i++) {
            parameters.put("AttributeName." + i, attributeNames[i]);
        }

        ServiceResponse response = send("GetAttributes", parameters);
        return ResponseParser.attributes(itemName, response.result("GetAttributesResult"));
    }

    @Override
    public PagedResults<Item> select(@NotNull String expression) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("SelectExpression", expression);

        return paged("Select", parameters, response -> {
            JsonNode result = response.result("SelectResult");
            return new Page<>(ResponseParser.items(result), ResponseParser.text(result, "NextToken"));
        });
    }

    // ==================== Requests ====================

    /**
     * Signs and sends one action, returning its parsed response.
     *
     * @throws io.github.flameyossnowy.simpledb.api.exceptions.RemoteServiceException when the service answers with an error
     */
    public ServiceResponse send(@NotNull String action, @NotNull Map<String, String> parameters) {
        Map<String, String> all = new LinkedHashMap<>();
        all.put("Action", action);
        all.putAll(parameters);
        all.put("Version", API_VERSION);

        ServiceRequest request = signer.sign(ServiceRequest.post(endpoint, all));
        Logging.deepInfo(() -> "Sending " + action + " with " + parameters.size() + " parameters");

        String body = dispatcher.dispatch(request);
        ServiceResponse response = parser.parse(body);
        LOGGER.debug("{} completed, request id {}, box usage {}", action, response.requestId(), response.boxUsage());
        return response;
    }

    /**
     * Results of a paged action. Each page re-sends {@code parameters} and
     * adds only the {@code NextToken} of the previous page.
     */
    <T> PagedResults<T> paged(String action, Map<String, String> parameters, Function<ServiceResponse, Page<T>> reader) {
        Map<String, String> base = new LinkedHashMap<>(parameters);
        return new PagedResults<>(token -> {
            Map<String, String> page = new LinkedHashMap<>(base);
            if (token != null) {
                page.put("NextToken", token);
            }
            return reader.apply(send(action, page));
        });
    }

    private void appendAttributes(Map<String, String> parameters, String prefix, String domain, List<ReplaceableAttribute> attributes) {
        int index = 0;
        for (ReplaceableAttribute attribute : attributes) {
            for (Object value : attribute.valueList()) {
                String key = prefix + "Attribute." + index + '.';
                parameters.put(key + "Name", attribute.name());
                parameters.put(key + "Value", encode(domain, attribute.name(), value));
                if (attribute.replace()) {
                    parameters.put(key + "Replace", "true");
                }
                index++;
            }
        }
    }

    private String encode(String domain, String attribute, Object value) {
        String encoded = encoder.encode(domain, attribute, value);
        if (encoded == null) {
            throw new ValidationException("Value of attribute " + attribute + " cannot be null");
        }
        return encoded;
    }

    private static Collection<?> valuesOf(Object value) {
        return value instanceof Collection<?> many ? many : List.of(value);
    }

    private static Map<String, String> domainParameters(String domain) {
        Objects.requireNonNull(domain, "Domain cannot be null");
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("DomainName", domain);
        return parameters;
    }

    private static Map<String, String> itemParameters(String domain, String itemName) {
        Objects.requireNonNull(itemName, "Item name cannot be null");
        Map<String, String> parameters = domainParameters(domain);
        parameters.put("ItemName", itemName);
        return parameters;
    }
}
