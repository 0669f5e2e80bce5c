package io.github.flameyossnowy.simpledb.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.github.flameyossnowy.simpledb.api.exceptions.ProtocolException;
import io.github.flameyossnowy.simpledb.api.exceptions.RemoteServiceException;
import io.github.flameyossnowy.simpledb.api.model.Item;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns response documents into {@link ServiceResponse}s and reads the
 * elements inside them.
 *
 * <p>Documents are read with Jackson's XML tree model. The root element is
 * unwrapped, a repeated element becomes an array and an element seen once
 * does not, so every lookup of a possibly repeated element goes through
 * {@link #children(JsonNode, String)}.</p>
 */
public final class ResponseParser {
    private final XmlMapper mapper;

    public ResponseParser() {
        this(new XmlMapper());
    }

    public ResponseParser(@NotNull XmlMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws RemoteServiceException for an error document
     * @throws ProtocolException for a body that is not XML or lacks response metadata
     */
    public ServiceResponse parse(@NotNull String content) {
        JsonNode root = readTree(content);

        JsonNode errors = root.path("Errors");
        if (!errors.isMissingNode()) {
            List<JsonNode> list = children(errors, "Error");
            JsonNode error = list.isEmpty() ? errors : list.get(0);
            throw new RemoteServiceException(text(error, "Code"), text(error, "Message"), text(root, "RequestID"));
        }

        JsonNode metadata = root.path("ResponseMetadata");
        String requestId = text(metadata, "RequestId");
        String boxUsage = text(metadata, "BoxUsage");
        if (requestId == null || boxUsage == null) {
            throw new ProtocolException("Response has no ResponseMetadata with RequestId and BoxUsage");
        }

        try {
            return new ServiceResponse(requestId, Double.parseDouble(boxUsage.trim()), root);
        } catch (NumberFormatException e) {
            throw new ProtocolException("BoxUsage is not a number: " + boxUsage, e);
        }
    }

    private JsonNode readTree(String content) {
        if (content.isBlank()) {
            throw new ProtocolException("Empty response body");
        }
        try {
            JsonNode root = mapper.readTree(content);
            if (root == null || !root.isObject()) {
                throw new ProtocolException("Response is not an XML document: " + abbreviate(content));
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Response is not an XML document: " + abbreviate(content), e);
        }
    }

    /**
     * Every {@code name} child of {@code node}, whether the element occurred
     * once, several times or not at all.
     */
    public static List<JsonNode> children(@NotNull JsonNode node, @NotNull String name) {
        JsonNode child = node.path(name);
        if (child.isMissingNode() || child.isNull()) {
            return List.of();
        }
        if (child.isArray()) {
            List<JsonNode> list = new ArrayList<>(child.size());
            child.forEach(list::add);
            return list;
        }
        return List.of(child);
    }

    /**
     * Text of the {@code name} child, or {@code null} when absent. An element
     * carrying attributes keeps its text under the empty key.
     */
    @Nullable
    public static String text(@NotNull JsonNode node, @NotNull String name) {
        JsonNode child = node.path(name);
        if (child.isMissingNode() || child.isNull()) {
            return null;
        }
        if (child.isObject()) {
            JsonNode inner = child.path("");
            return inner.isValueNode() ? inner.asText() : "";
        }
        return child.asText();
    }

    /**
     * Reads {@code Item} elements, each with a {@code Name} and repeated
     * {@code Attribute{Name, Value}} children.
     */
    public static List<Item> items(@NotNull JsonNode result) {
        List<JsonNode> nodes = children(result, "Item");
        List<Item> items = new ArrayList<>(nodes.size());
        for (JsonNode node : nodes) {
            String name = text(node, "Name");
            if (name == null) {
                throw new ProtocolException("Item element without a Name");
            }
            items.add(attributes(name, node));
        }
        return items;
    }

    /**
     * The {@code Attribute} children of {@code node} as an item named
     * {@code itemName}. Repeated attribute names become multiple values.
     */
    public static Item attributes(@NotNull String itemName, @NotNull JsonNode node) {
        Item.Builder builder = Item.builder(itemName);
        for (JsonNode attribute : children(node, "Attribute")) {
            String name = text(attribute, "Name");
            if (name == null) {
                throw new ProtocolException("Attribute of item " + itemName + " has no Name");
            }
            String value = text(attribute, "Value");
            builder.add(name, value == null ? "" : value);
        }
        return builder.build();
    }

    private static String abbreviate(String content) {
        return content.length() <= 120 ? content : content.substring(0, 120) + "...";
    }
}
