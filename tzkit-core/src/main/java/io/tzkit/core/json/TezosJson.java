// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tzkit.core.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tzkit.core.model.Block;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for Tezos RPC payloads.
 *
 * <p>Example usage:
 * <pre>{@code
 * Block block = TezosJson.readBlock(bytes);
 * byte[] archived = TezosJson.writeBlock(block);
 * }</pre>
 *
 * <p>
 * Decoding ignores fields the model does not know, rejects {@code null} or
 * missing values for required numeric fields, and fails on unknown operation
 * kinds. Encoding omits absent fields, so decoding a node response and
 * encoding it again reproduces every modelled field with the node's ordering
 * of validation passes and contents.
 *
 * <p>
 * Methods throw the underlying Jackson exception; callers wrap it with the
 * context of the operation they were performing.
 */
public final class TezosJson {

    /**
     * Shared, thread-safe ObjectMapper configured for Tezos payloads.
     */
    public static final ObjectMapper MAPPER = createMapper();

    private TezosJson() {
        // Utility class - prevent instantiation
    }

    /**
     * Decodes a block.
     *
     * @param json the response body
     * @return the decoded block
     * @throws IOException if the body is not valid JSON or does not match the block schema
     */
    public static Block readBlock(final byte[] json) throws IOException {
        final Block block = MAPPER.readValue(json, Block.class);
        if (block == null) {
            throw schemaError("Expected a block object but got null");
        }
        return block;
    }

    /**
     * Encodes a block back to its wire form.
     *
     * @param block the block
     * @return the UTF-8 encoded JSON
     * @throws JsonProcessingException if the block cannot be serialized
     */
    public static byte[] writeBlock(final Block block) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(block);
    }

    /**
     * Decodes the response of {@code /operation_hashes}.
     *
     * <p>
     * Nodes answer with one list per validation pass; those lists are
     * concatenated in order. A flat list of strings is accepted as is.
     *
     * @param json the response body
     * @return the operation hashes in wire order
     * @throws IOException if the body is not a list of strings or of lists of strings
     */
    public static List<String> readOperationHashes(final byte[] json) throws IOException {
        final JsonNode root = MAPPER.readTree(json);
        if (root == null || !root.isArray()) {
            throw schemaError("Expected a JSON array of operation hashes");
        }
        final List<String> hashes = new ArrayList<>();
        for (JsonNode element : root) {
            if (element.isTextual()) {
                hashes.add(element.textValue());
            } else if (element.isArray()) {
                for (JsonNode nested : element) {
                    if (!nested.isTextual()) {
                        throw schemaError("Expected an operation hash string but got " + nested.getNodeType());
                    }
                    hashes.add(nested.textValue());
                }
            } else {
                throw schemaError("Expected an operation hash or a list of hashes but got " + element.getNodeType());
            }
        }
        return List.copyOf(hashes);
    }

    /**
     * Parses arbitrary JSON into a tree.
     *
     * @param json the JSON text
     * @return the tree
     * @throws JsonProcessingException if the text is not valid JSON
     */
    public static JsonNode readTree(final String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }

    private static JsonMappingException schemaError(final String message) {
        return JsonMappingException.from((JsonParser) null, message);
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
