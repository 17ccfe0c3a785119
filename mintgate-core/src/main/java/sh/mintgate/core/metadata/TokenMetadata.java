// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jspecify.annotations.Nullable;

/**
 * Credential metadata document.
 *
 * <p>This is the JSON file a resolved token URI ({@code prefix + id + ".json"}) points to,
 * following the multi-token metadata schema. Publishers write one per token id; wallets
 * and indexers read it to show the credential.
 *
 * <pre>{@code
 * TokenMetadata meta = TokenMetadata.fromJson(body);
 * System.out.println(meta.name() + " - " + meta.image());
 * }</pre>
 *
 * @param name        human-readable credential name
 * @param description what holding the credential means
 * @param image       image URL
 * @param decimals    display decimals, usually 0 for credentials
 * @param properties  arbitrary extra attributes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenMetadata(
    String name,
    @Nullable String description,
    @Nullable String image,
    @Nullable Integer decimals,
    @Nullable Map<String, Object> properties
) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public TokenMetadata {
        Objects.requireNonNull(name, "name");
        properties = properties == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Parses a metadata document.
     *
     * @param json the JSON string
     * @return the parsed metadata
     * @throws IllegalArgumentException if the JSON is invalid or has no name
     */
    public static TokenMetadata fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, TokenMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Invalid token metadata JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializes this document, omitting null fields.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Token metadata is not serializable", e);
        }
    }
}
