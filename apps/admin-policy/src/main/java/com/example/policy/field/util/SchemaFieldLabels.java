package com.example.policy.field.util;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts field names and labels from a DTO type using Jackson's introspection.
 * The name is the JSON property name (so {@code @JsonProperty} aliases win); the label is the
 * {@code @JsonPropertyDescription} text, or the name when there is none.
 */
public final class SchemaFieldLabels {

    private SchemaFieldLabels() {}

    @NonNull
    public static Map<String, String> of(
            @NonNull ObjectMapper objectMapper, @Nullable Class<?> type, @NonNull String labelPrefix) {
        if (type == null) {
            return Map.of();
        }
        BeanDescription description = objectMapper.getSerializationConfig()
                .introspect(objectMapper.constructType(type));
        Map<String, String> fields = new LinkedHashMap<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            String name = property.getName();
            String text = property.getMetadata().getDescription();
            String label = text == null || text.isBlank() ? name : text;
            fields.put(name, labelPrefix + label);
        }
        return fields;
    }
}
