package com.example.policy.permission.codec;

import com.example.policy.common.exception.MalformedPermissionKeyException;
import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps permission field tuples to the single string token stored in option values
 * and back. Fields are joined with {@code #}; fields must not contain the delimiter.
 */
public final class PermissionCodec {

    public static final String DELIMITER = "#";

    private PermissionCodec() {}

    /**
     * Join the non-null fields with the delimiter.
     *
     * @throws MalformedPermissionKeyException if a field contains the delimiter
     */
    @NonNull
    public static String encode(String... fields) {
        return encode(Arrays.asList(fields));
    }

    @NonNull
    public static String encode(@NonNull List<String> fields) {
        for (String field : fields) {
            if (field != null && field.contains(DELIMITER)) {
                throw new MalformedPermissionKeyException(field,
                        "Permission field must not contain '" + DELIMITER + "': " + field);
            }
        }
        return fields.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.joining(DELIMITER));
    }

    /**
     * Strip leading and trailing delimiters and split. Arity is not checked.
     */
    @NonNull
    public static List<String> decode(@NonNull String permission) {
        int start = 0;
        int end = permission.length();
        while (start < end && permission.startsWith(DELIMITER, start)) {
            start++;
        }
        while (end > start && permission.startsWith(DELIMITER, end - 1)) {
            end--;
        }
        return List.of(permission.substring(start, end).split(DELIMITER, -1));
    }

    /**
     * Decode and require one of the given arities.
     *
     * @throws MalformedPermissionKeyException if the decoded arity is not allowed
     */
    @NonNull
    public static List<String> decode(@NonNull String permission, int... allowedArities) {
        List<String> fields = decode(permission);
        for (int arity : allowedArities) {
            if (fields.size() == arity) {
                return fields;
            }
        }
        throw new MalformedPermissionKeyException(permission, fields.size(), Arrays.toString(allowedArities));
    }
}
