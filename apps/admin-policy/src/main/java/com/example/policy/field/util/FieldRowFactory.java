package com.example.policy.field.util;

import com.example.policy.field.model.FieldPolicyRow;
import com.example.policy.permission.codec.PermissionCodec;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the field rows of one page action, e.g. the columns of a list view.
 */
public final class FieldRowFactory {

    private FieldRowFactory() {}

    /**
     * @param permission  page action key, {@code adminId#admin:list#page}
     * @param fieldLabels field name to label, in display order
     */
    @NonNull
    public static List<FieldPolicyRow> rows(@NonNull String permission, @NonNull Map<String, String> fieldLabels) {
        List<String> fields = PermissionCodec.decode(permission, 3);
        String resource = fields.get(0);
        String action = FieldActionNamespace.toStoredAction(fields.get(1));
        List<FieldPolicyRow> rows = new ArrayList<>(fieldLabels.size());
        fieldLabels.forEach((name, label) ->
                rows.add(FieldPolicyRow.of(label, PermissionCodec.encode(resource, action, name))));
        return rows;
    }
}
