package com.vibeflows.dataserver.repositories.mongo;

import com.vibeflows.dataserver.core.IndexSpec;
import com.vibeflows.dataserver.core.Ids;
import org.bson.Document;

import java.util.Map;
import java.util.Set;

public interface Converters {
    String CREATED_AT = "created_at";
    String UPDATED_AT = "updated_at";

    /**
     * Replaces the store's {@code _id} with its string form, in place.
     */
    static Document normalizeId(Document doc) {
        if (doc != null && doc.containsKey("_id")) {
            doc.put("_id", Ids.normalize(doc.get("_id")));
        }
        return doc;
    }

    static Document indexKeys(IndexSpec spec) {
        Document keys = new Document();
        for (String field : spec.fields()) {
            keys.put(field, spec.direction());
        }
        return keys;
    }

    /**
     * Turns a caller patch into an update document. Patches made only of operators
     * are copied; plain field maps become a {@code $set}. The returned update always
     * holds its own mutable {@code $set} document.
     *
     * {@code created_at} cannot be touched at all. The other {@code bookkeeping} fields
     * may only appear in {@code $set}, where the store overwrites them.
     */
    static Document toUpdate(Document patch, Set<String> bookkeeping) {
        long operators = patch.keySet().stream().filter(k -> k.startsWith("$")).count();
        if (operators > 0 && operators < patch.size()) {
            throw new IllegalArgumentException("Patch mixes update operators and plain fields: " + patch.keySet());
        }

        Document update = new Document();
        if (operators == 0) {
            update.put("$set", new Document(patch));
        } else {
            update.putAll(patch);
            update.put("$set", asDocument(patch.get("$set")));
        }

        for (Map.Entry<String, Object> entry : update.entrySet()) {
            Set<String> guarded = "$set".equals(entry.getKey()) ? Set.of(CREATED_AT) : bookkeeping;
            checkPaths(entry.getKey(), entry.getValue(), guarded);
        }
        return update;
    }

    private static void checkPaths(String operator, Object fields, Set<String> guarded) {
        if (!(fields instanceof Map)) {
            return;
        }
        for (Map.Entry<?, ?> field : ((Map<?, ?>) fields).entrySet()) {
            String path = String.valueOf(field.getKey());
            // $rename also writes to its target
            String target = "$rename".equals(operator) && field.getValue() instanceof String
                    ? (String) field.getValue() : null;
            if (touches(path, guarded) || (target != null && touches(target, guarded))) {
                throw new IllegalArgumentException(operator + " may not modify bookkeeping field " + path);
            }
        }
    }

    private static boolean touches(String path, Set<String> guarded) {
        for (String field : guarded) {
            if (path.equals(field) || path.startsWith(field + ".")) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private static Document asDocument(Object value) {
        if (value == null) {
            return new Document();
        }
        if (value instanceof Map) {
            return new Document((Map<String, Object>) value);
        }
        throw new IllegalArgumentException("$set must be a document, got " + value.getClass().getSimpleName());
    }
}
