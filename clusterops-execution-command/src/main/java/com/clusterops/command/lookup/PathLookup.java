package com.clusterops.command.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Walks a JSON tree along a {@link FieldPath}. Never throws for shape problems: a missing key, or a
 * scalar/array where a mapping is needed, ends the walk with the default.
 */
public final class PathLookup {

    private PathLookup() {
    }

    public static JsonNode lookup(JsonNode document, String path, JsonNode defaultValue) {
        return lookup(document, FieldPath.of(path), defaultValue);
    }

    /**
     * Returns the node at {@code path}, or {@code defaultValue} when any segment is missing.
     * <p>
     * An explicit JSON null met on the way is replaced by {@code defaultValue} at that point and the walk
     * continues inside it, so a null leaf yields the default and a null intermediate almost always does too.
     * An empty path returns the document itself.
     *
     * @param document     root of the tree (may be null)
     * @param path         parsed path
     * @param defaultValue value returned when the path cannot be followed (may be null)
     * @return the node found, or the default
     */
    public static JsonNode lookup(JsonNode document, FieldPath path, JsonNode defaultValue) {
        JsonNode current = document;
        for (String segment : path.getSegments()) {
            if (current == null || !current.isObject() || !current.has(segment)) {
                return defaultValue;
            }
            current = current.get(segment);
            if (current.isNull()) {
                current = defaultValue;
            }
        }
        return current;
    }

    public static LookupResult<JsonNode> find(JsonNode document, String path) {
        return find(document, FieldPath.of(path));
    }

    /**
     * Like {@link #lookup(JsonNode, FieldPath, JsonNode)} with no default: reports {@link LookupResult.Status#ABSENT}
     * for missing keys, explicit nulls and malformed intermediates.
     */
    public static LookupResult<JsonNode> find(JsonNode document, FieldPath path) {
        JsonNode node = lookup(document, path, MissingNode.getInstance());
        if (node == null || node.isMissingNode() || node.isNull()) {
            return LookupResult.absent(path);
        }
        return LookupResult.found(path, node);
    }
}
