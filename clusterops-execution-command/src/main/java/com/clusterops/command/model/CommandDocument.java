package com.clusterops.command.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * The command payload delivered to the agent for one unit of deployment work (command.json), held as a
 * Jackson tree: objects are mappings, arrays are sequences, value nodes are scalars.
 * <p>
 * Read-only: nothing in this module writes to the tree. A document built with {@link #of(JsonNode)} shares
 * the caller's tree, so the caller must not mutate it while accessors are in use; that is what makes
 * concurrent reads safe without locking.
 */
public final class CommandDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final CommandDocument EMPTY = new CommandDocument(MAPPER.createObjectNode());

    private final JsonNode root;

    private CommandDocument(JsonNode root) {
        this.root = root;
    }

    /** Wraps an existing tree. A null or missing root behaves as an empty document. */
    public static CommandDocument of(JsonNode root) {
        if (root == null || root.isMissingNode()) return EMPTY;
        return new CommandDocument(root);
    }

    public static CommandDocument empty() {
        return EMPTY;
    }

    /**
     * Parses a command.json payload. Throws {@link UncheckedIOException} on malformed JSON.
     */
    public static CommandDocument fromJson(String json) {
        if (json == null || json.isBlank()) return EMPTY;
        try {
            return of(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public JsonNode getRoot() {
        return root;
    }

    /** Top-level section (e.g. "commandParams"), or a missing node. */
    public JsonNode section(String name) {
        JsonNode node = root.get(name);
        return node != null ? node : MissingNode.getInstance();
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return root.equals(((CommandDocument) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
