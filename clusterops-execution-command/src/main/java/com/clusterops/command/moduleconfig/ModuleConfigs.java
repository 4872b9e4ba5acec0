package com.clusterops.command.moduleconfig;

import com.clusterops.command.lookup.FieldPath;
import com.clusterops.command.lookup.LookupResult;
import com.clusterops.command.lookup.PathLookup;
import com.clusterops.command.lookup.ValueCoercion;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Service and component configuration carried by a command: the {@code configurations} block
 * ({@code configType → property → value}, e.g. {@code zoo.cfg → clientPort → 2181}) and the
 * {@code configurationAttributes} block ({@code configType → attribute → property → value}, e.g.
 * {@code hdfs-site → final → dfs.webhdfs.enabled → true}).
 * <p>
 * Missing blocks behave as empty. Config type and property names are matched literally.
 */
public final class ModuleConfigs {

    private final JsonNode configurations;
    private final JsonNode configurationAttributes;

    /**
     * @param configurations          the {@code configurations} block; null or non-object means none
     * @param configurationAttributes the {@code configurationAttributes} block; null or non-object means none
     */
    public ModuleConfigs(JsonNode configurations, JsonNode configurationAttributes) {
        this.configurations = objectOrEmpty(configurations);
        this.configurationAttributes = objectOrEmpty(configurationAttributes);
    }

    public static ModuleConfigs empty() {
        return new ModuleConfigs(null, null);
    }

    /** The {@code configurations} block as received (empty object if it was missing). */
    public JsonNode getRawConfigurations() {
        return configurations;
    }

    public JsonNode getRawConfigurationAttributes() {
        return configurationAttributes;
    }

    /** Config types present in {@code configurations}, in document order. */
    public Set<String> getConfigTypes() {
        Set<String> types = new LinkedHashSet<>();
        configurations.fieldNames().forEachRemaining(types::add);
        return Collections.unmodifiableSet(types);
    }

    public boolean hasConfigType(String configType) {
        return configurations.has(configType);
    }

    /**
     * All properties of a config type as text. Nested objects/arrays and nulls are skipped.
     *
     * @return property → value, empty if the type is missing
     */
    public Map<String, String> getAllProperties(String configType) {
        return textFields(PathLookup.lookup(configurations, FieldPath.ofSegments(configType), null));
    }

    public Optional<String> getPropertyValue(String configType, String propertyName) {
        return property(configType, propertyName).asOptional();
    }

    /**
     * Value of one property, or {@code defaultValue} when the type or property is missing or null.
     */
    public String getPropertyValue(String configType, String propertyName, String defaultValue) {
        return property(configType, propertyName).orElse(defaultValue);
    }

    /**
     * Values for several properties of one type. Every requested name is present in the result;
     * missing ones map to {@code defaultValue} (which may be null).
     */
    public Map<String, String> getProperties(String configType, Collection<String> propertyNames, String defaultValue) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String name : propertyNames) {
            result.put(name, getPropertyValue(configType, name, defaultValue));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Attributes of a config type: attribute name (e.g. "final", "hidden") → property → value.
     *
     * @return empty if the type has no attributes
     */
    public Map<String, Map<String, String>> getAllConfigAttributes(String configType) {
        JsonNode typeAttributes = PathLookup.lookup(configurationAttributes, FieldPath.ofSegments(configType), null);
        if (typeAttributes == null || !typeAttributes.isObject()) return Map.of();
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = typeAttributes.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            result.put(e.getKey(), textFields(e.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    /** One attribute of one property, e.g. {@code ("hdfs-site", "final", "dfs.webhdfs.enabled")}. */
    public Optional<String> getPropertyAttribute(String configType, String attributeName, String propertyName) {
        FieldPath path = FieldPath.ofSegments(configType, attributeName, propertyName);
        return ValueCoercion.toText(PathLookup.find(configurationAttributes, path)).asOptional();
    }

    private LookupResult<String> property(String configType, String propertyName) {
        FieldPath path = FieldPath.ofSegments(configType, propertyName);
        return ValueCoercion.toText(PathLookup.find(configurations, path));
    }

    private static Map<String, String> textFields(JsonNode node) {
        if (node == null || !node.isObject()) return Map.of();
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (v.isValueNode() && !v.isNull()) {
                result.put(e.getKey(), v.asText());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private static JsonNode objectOrEmpty(JsonNode node) {
        return node != null && node.isObject() ? node : JsonNodeFactory.instance.objectNode();
    }
}
