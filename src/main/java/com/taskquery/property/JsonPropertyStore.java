package com.taskquery.property;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 基于 JSON 文件的文档属性表：{"notes/a.md": {"type": "Project", ...}, ...}。
 *
 * 文件缺失、无法解析或某个文档的属性不是对象时，对应文档视为没有属性。
 */
public class JsonPropertyStore implements PropertyLookup {
    private static final Logger logger = LoggerFactory.getLogger(JsonPropertyStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTY_MAP = new TypeReference<>() {
    };

    private final Map<String, Map<String, Object>> propertiesByPath;

    public JsonPropertyStore(Map<String, Map<String, Object>> propertiesByPath) {
        this.propertiesByPath = new HashMap<>(propertiesByPath);
    }

    /**
     * 从 JSON 文件加载；读取失败时记录告警并返回空表。
     */
    public static JsonPropertyStore load(Path file) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return new JsonPropertyStore(toPropertyTable(mapper, mapper.readTree(file.toFile()), file.toString()));
        } catch (IOException ioException) {
            logger.warn("无法读取属性文件: {} - {}", file, ioException.getMessage());
            return new JsonPropertyStore(Map.of());
        }
    }

    public static JsonPropertyStore parse(String json) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return new JsonPropertyStore(toPropertyTable(mapper, mapper.readTree(json), "<inline>"));
        } catch (IOException ioException) {
            logger.warn("无法解析属性 JSON: {}", ioException.getMessage());
            return new JsonPropertyStore(Map.of());
        }
    }

    @Override
    public CompletableFuture<Map<String, Object>> lookup(String path) {
        return CompletableFuture.completedFuture(propertiesByPath.get(path));
    }

    public int size() {
        return propertiesByPath.size();
    }

    private static Map<String, Map<String, Object>> toPropertyTable(ObjectMapper mapper, JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            logger.warn("属性文件根节点不是对象: {}", source);
            return Map.of();
        }
        Map<String, Map<String, Object>> table = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isObject()) {
                logger.warn("忽略非对象属性: {} -> {}", entry.getKey(), entry.getValue().getNodeType());
                continue;
            }
            table.put(entry.getKey(), Collections.unmodifiableMap(mapper.convertValue(entry.getValue(), PROPERTY_MAP)));
        }
        return table;
    }
}
