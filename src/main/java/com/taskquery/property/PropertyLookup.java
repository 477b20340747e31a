package com.taskquery.property;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 按文档路径异步获取文档级属性（frontmatter）。
 *
 * 返回 null 的 Map 表示该文档没有属性；失败的 future 会原样传播给调用方。
 */
@FunctionalInterface
public interface PropertyLookup {

    /** 不提供任何属性的查找 */
    PropertyLookup NONE = path -> CompletableFuture.completedFuture(Map.of());

    CompletableFuture<Map<String, Object>> lookup(String path);
}
