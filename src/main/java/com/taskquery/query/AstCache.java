package com.taskquery.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 查询字符串到 AST 的有界缓存。
 *
 * 淘汰策略为 FIFO：满时移除最早插入的条目，读取不会改变条目的先后顺序。
 * key 为原始查询字符串，不做任何规范化。读写通过读写锁串行化。
 */
public class AstCache {
    private static final Logger logger = LoggerFactory.getLogger(AstCache.class);

    private final int capacity;
    private final Map<String, QueryNode> entries;
    private final Deque<String> insertionOrder;
    private final ReadWriteLock lock;

    public AstCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new HashMap<>(capacity * 2);
        this.insertionOrder = new ArrayDeque<>(capacity);
        this.lock = new ReentrantReadWriteLock();
    }

    public Optional<QueryNode> get(String query) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(query));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 插入新条目；容量已满时先淘汰最早插入的一条。已存在的 key 只更新值，不改变顺序。
     */
    public void put(String query, QueryNode ast) {
        lock.writeLock().lock();
        try {
            if (entries.containsKey(query)) {
                entries.put(query, ast);
                return;
            }
            if (entries.size() >= capacity) {
                String oldest = insertionOrder.removeFirst();
                entries.remove(oldest);
                logger.debug("AST 缓存已满，淘汰最早的查询: {}", oldest);
            }
            entries.put(query, ast);
            insertionOrder.addLast(query);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 命中时直接返回；未命中时解析并插入。解析抛出的异常原样传播，失败的查询不会被缓存。
     */
    public QueryNode computeIfAbsent(String query, Function<String, QueryNode> parser) {
        Optional<QueryNode> cached = get(query);
        if (cached.isPresent()) {
            return cached.get();
        }
        QueryNode parsed = parser.apply(query);
        put(query, parsed);
        return parsed;
    }

    public boolean contains(String query) {
        return get(query).isPresent();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            insertionOrder.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
