package com.taskquery.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AstCacheTest {

    private static final QueryNode A = new QueryNode.Term("a");
    private static final QueryNode B = new QueryNode.Term("b");
    private static final QueryNode C = new QueryNode.Term("c");
    private static final QueryNode D = new QueryNode.Term("d");

    @Test
    void testEvictsOldestInsertion() {
        AstCache cache = new AstCache(3);
        cache.put("a", A);
        cache.put("b", B);
        cache.put("c", C);

        cache.put("d", D);

        assertEquals(3, cache.size());
        assertFalse(cache.contains("a"));
        assertTrue(cache.contains("b"));
        assertTrue(cache.contains("c"));
        assertTrue(cache.contains("d"));
    }

    @Test
    void testReadsDoNotPromoteEntries() {
        AstCache cache = new AstCache(2);
        cache.put("a", A);
        cache.put("b", B);

        assertSame(A, cache.get("a").orElseThrow());
        cache.put("c", C);

        assertFalse(cache.contains("a"));
        assertTrue(cache.contains("b"));
    }

    @Test
    void testUpdatingExistingKeyKeepsPosition() {
        AstCache cache = new AstCache(2);
        cache.put("a", A);
        cache.put("b", B);
        cache.put("a", D);

        assertEquals(2, cache.size());
        assertSame(D, cache.get("a").orElseThrow());

        cache.put("c", C);
        assertFalse(cache.contains("a"));
        assertTrue(cache.contains("b"));
    }

    @Test
    void testComputeIfAbsentParsesOnce() {
        AstCache cache = new AstCache(4);
        AtomicInteger parses = new AtomicInteger();

        QueryNode first = cache.computeIfAbsent("x", query -> {
            parses.incrementAndGet();
            return new QueryNode.Term(query);
        });
        QueryNode second = cache.computeIfAbsent("x", query -> {
            parses.incrementAndGet();
            return new QueryNode.Term(query);
        });

        assertSame(first, second);
        assertEquals(1, parses.get());
    }

    @Test
    void testComputeIfAbsentDoesNotCacheFailures() {
        AstCache cache = new AstCache(4);

        assertThrows(QueryParseException.class, () -> cache.computeIfAbsent("bad", query -> {
            throw new QueryParseException("Unexpected end of expression", 0);
        }));
        assertFalse(cache.contains("bad"));
        assertEquals(0, cache.size());
    }

    @Test
    void testKeysAreNotNormalized() {
        AstCache cache = new AstCache(4);
        cache.put("a b", A);

        assertFalse(cache.contains("a  b"));
        assertFalse(cache.contains("A B"));
    }

    @Test
    void testClear() {
        AstCache cache = new AstCache(2);
        cache.put("a", A);
        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(2, cache.capacity());
        cache.put("b", B);
        cache.put("c", C);
        assertTrue(cache.contains("b"));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new AstCache(0));
        assertThrows(IllegalArgumentException.class, () -> new AstCache(-1));
    }
}
