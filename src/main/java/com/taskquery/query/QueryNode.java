package com.taskquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 查询 AST，构建后不可变。
 */
public sealed interface QueryNode permits QueryNode.And, QueryNode.Or, QueryNode.Not,
        QueryNode.Term, QueryNode.Phrase, QueryNode.PrefixFilter,
        QueryNode.RangeFilter, QueryNode.PropertyFilter {

    record And(List<QueryNode> children) implements QueryNode {
        public And {
            children = List.copyOf(children);
        }

        public And(QueryNode left, QueryNode right) {
            this(List.of(left, right));
        }

        /** 追加一个子节点，返回新节点 */
        public And append(QueryNode child) {
            List<QueryNode> extended = new ArrayList<>(children);
            extended.add(child);
            return new And(extended);
        }
    }

    record Or(List<QueryNode> children) implements QueryNode {
        public Or {
            children = List.copyOf(children);
        }

        public Or(QueryNode left, QueryNode right) {
            this(List.of(left, right));
        }
    }

    record Not(QueryNode child) implements QueryNode {
        public Not {
            Objects.requireNonNull(child, "child");
        }
    }

    record Term(String value) implements QueryNode {
    }

    record Phrase(String value) implements QueryNode {
    }

    /**
     * @param exact 值在查询中是否带引号
     */
    record PrefixFilter(FilterField field, String value, boolean exact) implements QueryNode {
    }

    record RangeFilter(FilterField field, String start, String end) implements QueryNode {
    }

    /**
     * @param value 仅有属性名时为 null
     * @param exact 属性名或属性值在查询中是否带引号
     */
    record PropertyFilter(String key, String value, boolean exact) implements QueryNode {

        public boolean keyOnly() {
            return value == null;
        }

        /** 规范形式：key 或 key:value */
        public String expression() {
            return keyOnly() ? key : key + ":" + value;
        }
    }
}
