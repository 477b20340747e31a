package com.taskquery.query;

import java.util.List;
import java.util.StringJoiner;

/**
 * AST 的函数式文本表示，例如 and(term(a), not(term(b)))。
 */
public final class QueryNodes {
    private QueryNodes() {
        // 工具类，禁止实例化
    }

    public static String render(QueryNode node) {
        if (node instanceof QueryNode.And and) {
            return renderChildren("and", and.children());
        }
        if (node instanceof QueryNode.Or or) {
            return renderChildren("or", or.children());
        }
        if (node instanceof QueryNode.Not not) {
            return "not(" + render(not.child()) + ")";
        }
        if (node instanceof QueryNode.Term term) {
            return "term(" + term.value() + ")";
        }
        if (node instanceof QueryNode.Phrase phrase) {
            return "phrase(\"" + phrase.value() + "\")";
        }
        if (node instanceof QueryNode.PrefixFilter filter) {
            String value = filter.exact() ? "\"" + filter.value() + "\"" : filter.value();
            return filter.field().keyword() + "(" + value + ")";
        }
        if (node instanceof QueryNode.RangeFilter range) {
            return range.field().keyword() + "(" + range.start() + ".." + range.end() + ")";
        }
        if (node instanceof QueryNode.PropertyFilter property) {
            return "property(" + (property.exact() ? "=" : "") + property.expression() + ")";
        }
        throw new IllegalStateException("未知节点类型: " + node);
    }

    private static String renderChildren(String name, List<QueryNode> children) {
        StringJoiner joiner = new StringJoiner(", ", name + "(", ")");
        for (QueryNode child : children) {
            joiner.add(render(child));
        }
        return joiner.toString();
    }
}
