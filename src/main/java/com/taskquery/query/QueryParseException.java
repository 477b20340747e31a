package com.taskquery.query;

/**
 * 查询语法错误，携带出错位置。
 */
public class QueryParseException extends RuntimeException {
    private final int position;
    private final String queryString;

    public QueryParseException(String message, int position) {
        this(message, position, null);
    }

    public QueryParseException(String message, int position, String queryString) {
        super(message);
        this.position = position;
        this.queryString = queryString;
    }

    public int getPosition() {
        return position;
    }

    /** 出错的查询原文，仅由 token 序列解析时为 null */
    public String getQueryString() {
        return queryString;
    }

    /**
     * 关联查询原文，供上层在只有 token 的解析错误上补充上下文。
     */
    public QueryParseException withQuery(String query) {
        if (queryString != null || query == null) {
            return this;
        }
        QueryParseException located = new QueryParseException(getMessage(), position, query);
        located.setStackTrace(getStackTrace());
        return located;
    }

    /**
     * 多行描述：错误信息、查询原文以及指向出错位置的 ^。
     */
    public String describe() {
        String header = "Parse error at position " + position + ": " + getMessage();
        if (queryString == null) {
            return header;
        }
        int caretPos = Math.max(0, Math.min(position, queryString.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return header + System.lineSeparator() + queryString + System.lineSeparator() + pointer;
    }

    public String getSuggestion() {
        if (queryString == null || queryString.isBlank()) {
            return "请输入非空查询";
        }
        String message = getMessage();
        if (message.startsWith("Unexpected end")) {
            return "查询在运算符或前缀后提前结束，请补全右侧的条件";
        }
        if (message.contains("parenthesis")) {
            return "请检查括号是否成对出现";
        }
        if (message.startsWith("Range operator")) {
            return "范围 .. 只能用于 scheduled: 或 deadline:，例如 scheduled:2024-01-01..2024-01-31";
        }
        return "请检查该位置附近的语法，例如括号、引号或布尔运算符";
    }
}
