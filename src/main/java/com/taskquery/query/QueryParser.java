package com.taskquery.query;

import com.taskquery.config.Constants;

import java.util.List;

/**
 * Pratt（运算符优先级）解析器。
 *
 * 绑定力：NOT 100，AND 80，OR 60，其余 50。相邻原子之间是隐式 AND，
 * 表达式中间出现的 "-x" 解析为 and(左侧, not(x))。
 * 实例持有解析状态，不可跨线程共享。
 */
public class QueryParser {
    private static final String RANGE_MISUSE = "Range operator can only be used with scheduled: or deadline: prefixes";

    private List<LexToken> tokens;
    private int pos;

    /**
     * 对查询字符串做词法分析并解析为 AST。
     */
    public QueryNode parse(String query) {
        try {
            return parse(new QueryLexer().tokenize(query));
        } catch (QueryParseException parseException) {
            throw parseException.withQuery(query);
        }
    }

    /**
     * 将 token 序列解析为 AST。
     */
    public QueryNode parse(List<LexToken> tokenList) {
        this.tokens = List.copyOf(tokenList);
        this.pos = 0;

        QueryNode ast = parseExpression(0);
        if (hasMore()) {
            LexToken extra = current();
            if (extra.type() == TokenType.RPAREN) {
                throw new QueryParseException("Unmatched closing parenthesis", extra.position());
            }
            throw new QueryParseException("Unexpected token: " + extra.originalText(), extra.position());
        }
        return ast;
    }

    /**
     * 优先级爬升主循环：后续 token 的绑定力高于 minBindingPower 时继续结合。
     */
    private QueryNode parseExpression(int minBindingPower) {
        QueryNode left = parsePrefix();

        while (hasMore()) {
            LexToken token = current();
            if (token.type() == TokenType.RPAREN || token.type().bindingPower() <= minBindingPower) {
                break;
            }

            switch (token.type()) {
                case NOT -> {
                    advance();
                    QueryNode negated = parseNegatedOperand();
                    left = new QueryNode.And(left, new QueryNode.Not(negated));
                }
                case AND -> {
                    advance();
                    left = new QueryNode.And(left, parseExpression(Constants.AND_BINDING_POWER - 1));
                }
                case OR -> {
                    advance();
                    left = new QueryNode.Or(left, parseExpression(Constants.OR_BINDING_POWER - 1));
                }
                case WORD, PHRASE, PREFIX, PROPERTY, LPAREN -> left = joinImplicit(left, parsePrefix());
                case RANGE -> throw new QueryParseException(RANGE_MISUSE, token.position());
                default -> throw new QueryParseException("Unexpected token: " + token.originalText(), token.position());
            }
        }
        return left;
    }

    /**
     * 解析原子或前缀运算符：-x、括号分组、前缀过滤、属性过滤、词项、短语。
     */
    private QueryNode parsePrefix() {
        if (!hasMore()) {
            throw new QueryParseException("Unexpected end of expression", endPosition());
        }

        LexToken token = current();
        if (token.type() == TokenType.NOT) {
            advance();
            return new QueryNode.Not(parseNegatedOperand());
        }
        if (token.type() == TokenType.LPAREN) {
            return parseGroup();
        }
        if (token.type() == TokenType.PREFIX) {
            return parsePrefixFilter();
        }
        if (token.type() == TokenType.PROPERTY) {
            return parsePropertyFilter();
        }
        if (token.type() == TokenType.WORD) {
            advance();
            return new QueryNode.Term(token.value());
        }
        if (token.type() == TokenType.PHRASE) {
            advance();
            return new QueryNode.Phrase(token.value());
        }
        throw new QueryParseException("Unexpected token: " + token.originalText(), token.position());
    }

    /**
     * NOT 的操作数以 NOT 绑定力减一解析，后续的 "-x" 会并入操作数："a -b -c" 即 and(a, not(and(b, not(c))))。
     */
    private QueryNode parseNegatedOperand() {
        return parseExpression(Constants.NOT_BINDING_POWER - 1);
    }

    /**
     * 括号内以绑定力 0 重新开始，接受任意运算符。
     */
    private QueryNode parseGroup() {
        advance();
        QueryNode grouped = parseExpression(0);
        expect(TokenType.RPAREN, "Expected closing parenthesis");
        return grouped;
    }

    private QueryNode parsePrefixFilter() {
        LexToken prefixToken = advance();
        FilterField field = FilterField.fromKeyword(prefixToken.value())
                .orElseThrow(() -> new QueryParseException(
                        "Unknown prefix: " + prefixToken.originalText(), prefixToken.position()));

        if (!hasMore()) {
            throw new QueryParseException("Expected value after prefix " + prefixToken.originalText(), prefixToken.end());
        }
        LexToken valueToken = current();
        if (!isValueToken(valueToken.type())) {
            throw new QueryParseException("Expected prefix value, got " + valueToken.originalText(), valueToken.position());
        }
        advance();

        if (hasMore() && current().type() == TokenType.RANGE) {
            return parseRange(field, valueToken);
        }
        boolean exact = valueToken.type() == TokenType.PHRASE || valueToken.type() == TokenType.PREFIX_VALUE_QUOTED;
        return new QueryNode.PrefixFilter(field, valueToken.value(), exact);
    }

    /**
     * 解析 start..end，只允许日期字段。
     */
    private QueryNode parseRange(FilterField field, LexToken startToken) {
        LexToken rangeToken = advance();
        if (!field.isDateField()) {
            throw new QueryParseException(RANGE_MISUSE, rangeToken.position());
        }
        if (!hasMore()) {
            throw new QueryParseException("Expected date value after range operator", rangeToken.end());
        }
        LexToken endToken = current();
        if (!isValueToken(endToken.type())) {
            throw new QueryParseException(
                    "Expected date value after range operator, got " + endToken.originalText(), endToken.position());
        }
        advance();
        return new QueryNode.RangeFilter(field, startToken.value(), endToken.value());
    }

    private QueryNode parsePropertyFilter() {
        LexToken token = advance();
        PropertyExpression expression = PropertyExpression.parse(token.originalText())
                .orElseThrow(() -> new QueryParseException(
                        "Invalid property expression: " + token.originalText(), token.position()));
        return new QueryNode.PropertyFilter(expression.key(), expression.value(), expression.exact());
    }

    /**
     * 隐式 AND：左侧已是 AND 时直接追加，保持扁平。
     */
    private QueryNode joinImplicit(QueryNode left, QueryNode right) {
        if (left instanceof QueryNode.And conjunction) {
            return conjunction.append(right);
        }
        return new QueryNode.And(left, right);
    }

    private static boolean isValueToken(TokenType type) {
        return type == TokenType.PREFIX_VALUE
                || type == TokenType.PREFIX_VALUE_QUOTED
                || type == TokenType.WORD
                || type == TokenType.PHRASE;
    }

    private boolean hasMore() {
        return pos < tokens.size();
    }

    private LexToken current() {
        return tokens.get(pos);
    }

    private LexToken advance() {
        return tokens.get(pos++);
    }

    /**
     * 断言当前 token 类型符合预期，否则抛出带位置的语法错误。
     */
    private void expect(TokenType type, String message) {
        if (!hasMore() || current().type() != type) {
            throw new QueryParseException(message, hasMore() ? current().position() : endPosition());
        }
        advance();
    }

    private int endPosition() {
        return tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).end();
    }
}
