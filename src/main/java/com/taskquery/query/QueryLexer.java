package com.taskquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class QueryLexer {
    private static final Pattern PHRASE_PATTERN = Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\"");
    private static final Pattern OR_PATTERN = Pattern.compile("\\bOR\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND_PATTERN = Pattern.compile("\\bAND\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PREFIX_PATTERN =
            Pattern.compile("\\b(path|file|tag|state|priority|content|scheduled|deadline):");
    private static final Pattern WORD_PATTERN = Pattern.compile("[^\\s\"()]+");
    private static final Pattern DASH_JOINED_WORD_PATTERN = Pattern.compile("[^\\s\"()-]+");

    /**
     * 将原始查询字符串切分为词法 token 序列。
     *
     * 不会抛出异常：无法识别的字符逐个跳过，null 视为空查询。
     */
    public List<LexToken> tokenize(String query) {
        List<LexToken> tokens = new ArrayList<>();
        if (query == null) {
            return tokens;
        }

        int index = 0;
        while (index < query.length()) {
            if (Character.isWhitespace(query.charAt(index))) {
                index++;
                continue;
            }

            LexToken previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            if (isPrefixValue(previous) && query.startsWith("..", index)) {
                tokens.add(new LexToken(TokenType.RANGE, "..", "..", index));
                index += 2;
                continue;
            }

            int nextIndex = readToken(query, index, previous, tokens);
            index = nextIndex > index ? nextIndex : index + 1;
        }
        return tokens;
    }

    /**
     * 按固定优先级尝试各类 token，返回下一个读取位置；未匹配时返回原位置。
     */
    private int readToken(String query, int index, LexToken previous, List<LexToken> tokens) {
        boolean afterPrefix = previous != null && previous.type() == TokenType.PREFIX;

        Matcher phrase = matchAt(PHRASE_PATTERN, query, index);
        if (phrase != null) {
            String original = phrase.group();
            String value = original.substring(1, original.length() - 1).replace("\\\"", "\"");
            TokenType type = afterPrefix ? TokenType.PREFIX_VALUE_QUOTED : TokenType.PHRASE;
            tokens.add(new LexToken(type, value, original, index));
            return phrase.end();
        }

        Matcher keyword = matchAt(OR_PATTERN, query, index);
        if (keyword != null) {
            return addKeyword(TokenType.OR, keyword, index, tokens);
        }
        keyword = matchAt(AND_PATTERN, query, index);
        if (keyword != null) {
            return addKeyword(TokenType.AND, keyword, index, tokens);
        }

        if (query.startsWith("..", index)) {
            tokens.add(new LexToken(TokenType.RANGE, "..", "..", index));
            return index + 2;
        }

        char currentChar = query.charAt(index);
        if (currentChar == '(') {
            tokens.add(new LexToken(TokenType.LPAREN, "(", "(", index));
            return index + 1;
        }
        if (currentChar == ')') {
            tokens.add(new LexToken(TokenType.RPAREN, ")", ")", index));
            return index + 1;
        }

        Matcher prefix = matchAt(PREFIX_PATTERN, query, index);
        if (prefix != null) {
            tokens.add(new LexToken(TokenType.PREFIX, prefix.group(1), prefix.group(), index));
            return prefix.end();
        }

        Matcher property = matchAt(PropertyExpression.BRACKET_PATTERN, query, index);
        if (property != null) {
            String canonical = PropertyExpression.fromMatch(property).canonical();
            tokens.add(new LexToken(TokenType.PROPERTY, canonical, property.group(), index));
            return property.end();
        }

        if (currentChar == '-') {
            return readDash(query, index, previous, tokens);
        }

        if (afterPrefix) {
            int rangeValueEnd = findRangeStart(query, index);
            if (rangeValueEnd > index) {
                String value = query.substring(index, rangeValueEnd);
                tokens.add(new LexToken(TokenType.PREFIX_VALUE, value, value, index));
                return rangeValueEnd;
            }
        }

        Matcher word = matchAt(WORD_PATTERN, query, index);
        if (word != null) {
            TokenType type = afterPrefix ? TokenType.PREFIX_VALUE : TokenType.WORD;
            tokens.add(new LexToken(type, word.group(), word.group(), index));
            return word.end();
        }
        return index;
    }

    private int addKeyword(TokenType type, Matcher keyword, int index, List<LexToken> tokens) {
        String original = keyword.group();
        tokens.add(new LexToken(type, original.toLowerCase(Locale.ROOT), original, index));
        return keyword.end();
    }

    /**
     * 紧贴在前缀值后的 "-word" 并入前缀值（state:in-progress），其余情况为 NOT。
     */
    private int readDash(String query, int index, LexToken previous, List<LexToken> tokens) {
        if (previous != null && previous.type() == TokenType.PREFIX_VALUE && previous.end() == index) {
            Matcher joined = matchAt(DASH_JOINED_WORD_PATTERN, query, index + 1);
            if (joined != null) {
                String suffix = "-" + joined.group();
                tokens.set(tokens.size() - 1, new LexToken(TokenType.PREFIX_VALUE,
                        previous.value() + suffix, previous.originalText() + suffix, previous.position()));
                return joined.end();
            }
        }
        tokens.add(new LexToken(TokenType.NOT, "-", "-", index));
        return index + 1;
    }

    /**
     * 在当前片段（到空白、引号或括号为止）内查找 ".."，返回其位置；不存在时返回 -1。
     */
    private int findRangeStart(String query, int index) {
        int segmentEnd = index;
        while (segmentEnd < query.length()) {
            char ch = query.charAt(segmentEnd);
            if (Character.isWhitespace(ch) || ch == '"' || ch == '(' || ch == ')') {
                break;
            }
            segmentEnd++;
        }
        int rangeStart = query.indexOf("..", index);
        return rangeStart >= 0 && rangeStart < segmentEnd ? rangeStart : -1;
    }

    private static boolean isPrefixValue(LexToken token) {
        return token != null
                && (token.type() == TokenType.PREFIX_VALUE || token.type() == TokenType.PREFIX_VALUE_QUOTED);
    }

    private static Matcher matchAt(Pattern pattern, String query, int index) {
        Matcher matcher = pattern.matcher(query);
        matcher.region(index, query.length());
        matcher.useTransparentBounds(true);
        return matcher.lookingAt() ? matcher : null;
    }
}
