package com.taskquery.query;

/**
 * 词法 token。value 为解码后的值，originalText 为查询中的原文，position 为起始偏移。
 */
public record LexToken(TokenType type, String value, String originalText, int position) {

    /** 原文结束位置（不含） */
    public int end() {
        return position + originalText.length();
    }
}
