package com.taskquery.query;

import com.taskquery.config.Constants;

/**
 * 词法 token 类型及其 Pratt 绑定力。
 */
public enum TokenType {
    WORD,
    PHRASE,
    AND(Constants.AND_BINDING_POWER),
    OR(Constants.OR_BINDING_POWER),
    NOT(Constants.NOT_BINDING_POWER),
    RANGE,
    LPAREN,
    RPAREN,
    PREFIX,
    PREFIX_VALUE,
    PREFIX_VALUE_QUOTED,
    PROPERTY;

    private final int bindingPower;

    TokenType() {
        this(Constants.DEFAULT_BINDING_POWER);
    }

    TokenType(int bindingPower) {
        this.bindingPower = bindingPower;
    }

    public int bindingPower() {
        return bindingPower;
    }
}
