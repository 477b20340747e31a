package com.taskquery.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.taskquery.query.TokenType;
import java.lang.reflect.Constructor;
import java.time.DayOfWeek;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals(50, Constants.AST_CACHE_CAPACITY);
        assertEquals(100, Constants.NOT_BINDING_POWER);
        assertEquals(80, Constants.AND_BINDING_POWER);
        assertEquals(60, Constants.OR_BINDING_POWER);
        assertEquals(50, Constants.DEFAULT_BINDING_POWER);
        assertEquals(DayOfWeek.MONDAY, Constants.DEFAULT_WEEK_START);
        assertEquals(1000, Constants.MAX_QUERY_LENGTH);
    }

    @Test
    void testTokenBindingPowers() {
        assertEquals(Constants.NOT_BINDING_POWER, TokenType.NOT.bindingPower());
        assertEquals(Constants.AND_BINDING_POWER, TokenType.AND.bindingPower());
        assertEquals(Constants.OR_BINDING_POWER, TokenType.OR.bindingPower());
        assertEquals(Constants.DEFAULT_BINDING_POWER, TokenType.WORD.bindingPower());
        assertEquals(Constants.DEFAULT_BINDING_POWER, TokenType.RANGE.bindingPower());
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
