package br.edu.ifba.kgrag.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenUtilTest {

    @Test
    void testEmptyTextHasNoTokens() {
        assertEquals(0, TokenUtil.countTokens(null));
        assertEquals(0, TokenUtil.countTokens(""));
    }

    @Test
    void testCountsTokensWithEncoding() {
        int tokens = TokenUtil.countTokens("A binary search tree keeps keys in sorted order.");
        assertTrue(tokens > 5 && tokens < 20, "unexpected token count " + tokens);
    }

    @Test
    void testMixedScriptEstimate() {
        // 4 ideographs + 2 latin words * 1.3
        assertEquals(6, TokenUtil.estimateMixedScript("二叉树遍历 binary tree"));
        assertEquals(1, TokenUtil.estimateMixedScript("heap"));
    }
}
