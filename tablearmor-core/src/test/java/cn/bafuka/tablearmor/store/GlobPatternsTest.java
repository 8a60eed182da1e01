package cn.bafuka.tablearmor.store;

import org.junit.Test;

import java.util.regex.Pattern;

import static org.junit.Assert.*;

/**
 * GlobPatterns 单元测试
 */
public class GlobPatternsTest {

    @Test
    public void testToRegex() {
        Pattern pattern = GlobPatterns.toRegex("Users_*_v?");

        assertTrue(pattern.matcher("Users_GetAll_v1").matches());
        assertTrue(pattern.matcher("Users__v2").matches());
        assertFalse(pattern.matcher("Users_GetAll_v10").matches());
        assertFalse(pattern.matcher("users_GetAll_v1").matches());
    }

    /**
     * 正则元字符按字面量处理
     */
    @Test
    public void testRegexMetaCharactersAreLiteral() {
        Pattern pattern = GlobPatterns.toRegex("a.b+(c)*");

        assertTrue(pattern.matcher("a.b+(c)").matches());
        assertTrue(pattern.matcher("a.b+(c)xyz").matches());
        assertFalse(pattern.matcher("aXb+(c)").matches());
    }

    @Test
    public void testToRedisPatternEscapesBrackets() {
        assertEquals("a\\[1\\]*", GlobPatterns.toRedisPattern("a[1]*"));
        assertEquals("Users_*", GlobPatterns.toRedisPattern("Users_*"));
    }
}
