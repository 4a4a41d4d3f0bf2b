package org.quarry.history.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlUtilsTest {

    @Test
    void isFirst_appendsWhereThenAnd() {
        StringBuilder sql = new StringBuilder("SELECT * FROM audit_log");
        boolean first = SqlUtils.isFirst(true, sql);
        SqlUtils.appendEqualsCriteria("session_id", "sessionId", sql);
        first = SqlUtils.isFirst(first, sql);
        SqlUtils.appendEqualsCriteria("source", "source", sql);

        assertFalse(first);
        assertEquals("SELECT * FROM audit_log WHERE session_id = :sessionId AND source = :source ", sql.toString());
    }

    @Test
    void appendStartsWithCriteria_declaresEscapeCharacter() {
        StringBuilder sql = new StringBuilder();
        SqlUtils.appendStartsWithCriteria("target_path", "targetPath", sql);

        assertEquals("target_path LIKE :targetPath ESCAPE '\\' ", sql.toString());
    }

    @Test
    void startsWithPattern_escapesWildcards() {
        assertEquals("weaves/intro%", SqlUtils.startsWithPattern("weaves/intro"));
        assertEquals("a\\_b\\%c\\\\d%", SqlUtils.startsWithPattern("a_b%c\\d"));
        assertEquals("%", SqlUtils.startsWithPattern(""));
    }
}
