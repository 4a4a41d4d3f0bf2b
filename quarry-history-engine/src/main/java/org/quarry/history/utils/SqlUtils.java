package org.quarry.history.utils;

public final class SqlUtils {

    public static final String SELECT = "SELECT ";
    public static final String FROM = " FROM ";
    public static final String WHERE = " WHERE ";
    public static final String AND = "AND ";
    public static final String ORDER_BY = " ORDER BY ";
    public static final String LIMIT = " LIMIT ";
    public static final String OFFSET = " OFFSET ";
    public static final String COMMA = ", ";
    public static final String SPACE = " ";
    public static final char LIKE_ESCAPE = '\\';

    private SqlUtils() {
    }

    public static boolean isFirst(boolean first, StringBuilder sql) {
        if (!first) {
            sql.append(AND);
        } else {
            sql.append(WHERE);
            first = false;
        }
        return first;
    }

    public static void appendEqualsCriteria(String column, String param, StringBuilder sql) {
        sql.append(column).append(" = :").append(param).append(SPACE);
    }

    public static void appendStartsWithCriteria(String column, String param, StringBuilder sql) {
        sql.append(column).append(" LIKE :").append(param).append(" ESCAPE '").append(LIKE_ESCAPE).append("' ");
    }

    /**
     * LIKE pattern matching every value that starts with {@code prefix} literally.
     */
    public static String startsWithPattern(String prefix) {
        StringBuilder pattern = new StringBuilder(prefix.length() + 1);
        for (char c : prefix.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }
}
