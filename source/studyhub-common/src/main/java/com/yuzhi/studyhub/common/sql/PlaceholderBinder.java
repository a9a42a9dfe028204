package com.yuzhi.studyhub.common.sql;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Renders {@code $N} statement templates into JDBC statements.
 * <p>
 * JDBC markers are anonymous and strictly ordered, while templates reference parameters by
 * 1-based position and may reuse or reorder them ({@code $1} for a cutoff used three times,
 * sample arrays referenced before later study ids). Every {@code $N} becomes a {@code ?} and
 * contributes {@code params[N-1]} to the bind list in text order. Quoted literals and
 * identifiers are copied untouched.
 * <p>
 * The template and the parameter list must agree exactly: every parameter referenced at least
 * once, no reference past the end of the list.
 */
public final class PlaceholderBinder {

    private PlaceholderBinder() {}

    public static BoundStatement bind(String template, List<?> params) {
        if (template == null) {
            throw new IllegalArgumentException("template must not be null");
        }
        List<?> values = params == null ? List.of() : params;
        StringBuilder sql = new StringBuilder(template.length());
        List<Object> bindValues = new ArrayList<>();
        BitSet referenced = new BitSet(values.size() + 1);

        int i = 0;
        int length = template.length();
        while (i < length) {
            char c = template.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(template, i, c);
                sql.append(template, i, end);
                i = end;
                continue;
            }
            if (c == '$' && i + 1 < length && Character.isDigit(template.charAt(i + 1))) {
                int j = i + 1;
                while (j < length && Character.isDigit(template.charAt(j))) {
                    j++;
                }
                int index = Integer.parseInt(template.substring(i + 1, j));
                if (index < 1 || index > values.size()) {
                    throw new IllegalStateException("Placeholder $" + index + " has no parameter (" + values.size() + " supplied)");
                }
                referenced.set(index);
                bindValues.add(values.get(index - 1));
                sql.append('?');
                i = j;
                continue;
            }
            sql.append(c);
            i++;
        }

        if (referenced.cardinality() != values.size()) {
            throw new IllegalStateException(
                "Statement references " + referenced.cardinality() + " distinct placeholder(s) but " + values.size() + " parameter(s) were supplied"
            );
        }
        return new BoundStatement(sql.toString(), bindValues);
    }

    private static int skipQuoted(String template, int start, char quote) {
        int i = start + 1;
        while (i < template.length()) {
            if (template.charAt(i) == quote) {
                if (i + 1 < template.length() && template.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return template.length();
    }
}
