package com.yuzhi.studyhub.common.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement ready for JDBC: {@code ?} markers in text order and one bind value per marker.
 */
public record BoundStatement(String sql, List<Object> bindValues) {
    public BoundStatement {
        bindValues = bindValues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindValues));
    }
}
