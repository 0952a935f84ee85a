package org.experiment.analysis.warehouse.compiler;

import java.util.LinkedHashMap;
import java.util.Map;

/** Ordered set of named CTEs rendered as a single {@code WITH} clause. */
class CommonTableExpressions {
  private final Map<String, String> expressions = new LinkedHashMap<>();

  boolean contains(String name) {
    return expressions.containsKey(name);
  }

  String get(String name) {
    return expressions.get(name);
  }

  CommonTableExpressions add(String name, String body) {
    if (expressions.containsKey(name)) {
      throw new IllegalStateException("Duplicate CTE " + name);
    }
    expressions.put(name, body);
    return this;
  }

  String render(String finalSelect) {
    if (expressions.isEmpty()) {
      return finalSelect;
    }
    StringBuilder sql = new StringBuilder("WITH\n");
    boolean first = true;
    for (Map.Entry<String, String> expression : expressions.entrySet()) {
      if (!first) {
        sql.append(",\n");
      }
      first = false;
      sql.append("  ")
          .append(expression.getKey())
          .append(" AS (\n")
          .append(indent(expression.getValue()))
          .append("\n  )");
    }
    return sql.append('\n').append(finalSelect).toString();
  }

  private static String indent(String body) {
    return "    " + body.replace("\n", "\n    ");
  }
}
