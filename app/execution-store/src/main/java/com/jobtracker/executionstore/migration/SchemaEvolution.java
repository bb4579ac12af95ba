/*
 * どこで: Execution store スキーマ移行
 * 何を: 1 つのスキーマ進化(順序付きの DDL 群)を不変な値として表す
 * なぜ: バージョン番号をリスト上の位置で決め、文字列連結で移行を組み立てないため
 */
package com.jobtracker.executionstore.migration;

import java.util.List;
import java.util.Objects;

/**
 * A released unit of schema change. Its version is its 1-based position in
 * {@link SchemaEvolutions#all()}.
 */
public record SchemaEvolution(String description, List<String> statements) {

  public SchemaEvolution {
    Objects.requireNonNull(description, "description");
    statements = List.copyOf(statements);
    if (statements.isEmpty()) {
      throw new IllegalArgumentException("schema evolution must have at least one statement");
    }
    for (String statement : statements) {
      if (statement.isBlank()) {
        throw new IllegalArgumentException("schema evolution statement must not be blank");
      }
    }
  }

  public static SchemaEvolution of(String description, String... statements) {
    return new SchemaEvolution(description, List.of(statements));
  }
}
