/*
 * どこで: Execution store ドメインモデル
 * 何を: 適用済みスキーマ進化 1 件(schema_evolutions の 1 行)を表す
 * なぜ: 起動時の再開位置と適用履歴を確認するため
 */
package com.jobtracker.executionstore.model;

import java.time.LocalDateTime;

public record SchemaVersion(int version, LocalDateTime appliedAt) {}
