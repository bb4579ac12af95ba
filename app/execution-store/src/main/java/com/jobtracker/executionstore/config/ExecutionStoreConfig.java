/*
 * どこで: Execution store の Bean 定義
 * 何を: 移行済み DB ハンドルとそこから派生するテンプレート/コーデックを登録する
 * なぜ: ストアの生成をスキーマ移行の完了後に限定するため
 */
package com.jobtracker.executionstore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobtracker.common.codec.JsonDocumentCodec;
import com.jobtracker.executionstore.db.TrackerDatabase;
import com.jobtracker.executionstore.migration.SchemaEvolutions;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class ExecutionStoreConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // 移行失敗時はここで例外となり、コンテキスト起動自体が失敗する
  @Bean(destroyMethod = "close")
  public TrackerDatabase trackerDatabase(DatabaseProperties properties, Clock clock) {
    return TrackerDatabase.connect(properties, SchemaEvolutions.all(), clock);
  }

  @Bean
  public NamedParameterJdbcTemplate trackerJdbcTemplate(TrackerDatabase trackerDatabase) {
    return trackerDatabase.jdbcTemplate();
  }

  @Bean
  public TransactionTemplate trackerTransactionTemplate(TrackerDatabase trackerDatabase) {
    return trackerDatabase.transactionTemplate();
  }

  @Bean
  public JsonDocumentCodec jsonDocumentCodec(ObjectMapper objectMapper) {
    return new JsonDocumentCodec(objectMapper);
  }
}
