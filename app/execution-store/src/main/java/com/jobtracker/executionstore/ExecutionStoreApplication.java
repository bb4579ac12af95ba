/*
 * どこで: Execution store アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 単体起動時にスキーマ移行を適用し、ホストプロセスには同じ構成を組み込めるようにするため
 */
package com.jobtracker.executionstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// 接続プールは TrackerDatabase が所有するため、Boot の DataSource 自動構成は使わない
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class ExecutionStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExecutionStoreApplication.class, args);
    }
}
