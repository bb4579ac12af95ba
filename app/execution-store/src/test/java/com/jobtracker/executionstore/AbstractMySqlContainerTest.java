/*
 * どこで: Execution store テスト基盤
 * 何を: Testcontainers(MySQL) と tracker.database の共通設定を提供する
 * なぜ: テストごとの重複設定を削減し、本番と同じ MySQL で検証するため
 */
package com.jobtracker.executionstore;

import com.jobtracker.executionstore.config.DatabaseProperties;
import java.time.Duration;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractMySqlContainerTest {

  // JVM 内のテスト全体で共通の MySQL コンテナを使い回し、起動コストを抑える
  protected static final MySQLContainer<?> MYSQL = new MySQLContainer<>("mysql:8.0");

  static {
    // @DynamicPropertySource が拡張より先に動く場合に備えて明示起動する。Docker が無い環境ではクラスごとスキップされる
    if (DockerClientFactory.instance().isDockerAvailable()) {
      MYSQL.start();
    }
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("tracker.database.host", MYSQL::getHost);
    registry.add("tracker.database.port", () -> MYSQL.getMappedPort(MySQLContainer.MYSQL_PORT));
    registry.add("tracker.database.database", MYSQL::getDatabaseName);
    registry.add("tracker.database.user", MYSQL::getUsername);
    registry.add("tracker.database.password", MYSQL::getPassword);
  }

  protected static DatabaseProperties containerProperties() {
    return new DatabaseProperties(
        MYSQL.getHost(),
        String.valueOf(MYSQL.getMappedPort(MySQLContainer.MYSQL_PORT)),
        MYSQL.getDatabaseName(),
        MYSQL.getUsername(),
        MYSQL.getPassword(),
        new DatabaseProperties.Pool(
            2, 1, Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(10)));
  }
}
