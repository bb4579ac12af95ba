/*
 * どこで: Execution store の設定バインド
 * 何を: MySQL 接続先と接続プールの設定を保持する
 * なぜ: 必須項目の欠落を起動時に検知し、プールを上限付きで構成するため
 */
package com.jobtracker.executionstore.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.OptionalInt;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tracker.database")
public record DatabaseProperties(
    @DefaultValue("localhost") @NotBlank String host,
    @DefaultValue("3306") String port,
    @NotBlank String database,
    @NotBlank String user,
    @NotBlank String password,
    @DefaultValue @Valid Pool pool) {

  public static final int DEFAULT_PORT = 3306;

  private static final String JDBC_URL_TEMPLATE =
      "jdbc:mysql://%s:%d/%s?connectionTimeZone=UTC&useSSL=false";

  /** The configured port, or {@value #DEFAULT_PORT} when it is not a usable TCP port number. */
  public int resolvedPort() {
    return parsedPort().orElse(DEFAULT_PORT);
  }

  public boolean hasValidPort() {
    return parsedPort().isPresent();
  }

  private OptionalInt parsedPort() {
    if (port == null) {
      return OptionalInt.empty();
    }
    try {
      final int parsed = Integer.parseInt(port.trim());
      return parsed >= 1 && parsed <= 65535 ? OptionalInt.of(parsed) : OptionalInt.empty();
    } catch (NumberFormatException ex) {
      // 数値でない MYSQL_PORT は既定ポートで接続する
      return OptionalInt.empty();
    }
  }

  public String jdbcUrl() {
    return JDBC_URL_TEMPLATE.formatted(host, resolvedPort(), database);
  }

  public record Pool(
      // 移行中はロック保持用とトランザクション用に 2 本を同時に使う
      @DefaultValue("10") @Min(2) int maximumPoolSize,
      @DefaultValue("2") @Min(0) int minimumIdle,
      @DefaultValue("30s") @NotNull Duration connectionTimeout,
      @DefaultValue("30s") @NotNull Duration queryTimeout,
      @DefaultValue("60s") @NotNull Duration migrationLockTimeout) {}
}
