/*
 * どこで: Common 型変換
 * 何を: 構造化ドキュメント(JsonNode)と正規化テキストを相互変換する
 * なぜ: 実行コンテキストを JSON 列に保存し、読み出し時に壊れたデータを検出するため
 */
package com.jobtracker.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;

public class JsonDocumentCodec implements Codec<JsonNode, String> {

  private final ObjectMapper objectMapper;

  public JsonDocumentCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public String encode(JsonNode value) {
    if (value == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize document", ex);
    }
  }

  @Override
  public JsonNode decode(String stored) {
    if (stored == null) {
      return null;
    }
    final JsonNode document;
    try {
      document = objectMapper.readTree(stored);
    } catch (JsonProcessingException ex) {
      throw new CorruptDocumentException("stored document is not well-formed JSON", ex);
    }
    // readTree は空文字列に MissingNode を返すため、既定値として扱わず破損とみなす
    if (document == null || document.isMissingNode()) {
      throw new CorruptDocumentException("stored document is empty", null);
    }
    return document;
  }
}
