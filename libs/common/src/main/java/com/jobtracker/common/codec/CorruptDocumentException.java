/*
 * どこで: Common 型変換
 * 何を: 保存済み JSON が解析できないことを表す例外を定義する
 * なぜ: 書き込み経路は整形式のみを保存するため、解析失敗は外部改変として扱うため
 */
package com.jobtracker.common.codec;

public class CorruptDocumentException extends RuntimeException {

  public CorruptDocumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
