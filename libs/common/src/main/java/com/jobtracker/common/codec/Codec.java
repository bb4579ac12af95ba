/*
 * どこで: Common 型変換
 * 何を: ドメイン型と保存型の双方向変換を定義する
 * なぜ: 変換を暗黙の解決に頼らず、値として明示的に受け渡すため
 */
package com.jobtracker.common.codec;

/**
 * Encode/decode pair between a domain type and its storage representation.
 *
 * @param <D> domain type
 * @param <S> storage type
 */
public interface Codec<D, S> {

  S encode(D value);

  D decode(S stored);
}
