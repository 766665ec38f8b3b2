/*
 * どこで: Identity Repository 層
 * 何を: contacts の参照/作成/リンク更新を抽象化する
 * なぜ: 解決ロジックをストレージ実装から切り離し、明示的に注入するため
 */
package com.example.identity.repository;

import com.example.identity.model.ContactRecord;
import com.example.identity.model.LinkPrecedence;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * 同一人物グループの永続化操作。
 *
 * <p>全ての参照は deleted_at が設定されたレコードを除外する。一覧系は作成順 (created_at, id) で返す。
 */
public interface ContactRepository {

  /**
   * 役割: email または phoneNumber が完全一致する可視レコードを返す。 前提: null の引数は条件に含めない。両方 null なら空を返す。
   */
  List<ContactRecord> findByMatch(String email, String phoneNumber);

  /** 役割: id または linkedId が primaryIds に含まれる可視レコード (= グループ全体) を返す。 */
  List<ContactRecord> findByGroupIds(Collection<Long> primaryIds);

  /**
   * 役割: 指定 id の可視レコードを行ロックして返す。 前提: 呼び出し側のトランザクション内で使うこと。ロック順は id 昇順。
   */
  List<ContactRecord> lockByIds(Collection<Long> ids);

  /** 役割: 新しいレコードを作成し、採番済みの行を返す。 */
  ContactRecord insert(
      String email,
      String phoneNumber,
      Long linkedId,
      LinkPrecedence linkPrecedence,
      Instant createdAt);

  /**
   * 役割: primary を secondary へ降格し primaryId へリンクする。 動作: 対象が primary でなければ更新せず 0 を返す。
   */
  int demoteToSecondary(long contactId, long primaryId, Instant updatedAt);

  /** 役割: fromPrimaryId にリンクしている secondary を toPrimaryId へ付け替え、更新件数を返す。 */
  int relinkSecondaries(long fromPrimaryId, long toPrimaryId, Instant updatedAt);
}
