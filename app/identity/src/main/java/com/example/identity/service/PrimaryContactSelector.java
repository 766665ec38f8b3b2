/*
 * どこで: Identity サービス層
 * 何を: グループ内の primary を選び、不変条件違反時は最古レコードへフォールバックする
 * なぜ: 想定外データでも解決処理を止めず、異常としてログ/メトリクスへ残すため
 */
package com.example.identity.service;

import com.example.identity.model.ContactRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PrimaryContactSelector {

  static final String ANOMALY_PRIMARY_MISSING = "primary_missing";
  static final String ANOMALY_MULTIPLE_PRIMARIES = "multiple_primaries";

  private static final Logger logger = LoggerFactory.getLogger(PrimaryContactSelector.class);

  private final IdentityMetrics metrics;

  /**
   * 役割: 1 グループ分のメンバーから primary を返す。 動作: primary がちょうど 1 件ならそれを返し、0 件または複数件なら作成順で最古のレコードを返す。
   * 前提: members は空でないこと。
   */
  public ContactRecord selectPrimary(List<ContactRecord> members) {
    if (members.isEmpty()) {
      throw new IllegalStateException("members must not be empty");
    }
    final List<ContactRecord> primaries =
        members.stream().filter(ContactRecord::isPrimary).toList();
    if (primaries.size() == 1) {
      return primaries.get(0);
    }
    final ContactRecord earliest =
        members.stream().min(ContactRecord.CREATION_ORDER).orElseThrow();
    final String kind =
        primaries.isEmpty() ? ANOMALY_PRIMARY_MISSING : ANOMALY_MULTIPLE_PRIMARIES;
    reportAnomaly(kind, members, earliest);
    return earliest;
  }

  /** 明示的な primary が見つからず最古レコードを代用したことを記録する。 */
  public void reportFallback(List<ContactRecord> members, ContactRecord fallback) {
    reportAnomaly(ANOMALY_PRIMARY_MISSING, members, fallback);
  }

  private void reportAnomaly(String kind, List<ContactRecord> members, ContactRecord fallback) {
    logger.warn(
        "contact group invariant violated: kind={} memberIds={} fallbackPrimaryId={}",
        kind,
        members.stream().map(ContactRecord::id).toList(),
        fallback.id());
    metrics.recordAnomaly(kind);
  }
}
