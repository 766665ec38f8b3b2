/*
 * どこで: Identity サービス層
 * 何を: 観測に一致するレコードを探し、それらが属するグループ全体へ展開する
 * なぜ: Linker が既知/拡張/統合を判定するための材料を一度に揃えるため
 */
package com.example.identity.service;

import com.example.identity.model.ContactObservation;
import com.example.identity.model.ContactRecord;
import com.example.identity.repository.ContactRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MatchResolver {

  static final String ANOMALY_TOO_MANY_GROUPS = "candidate_groups_exceeded";

  // 一致条件は email と phoneNumber の 2 つだけなので、展開先も最大 2 グループ
  private static final int MAX_EXPECTED_GROUPS = 2;

  private static final Logger logger = LoggerFactory.getLogger(MatchResolver.class);

  private final ContactRepository contactRepository;
  private final IdentityMetrics metrics;

  public CandidateGroups findCandidateGroups(ContactObservation observation) {
    final List<ContactRecord> matched =
        contactRepository.findByMatch(observation.email(), observation.phoneNumber());
    if (matched.isEmpty()) {
      return CandidateGroups.noMatch();
    }

    final Set<Long> primaryIds = new LinkedHashSet<>();
    for (ContactRecord record : matched) {
      primaryIds.add(record.groupId());
    }
    if (primaryIds.size() > MAX_EXPECTED_GROUPS) {
      logger.warn(
          "observation matched more contact groups than expected: primaryIds={}", primaryIds);
      metrics.recordAnomaly(ANOMALY_TOO_MANY_GROUPS);
    }

    // 2 回の参照の間に一致レコードが不可視化されても、一致した事実は保持する
    final List<ContactRecord> records = new ArrayList<>(matched);
    records.addAll(contactRepository.findByGroupIds(primaryIds));
    return new CandidateGroups(records);
  }
}
