/*
 * どこで: Identity サービス層
 * 何を: 入力検証 → 一致検索 → リンク確定 → 集約ビュー生成を 1 リクエスト単位で実行する
 * なぜ: 解決処理の入口を一つにし、結果と失敗を一貫して記録するため
 */
package com.example.identity.service;

import com.example.identity.api.InvalidObservationException;
import com.example.identity.api.request.IdentifyRequest;
import com.example.identity.api.response.ContactSummary;
import com.example.identity.api.response.IdentifyResponse;
import com.example.identity.config.IdentityRequestProperties;
import com.example.identity.model.ContactObservation;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdentifyService {

  private static final Logger logger = LoggerFactory.getLogger(IdentifyService.class);

  private final MatchResolver matchResolver;
  private final ContactLinker contactLinker;
  private final ContactViewConsolidator viewConsolidator;
  private final IdentityMetrics metrics;
  private final IdentityRequestProperties requestProperties;

  public IdentifyResponse identify(@NonNull IdentifyRequest request) {
    // 検証エラーはストアへ触れる前に確定させる
    final ContactObservation observation = toObservation(request);
    try {
      final CandidateGroups candidates = matchResolver.findCandidateGroups(observation);
      final LinkOutcome outcome = contactLinker.link(observation, candidates);
      final ContactSummary summary = viewConsolidator.consolidate(outcome.members());
      metrics.recordIdentify(outcome.action());
      logger.info(
          "identify resolved: action={} primaryContactId={} secondaryCount={}",
          outcome.action(),
          summary.primaryContactId(),
          summary.secondaryContactIds().size());
      return new IdentifyResponse(summary);
    } catch (RuntimeException ex) {
      metrics.recordIdentifyFailure();
      throw ex;
    }
  }

  private ContactObservation toObservation(IdentifyRequest request) {
    final String email =
        normalize(request.email(), "email", requestProperties.emailMaxLength());
    final String phoneNumber =
        normalize(request.phoneNumber(), "phoneNumber", requestProperties.phoneNumberMaxLength());
    if (email == null && phoneNumber == null) {
      throw new InvalidObservationException("Either email or phoneNumber must be provided");
    }
    return new ContactObservation(email, phoneNumber);
  }

  private String normalize(String value, String fieldName, int maxLength) {
    if (value == null || value.isBlank()) {
      return null;
    }
    final String normalized = requestProperties.trimInput() ? value.strip() : value;
    if (normalized.length() > maxLength) {
      throw new InvalidObservationException(
          fieldName + " must be at most " + maxLength + " characters");
    }
    return normalized;
  }
}
