/*
 * どこで: Identity サービス層
 * 何を: 新しい側の primary の降格・secondary の付け替え・観測レコード作成を 1 トランザクションで行う
 * なぜ: 途中まで適用された統合 (降格済みだが secondary が旧 primary を指す等) を外から見せないため
 */
package com.example.identity.service;

import com.example.identity.api.ConcurrentContactUpdateException;
import com.example.identity.model.ContactObservation;
import com.example.identity.model.ContactRecord;
import com.example.identity.model.LinkPrecedence;
import com.example.identity.repository.ContactRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class ContactMergeExecutor {

  private static final Logger logger = LoggerFactory.getLogger(ContactMergeExecutor.class);

  private final ContactRepository contactRepository;
  private final IdentityMetrics metrics;
  private final Clock clock;

  /**
   * 役割: absorbed のグループを survivor のグループへ統合し、統合後の全メンバーを返す。
   *
   * <p>動作: 両グループの代表を行ロックしてから状態を再確認する。別リクエストが同じ統合を既に終えていれば付け替えを省略し、
   * それ以外の変化を検知した場合は {@link ConcurrentContactUpdateException} でロールバックする。
   *
   * <p>本来の primary が不可視なグループ ({@link GroupHead#isFallback()}) も統合できる。グループ id を基準に付け替えるため、
   * 代用された最古レコードを primary へ昇格させることはない。
   */
  @Transactional
  public LinkOutcome merge(ContactObservation observation, GroupHead survivor, GroupHead absorbed) {
    return metrics.recordMerge(() -> doMerge(observation, survivor, absorbed));
  }

  private LinkOutcome doMerge(
      ContactObservation observation, GroupHead survivor, GroupHead absorbed) {
    final long survivorGroupId = survivor.groupId();
    final long absorbedGroupId = absorbed.groupId();
    final long survivorHeadId = survivor.primary().id();
    final long absorbedHeadId = absorbed.primary().id();
    final List<ContactRecord> locked =
        contactRepository.lockByIds(List.of(survivorHeadId, absorbedHeadId));
    final ContactRecord lockedSurvivor = requireLocked(locked, survivorHeadId);
    final ContactRecord lockedAbsorbed = requireLocked(locked, absorbedHeadId);
    if (!hasSameLink(lockedSurvivor, survivor.primary())) {
      throw new ConcurrentContactUpdateException(
          "contact " + survivorHeadId + " is no longer the head of group " + survivorGroupId);
    }

    final Instant now = Instant.now(clock);
    if (!hasSameLink(lockedAbsorbed, absorbed.primary())) {
      if (lockedAbsorbed.groupId() != survivorGroupId) {
        throw new ConcurrentContactUpdateException(
            "contact " + absorbedHeadId + " was relinked by a concurrent request");
      }
      logger.info(
          "contact groups already merged by a concurrent request: groupId={} absorbedGroupId={}",
          survivorGroupId,
          absorbedGroupId);
    } else {
      if (!absorbed.isFallback()) {
        final int demoted =
            contactRepository.demoteToSecondary(absorbedHeadId, survivorGroupId, now);
        if (demoted != 1) {
          throw new ConcurrentContactUpdateException(
              "contact " + absorbedHeadId + " could not be demoted");
        }
      }
      // 代用 primary は absorbedGroupId へリンクしているため、ここで一緒に付け替わる
      final int relinked =
          contactRepository.relinkSecondaries(absorbedGroupId, survivorGroupId, now);
      logger.info(
          "merged contact groups: groupId={} primaryContactId={} absorbedGroupId={}"
              + " absorbedHeadId={} relinkedCount={} fallback={}",
          survivorGroupId,
          survivorHeadId,
          absorbedGroupId,
          absorbedHeadId,
          relinked,
          survivor.isFallback() || absorbed.isFallback());
    }

    final List<ContactRecord> members =
        new ArrayList<>(contactRepository.findByGroupIds(List.of(survivorGroupId)));
    // 統合後のメンバーで完全一致を再確認し、重複レコードを作らない
    final boolean alreadyKnown = members.stream().anyMatch(r -> r.hasSameContactData(observation));
    if (!alreadyKnown) {
      members.add(
          contactRepository.insert(
              observation.email(),
              observation.phoneNumber(),
              survivorGroupId,
              LinkPrecedence.SECONDARY,
              now));
      members.sort(ContactRecord.CREATION_ORDER);
    }
    return new LinkOutcome(LinkAction.MERGED, members);
  }

  private static boolean hasSameLink(ContactRecord current, ContactRecord observed) {
    return current.linkPrecedence() == observed.linkPrecedence()
        && Objects.equals(current.linkedId(), observed.linkedId());
  }

  private ContactRecord requireLocked(List<ContactRecord> locked, long contactId) {
    final Optional<ContactRecord> found =
        locked.stream().filter(r -> r.id() == contactId).findFirst();
    return found.orElseThrow(
        () ->
            new ConcurrentContactUpdateException(
                "contact " + contactId + " is no longer visible"));
  }
}
