/*
 * どこで: Identity サービス層
 * 何を: 観測を新規 primary / 既知 / secondary 追加 / グループ統合のいずれかとして確定する
 * なぜ: contacts を変更する経路をここに集約し、不変条件の維持箇所を一つにするため
 */
package com.example.identity.service;

import com.example.identity.model.ContactObservation;
import com.example.identity.model.ContactRecord;
import com.example.identity.model.LinkPrecedence;
import com.example.identity.repository.ContactRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ContactLinker {

  private static final Logger logger = LoggerFactory.getLogger(ContactLinker.class);

  private final ContactRepository contactRepository;
  private final ContactMergeExecutor mergeExecutor;
  private final PrimaryContactSelector primarySelector;
  private final Clock clock;

  /**
   * 役割: MatchResolver の結果に対して必要な変更を適用し、影響したグループの最新メンバーを返す。
   *
   * <p>判定順: 一致なし → 完全一致 (変更なし) → email と phoneNumber が別グループ (統合) → 既存グループへ追加。
   */
  public LinkOutcome link(ContactObservation observation, CandidateGroups candidates) {
    if (candidates.isNoMatch()) {
      final ContactRecord created =
          contactRepository.insert(
              observation.email(),
              observation.phoneNumber(),
              null,
              LinkPrecedence.PRIMARY,
              Instant.now(clock));
      logger.info("created primary contact: contactId={}", created.id());
      return new LinkOutcome(LinkAction.CREATED_PRIMARY, List.of(created));
    }

    final Optional<ContactRecord> duplicate = candidates.findExactDuplicate(observation);
    if (duplicate.isPresent()) {
      return new LinkOutcome(
          LinkAction.ALREADY_KNOWN, candidates.membersOf(duplicate.get().groupId()));
    }

    final Optional<MergePair> mergePair = findMergePair(observation, candidates);
    if (mergePair.isPresent()) {
      return mergeExecutor.merge(observation, mergePair.get().older(), mergePair.get().newer());
    }

    return attachSecondary(observation, candidates);
  }

  private Optional<MergePair> findMergePair(
      ContactObservation observation, CandidateGroups candidates) {
    if (!observation.hasBoth()) {
      return Optional.empty();
    }
    final Optional<ContactRecord> emailContact = candidates.firstWithEmail(observation.email());
    final Optional<ContactRecord> phoneContact =
        candidates.firstWithPhoneNumber(observation.phoneNumber());
    if (emailContact.isEmpty() || phoneContact.isEmpty()) {
      return Optional.empty();
    }
    final long emailGroupId = emailContact.get().groupId();
    final long phoneGroupId = phoneContact.get().groupId();
    if (emailGroupId == phoneGroupId) {
      return Optional.empty();
    }

    final GroupHead emailHead = groupHead(candidates, emailGroupId);
    final GroupHead phoneHead = groupHead(candidates, phoneGroupId);
    // createdAt が古い方 (同時刻なら id が小さい方) を primary として残す
    if (emailHead.primary().isOlderThan(phoneHead.primary())) {
      return Optional.of(new MergePair(emailHead, phoneHead));
    }
    return Optional.of(new MergePair(phoneHead, emailHead));
  }

  private GroupHead groupHead(CandidateGroups candidates, long groupId) {
    final Optional<ContactRecord> primary =
        candidates.findById(groupId).filter(ContactRecord::isPrimary);
    return new GroupHead(
        groupId,
        primary.orElseGet(() -> primarySelector.selectPrimary(candidates.membersOf(groupId))));
  }

  private LinkOutcome attachSecondary(ContactObservation observation, CandidateGroups candidates) {
    final ContactRecord primary =
        candidates
            .firstPrimary()
            .orElseGet(
                () -> {
                  final ContactRecord fallback = candidates.earliest();
                  primarySelector.reportFallback(candidates.records(), fallback);
                  return fallback;
                });

    // 代用 primary の場合もグループ本来の id へリンクし、リンクの深さを 1 に保つ
    final long groupId = primary.groupId();
    final ContactRecord created =
        contactRepository.insert(
            observation.email(),
            observation.phoneNumber(),
            groupId,
            LinkPrecedence.SECONDARY,
            Instant.now(clock));
    logger.info(
        "attached secondary contact: contactId={} primaryContactId={} groupId={}",
        created.id(),
        primary.id(),
        groupId);

    final List<ContactRecord> members = new ArrayList<>(candidates.membersOf(groupId));
    members.add(created);
    members.sort(ContactRecord.CREATION_ORDER);
    return new LinkOutcome(LinkAction.ATTACHED_SECONDARY, members);
  }

  private record MergePair(GroupHead older, GroupHead newer) {}
}
