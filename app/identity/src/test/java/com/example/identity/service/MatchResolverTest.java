package com.example.identity.service;

import static com.example.identity.service.ContactFixtures.primary;
import static com.example.identity.service.ContactFixtures.secondary;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.identity.model.ContactObservation;
import com.example.identity.model.ContactRecord;
import com.example.identity.repository.ContactRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MatchResolverTest {

  @Mock private ContactRepository contactRepository;

  private SimpleMeterRegistry registry;
  private MatchResolver resolver;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    resolver = new MatchResolver(contactRepository, new IdentityMetrics(registry));
  }

  @Test
  void returnsNoMatchWithoutGroupLookupWhenNothingMatches() {
    when(contactRepository.findByMatch("a@x.com", null)).thenReturn(List.of());

    final CandidateGroups groups =
        resolver.findCandidateGroups(new ContactObservation("a@x.com", null));

    assertThat(groups.isNoMatch()).isTrue();
    verify(contactRepository, never()).findByGroupIds(anyCollection());
  }

  @Test
  @SuppressWarnings("unchecked")
  void expandsMatchesToTheirWholeGroupsInCreationOrder() {
    final ContactRecord emailMatch = secondary(4, "a@x.com", "444", 1, 30);
    final ContactRecord phoneMatch = primary(2, "b@x.com", "222", 10);
    when(contactRepository.findByMatch("a@x.com", "222"))
        .thenReturn(List.of(phoneMatch, emailMatch));
    when(contactRepository.findByGroupIds(any()))
        .thenReturn(
            List.of(
                primary(1, "z@x.com", "111", 0),
                phoneMatch,
                secondary(3, null, "222", 2, 20),
                emailMatch));

    final CandidateGroups groups =
        resolver.findCandidateGroups(new ContactObservation("a@x.com", "222"));

    final ArgumentCaptor<Collection<Long>> idsCaptor = ArgumentCaptor.forClass(Collection.class);
    verify(contactRepository).findByGroupIds(idsCaptor.capture());
    assertThat(idsCaptor.getValue()).containsExactlyInAnyOrder(1L, 2L);
    assertThat(groups.records()).extracting(ContactRecord::id).containsExactly(1L, 2L, 3L, 4L);
    assertThat(groups.groupIds()).containsExactly(1L, 2L);
    assertThat(registry.find(IdentityMetrics.METRIC_ANOMALY_TOTAL).counter()).isNull();
  }

  @Test
  void keepsMatchedRecordEvenIfGroupLookupNoLongerSeesIt() {
    final ContactRecord match = primary(1, "a@x.com", null, 0);
    when(contactRepository.findByMatch("a@x.com", null)).thenReturn(List.of(match));
    when(contactRepository.findByGroupIds(any())).thenReturn(List.of());

    final CandidateGroups groups =
        resolver.findCandidateGroups(new ContactObservation("a@x.com", null));

    assertThat(groups.records()).containsExactly(match);
  }

  @Test
  void reportsAnomalyWhenMoreThanTwoGroupsMatch() {
    final List<ContactRecord> matched =
        List.of(
            primary(1, "a@x.com", null, 0),
            primary(2, "a@x.com", null, 1),
            primary(3, null, "222", 2));
    when(contactRepository.findByMatch("a@x.com", "222")).thenReturn(matched);
    when(contactRepository.findByGroupIds(any())).thenReturn(matched);

    final CandidateGroups groups =
        resolver.findCandidateGroups(new ContactObservation("a@x.com", "222"));

    assertThat(groups.groupIds()).hasSize(3);
    assertThat(
            registry
                .get(IdentityMetrics.METRIC_ANOMALY_TOTAL)
                .tag("kind", MatchResolver.ANOMALY_TOO_MANY_GROUPS)
                .counter()
                .count())
        .isEqualTo(1.0d);
  }
}
