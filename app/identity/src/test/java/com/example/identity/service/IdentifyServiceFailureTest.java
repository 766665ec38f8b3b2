package com.example.identity.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.identity.api.InvalidObservationException;
import com.example.identity.api.request.IdentifyRequest;
import com.example.identity.config.IdentityRequestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class IdentifyServiceFailureTest {

  @Mock private MatchResolver matchResolver;
  @Mock private ContactLinker contactLinker;
  @Mock private ContactViewConsolidator viewConsolidator;

  private SimpleMeterRegistry registry;
  private IdentifyService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new IdentifyService(
            matchResolver,
            contactLinker,
            viewConsolidator,
            new IdentityMetrics(registry),
            new IdentityRequestProperties(null, 8, false));
  }

  @Test
  void storeFailurePropagatesAndIsCounted() {
    when(matchResolver.findCandidateGroups(any()))
        .thenThrow(new QueryTimeoutException("statement timeout"));

    assertThatThrownBy(() -> service.identify(new IdentifyRequest("a@x.com", null)))
        .isInstanceOf(QueryTimeoutException.class);
    assertThat(
            registry
                .get(IdentityMetrics.METRIC_IDENTIFY_TOTAL)
                .tag("outcome", IdentityMetrics.OUTCOME_FAILED)
                .counter()
                .count())
        .isEqualTo(1.0d);
    verifyNoInteractions(contactLinker, viewConsolidator);
  }

  @Test
  void appliesConfiguredPhoneNumberLimit() {
    assertThatThrownBy(() -> service.identify(new IdentifyRequest(null, "123456789")))
        .isInstanceOf(InvalidObservationException.class)
        .hasMessage("phoneNumber must be at most 8 characters");
    verifyNoInteractions(matchResolver);
  }
}
