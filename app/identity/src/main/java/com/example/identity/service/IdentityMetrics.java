/*
 * どこで: Identity サービス層
 * 何を: 解決結果・不変条件の異常・merge 所要時間のメトリクス記録を集約する
 * なぜ: merge の頻度や想定外データの発生を運用で継続監視できるようにするため
 */
package com.example.identity.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IdentityMetrics {

  static final String METRIC_IDENTIFY_TOTAL = "identity.identify.total";
  static final String METRIC_ANOMALY_TOTAL = "identity.anomaly.total";
  static final String METRIC_MERGE_DURATION = "identity.merge.duration";

  static final String OUTCOME_FAILED = "failed";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> identifyCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> anomalyCounters = new ConcurrentHashMap<>();
  private final Timer mergeTimer;

  public IdentityMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.mergeTimer =
        Timer.builder(METRIC_MERGE_DURATION)
            .description("Duration of the transactional merge of two contact groups")
            .register(meterRegistry);
  }

  public void recordIdentify(LinkAction action) {
    recordIdentifyOutcome(action.metricTag());
  }

  public void recordIdentifyFailure() {
    recordIdentifyOutcome(OUTCOME_FAILED);
  }

  public void recordAnomaly(String kind) {
    anomalyCounters
        .computeIfAbsent(
            kind,
            ignored ->
                Counter.builder(METRIC_ANOMALY_TOTAL)
                    .description("Contact group invariant anomalies tolerated during resolution")
                    .tags(Tags.of("kind", kind))
                    .register(meterRegistry))
        .increment();
  }

  public <T> T recordMerge(Supplier<T> merge) {
    return mergeTimer.record(merge);
  }

  private void recordIdentifyOutcome(String outcome) {
    identifyCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_IDENTIFY_TOTAL)
                    .description("Identify requests by resolution outcome")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }
}
