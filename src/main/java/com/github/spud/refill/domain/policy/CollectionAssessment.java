package com.github.spud.refill.domain.policy;

import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.evaluator.EvaluatorType;
import com.github.spud.refill.domain.evaluator.EvaluatorVerdict;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * 本轮合并进会话后的收集评估结果
 * <p>
 * {@link #requiredEvaluators}、{@link #clarifySlot}、{@link #ready}、{@link #blockedReason}
 * 中恰有一项决定下一步
 */
@Value
@Builder
public class CollectionAssessment {

  /**
   * 会话槽位叠加本轮槽位及药品消歧结果
   */
  Map<String, String> mergedEntities;

  /**
   * 本轮需要持久化的槽位（按槽位名排序）
   */
  Map<String, String> persistedEntities;

  boolean intentClarification;

  /**
   * 本步确定的药品（自动确认或用户选择）
   */
  DrugCandidate resolution;

  /**
   * 供用户选择的候选药品
   */
  List<DrugCandidate> presentedCandidates;

  /**
   * 本步收到身份核验 PASS
   */
  boolean identityConfirmedNow;

  Set<EvaluatorType> requiredEvaluators;

  String clarifySlot;

  /**
   * 消歧无法确定药品时推导出的 REQUIRES_ESCALATION 结果
   */
  EvaluatorVerdict disambiguationVerdict;

  Set<String> resetSlots;

  boolean ready;

  /**
   * 其余结果均不适用时，无法继续收集的原因
   */
  String blockedReason;
}
