package com.github.spud.refill.domain.state;

/**
 * 续药流程状态枚举
 * <pre>
 * COLLECT_REQUEST → SAFETY_CHECK → BACKEND_CHECK → DISPENSED
 *                                               → PA_APPROVAL_NEEDED → ESCALATE_HANDOFF
 * (any non-terminal) --(circuit breaker)--> ESCALATE_HANDOFF → ESCALATION_COMPLETE
 * </pre>
 */
public enum WorkflowState {
  /**
   * 收集槽位、核验身份、药品消歧
   */
  COLLECT_REQUEST,

  /**
   * 相互作用、过敏、管制药品与剂量检查
   */
  SAFETY_CHECK,

  /**
   * 库存 / 配药后端检查
   */
  BACKEND_CHECK,

  /**
   * 需要事前授权，转交审核人
   */
  PA_APPROVAL_NEEDED,

  /**
   * 已配药（终态）
   */
  DISPENSED,

  /**
   * 等待人工审核人确认交接
   */
  ESCALATE_HANDOFF,

  /**
   * 交接已确认（终态）
   */
  ESCALATION_COMPLETE;

  public static boolean isFinal(WorkflowState state) {
    return state == DISPENSED || state == ESCALATION_COMPLETE;
  }

  /**
   * 无需等待用户下一轮、由控制器自动推进的状态
   */
  public static boolean isAutomatic(WorkflowState state) {
    return state == SAFETY_CHECK || state == BACKEND_CHECK || state == PA_APPROVAL_NEEDED;
  }

  /**
   * 转换受本轮置信度约束的状态
   */
  public static boolean gatesOnConfidence(WorkflowState state) {
    return state == COLLECT_REQUEST || state == SAFETY_CHECK;
  }
}
