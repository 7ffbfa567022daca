package com.github.spud.refill.domain.state;

/**
 * 指令类型 - 由转换引擎产出、会话控制器执行的副作用
 */
public enum DirectiveType {
  EMIT_AUDIT,
  INVOKE_EVALUATOR,
  REQUEST_ESCALATION,
  EMIT_PROMPT,
  CLARIFY,
  PERSIST_ENTITY,
  INCREMENT_RETRY,
  RESET_RETRY,
  CONFIRM_IDENTITY,
  RESOLVE_DRUG,
  COMPLETE,
  CANCEL
}
