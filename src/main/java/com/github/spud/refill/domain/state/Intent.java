package com.github.spud.refill.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 驱动状态转换的意图
 * <p>
 * 用户意图由上游 NLU 分类后传入；系统意图由会话控制器和升级协调器发出
 */
public enum Intent {
  REQUEST_REFILL("RequestRefill", false),
  CLARIFICATION("Clarification", false),
  STATUS_INQUIRY("StatusInquiry", false),
  CANCEL_REQUEST("CancelRequest", false),
  CONTINUE("Continue", true),
  ROUTING_RESOLVED("RoutingResolved", true),
  HANDOFF_ACKNOWLEDGED("HandoffAcknowledged", true);

  private final String wireName;
  private final boolean system;

  Intent(String wireName, boolean system) {
    this.wireName = wireName;
    this.system = system;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  public boolean isSystem() {
    return system;
  }

  /**
   * 不参与槽位收集与安全/后端检查的意图
   */
  public boolean isInformational() {
    return this == STATUS_INQUIRY || this == CANCEL_REQUEST;
  }

  @JsonCreator
  public static Intent fromWireName(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    for (Intent intent : values()) {
      if (intent.wireName.equalsIgnoreCase(trimmed) || intent.name().equalsIgnoreCase(trimmed)) {
        return intent;
      }
    }
    throw new IllegalArgumentException("Unknown intent: " + value);
  }
}
