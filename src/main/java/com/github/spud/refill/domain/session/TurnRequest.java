package com.github.spud.refill.domain.session;

import com.github.spud.refill.domain.state.Intent;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One inbound conversational turn, already classified by the NLU layer
 */
@Value
@Builder
public class TurnRequest {

  String sessionId;

  String rawUtterance;

  Intent intent;

  /**
   * Null is treated as 0.0
   */
  Double confidence;

  @Builder.Default
  Map<String, String> extractedEntities = Map.of();

  int turnSequence;
}
