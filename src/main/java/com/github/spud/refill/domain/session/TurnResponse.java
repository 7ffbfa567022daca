package com.github.spud.refill.domain.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.spud.refill.domain.error.ErrorKind;
import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.state.WorkflowState;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What the caller is told after a turn
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TurnResponse {

  String sessionId;

  WorkflowState nextState;

  String userPrompt;

  String escalationId;

  String orderId;

  /**
   * Choices offered in a disambiguation sub-turn
   */
  List<DrugCandidate> candidates;

  ErrorKind error;

  /**
   * Set when the turn cancelled the request and the session was discarded
   */
  Boolean cancelled;

  public static TurnResponse failed(String sessionId, ErrorKind error) {
    return TurnResponse.builder()
      .sessionId(sessionId)
      .userPrompt(error.getUserMessage())
      .error(error)
      .build();
  }
}
