package com.github.spud.refill.interfaces.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.github.spud.refill.domain.error.ErrorKind;
import com.github.spud.refill.domain.error.StaleSessionException;
import com.github.spud.refill.domain.error.StoreUnavailableException;
import com.github.spud.refill.domain.session.SessionController;
import com.github.spud.refill.domain.session.TurnResponse;
import com.github.spud.refill.domain.session.WorkflowSession;
import com.github.spud.refill.domain.state.Intent;
import com.github.spud.refill.domain.state.WorkflowState;
import com.github.spud.refill.support.WorkflowFixture;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class RefillControllerTest {

  @Mock
  private SessionController sessionController;

  private RefillController controller;

  @BeforeEach
  void setUp() {
    controller = new RefillController(sessionController);
  }

  @Test
  void shouldReturnTurnResponse() {
    TurnResponse response = TurnResponse.builder()
      .sessionId("rest-1")
      .nextState(WorkflowState.DISPENSED)
      .orderId("RX-0001")
      .build();
    when(sessionController.handleTurn(any())).thenReturn(response);

    StepVerifier.create(controller.submitTurn(dto()))
      .assertNext(entity -> {
        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(entity.getBody()).isEqualTo(response);
      })
      .verifyComplete();
  }

  @Test
  void shouldMapStaleSessionToConflict() {
    when(sessionController.handleTurn(any()))
      .thenThrow(new StaleSessionException("Session busy: rest-1"));

    StepVerifier.create(controller.submitTurn(dto()))
      .assertNext(entity -> {
        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(entity.getBody().getError()).isEqualTo(ErrorKind.STALE_SESSION);
        assertThat(entity.getBody().getUserPrompt()).doesNotContain("rest-1");
      })
      .verifyComplete();
  }

  @Test
  void shouldMapStoreFailureToServiceUnavailable() {
    when(sessionController.handleTurn(any())).thenThrow(new StoreUnavailableException(
      "Session store unavailable", new DataAccessResourceFailureException("down")));

    StepVerifier.create(controller.submitTurn(dto()))
      .assertNext(entity -> {
        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(entity.getBody().getError()).isEqualTo(ErrorKind.INTERNAL);
      })
      .verifyComplete();
  }

  @Test
  void shouldHideUnexpectedFailures() {
    when(sessionController.handleTurn(any()))
      .thenThrow(new IllegalStateException("Evaluator rounds exhausted in COLLECT_REQUEST"));

    StepVerifier.create(controller.submitTurn(dto()))
      .assertNext(entity -> {
        assertThat(entity.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(entity.getBody().getUserPrompt()).doesNotContain("Evaluator");
      })
      .verifyComplete();
  }

  @Test
  void shouldLeaveBadInputToExceptionHandler() {
    when(sessionController.handleTurn(any()))
      .thenThrow(new IllegalArgumentException("sessionId is required"));

    StepVerifier.create(controller.submitTurn(dto()))
      .expectError(IllegalArgumentException.class)
      .verify();
  }

  @Test
  void sessionSummaryShouldNotExposeSlotValues() {
    WorkflowSession session = WorkflowSession.start("rest-1", WorkflowFixture.START);
    session.getCollectedEntities().putAll(WorkflowFixture.completeRequest());
    when(sessionController.findSession("rest-1")).thenReturn(session);

    StepVerifier.create(controller.getSession("rest-1"))
      .assertNext(entity -> {
        RefillController.SessionSummary summary = entity.getBody();
        assertThat(summary.getState()).isEqualTo(WorkflowState.COLLECT_REQUEST);
        assertThat(summary.getCollectedSlots())
          .containsExactly("dose", "drug_name", "patient_id", "quantity");
        assertThat(summary.toString()).doesNotContain("1234567");
      })
      .verifyComplete();
  }

  private static RefillController.TurnRequestDto dto() {
    RefillController.TurnRequestDto dto = new RefillController.TurnRequestDto();
    dto.setSessionId("rest-1");
    dto.setIntent(Intent.REQUEST_REFILL);
    dto.setConfidence(0.95);
    dto.setExtractedEntities(Map.of("drug_name", "Lisinopril"));
    dto.setTurnSequence(1);
    return dto;
  }
}
