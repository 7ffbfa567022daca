package com.github.spud.refill;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.refill.domain.session.TurnResponse;
import com.github.spud.refill.domain.state.WorkflowState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Full context over the reference evaluators and in-memory stores
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class RefillOrchestratorApplicationTests {

  @Autowired
  private WebTestClient webTestClient;

  @Test
  void shouldDispenseThroughRestApi() {
    String requestBody = """
      {
        "sessionId": "it-dispense",
        "rawUtterance": "I need a refill of Lisinopril 10mg, 30 tablets",
        "intent": "RequestRefill",
        "confidence": 0.95,
        "extractedEntities": {
          "mrn": "1234567",
          "drug_name": "Lisinopril 10mg",
          "quantity": "30"
        },
        "turnSequence": 1
      }
      """;

    TurnResponse response = webTestClient.post()
      .uri("/api/v1/refill/turns")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(requestBody)
      .exchange()
      .expectStatus().isOk()
      .expectBody(TurnResponse.class)
      .returnResult()
      .getResponseBody();

    assertThat(response.getNextState()).isEqualTo(WorkflowState.DISPENSED);
    assertThat(response.getOrderId()).startsWith("RX-");

    webTestClient.get()
      .uri("/api/v1/refill/sessions/it-dispense/audit")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.length()").isEqualTo(3)
      .jsonPath("$[2].toState").isEqualTo("DISPENSED");

    webTestClient.get()
      .uri("/api/v1/refill/sessions/it-dispense")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.state").isEqualTo("DISPENSED")
      .jsonPath("$.collectedSlots[0]").isEqualTo("dose");
  }

  @Test
  void shouldEscalateControlledSubstanceAndAcknowledge() {
    String requestBody = """
      {
        "sessionId": "it-controlled",
        "intent": "RequestRefill",
        "confidence": 0.93,
        "extractedEntities": {
          "patient_id": "7654321",
          "drug_name": "Oxycodone",
          "dose": "10mg",
          "quantity": "20"
        },
        "turnSequence": 1
      }
      """;

    TurnResponse response = webTestClient.post()
      .uri("/api/v1/refill/turns")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(requestBody)
      .exchange()
      .expectStatus().isOk()
      .expectBody(TurnResponse.class)
      .returnResult()
      .getResponseBody();

    assertThat(response.getNextState()).isEqualTo(WorkflowState.ESCALATE_HANDOFF);

    webTestClient.get()
      .uri("/api/v1/escalations/" + response.getEscalationId())
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.reasonCode").isEqualTo("CONTROLLED_SUBSTANCE")
      .jsonPath("$.targetRole").isEqualTo("PHYSICIAN");

    webTestClient.post()
      .uri("/api/v1/escalations/" + response.getEscalationId() + "/acknowledge")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"actor\": \"dr.reyes\"}")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.status").isEqualTo("ACKNOWLEDGED");

    webTestClient.get()
      .uri("/api/v1/refill/sessions/it-controlled")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.state").isEqualTo("ESCALATION_COMPLETE");
  }

  @Test
  void shouldCancelThroughRestApi() {
    String requestBody = """
      {
        "sessionId": "it-cancel",
        "intent": "CancelRequest",
        "confidence": 0.97,
        "turnSequence": 1
      }
      """;

    webTestClient.post()
      .uri("/api/v1/refill/turns")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(requestBody)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.cancelled").isEqualTo(true)
      .jsonPath("$.nextState").isEqualTo("COLLECT_REQUEST");

    webTestClient.get()
      .uri("/api/v1/refill/sessions/it-cancel")
      .exchange()
      .expectStatus().isNotFound();
  }

  @Test
  void shouldRejectInvalidTurn() {
    webTestClient.post()
      .uri("/api/v1/refill/turns")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue("{\"intent\": \"RequestRefill\", \"turnSequence\": 1}")
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void shouldReportUnknownSession() {
    webTestClient.get()
      .uri("/api/v1/refill/sessions/nobody")
      .exchange()
      .expectStatus().isNotFound();
  }

  @Test
  void shouldReportHealth() {
    webTestClient.get()
      .uri("/health")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.status").isEqualTo("UP");
  }
}
