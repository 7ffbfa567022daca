package com.github.spud.refill.domain.state;

import com.github.spud.refill.domain.evaluator.DrugCandidate;
import com.github.spud.refill.domain.session.RefillSlots;
import java.util.List;

/**
 * 面向用户的提示文案，不回显任何患者数据
 */
public final class Prompts {

  private Prompts() {
  }

  public static String clarify(String slot) {
    switch (slot) {
      case RefillSlots.INTENT:
        return "Just to confirm, would you like to request a prescription refill?";
      case RefillSlots.PATIENT_ID:
        return "Please provide your medical record number (6 to 8 digits).";
      case RefillSlots.DRUG_NAME:
        return "Which medication would you like to refill?";
      case RefillSlots.DOSE:
        return "What dose is on your prescription (for example 10 mg)?";
      case RefillSlots.QUANTITY:
        return "How many units do you need (1 to 365)?";
      default:
        return "Could you provide the " + slot.replace('_', ' ') + "?";
    }
  }

  public static String chooseDrug(List<DrugCandidate> candidates) {
    StringBuilder sb = new StringBuilder("Which of these medications did you mean?");
    for (int i = 0; i < candidates.size(); i++) {
      sb.append(' ').append(i + 1).append(") ").append(candidates.get(i).getName());
    }
    return sb.append(". Reply with the number.").toString();
  }

  public static String checkingSafety() {
    return "Thanks, we are running the safety checks for your refill.";
  }

  public static String checkingAvailability() {
    return "Safety checks passed, checking availability.";
  }

  public static String dispensed() {
    return "Your refill has been submitted for dispensing.";
  }

  public static String priorAuthorization() {
    return "This medication needs prior authorization, routing it to a reviewer.";
  }

  public static String handoff() {
    return "Your request needs review by a clinician. A member of the care team will follow up.";
  }

  public static String cancelled() {
    return "Your refill request has been cancelled.";
  }

  public static String handoffAcknowledged() {
    return "A clinician has picked up your request.";
  }

  public static String status(WorkflowState state) {
    switch (state) {
      case COLLECT_REQUEST:
        return "We are still collecting the details of your refill request.";
      case SAFETY_CHECK:
        return "Your refill is going through safety checks.";
      case BACKEND_CHECK:
        return "We are checking availability for your refill.";
      case PA_APPROVAL_NEEDED:
        return priorAuthorization();
      case DISPENSED:
        return dispensed();
      case ESCALATE_HANDOFF:
        return "Your request is waiting for clinician review.";
      default:
        return "Your request has been reviewed by a clinician.";
    }
  }
}
