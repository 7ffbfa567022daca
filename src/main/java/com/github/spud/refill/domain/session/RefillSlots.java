package com.github.spud.refill.domain.session;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Slot names, aliases and validation rules of a refill request
 */
public final class RefillSlots {

  public static final String PATIENT_ID = "patient_id";
  public static final String DRUG_NAME = "drug_name";
  public static final String DOSE = "dose";
  public static final String QUANTITY = "quantity";
  public static final String FREQUENCY = "frequency";

  /**
   * Candidate choice in a disambiguation sub-turn, 1-based
   */
  public static final String SELECTION = "selection";

  /**
   * Pseudo-slot whose retry counter tracks intent re-prompts
   */
  public static final String INTENT = "intent";

  public static final List<String> REQUIRED = List.of(PATIENT_ID, DRUG_NAME, DOSE, QUANTITY);

  private static final Map<String, String> ALIASES = Map.of(
    "drug", DRUG_NAME,
    "medication", DRUG_NAME,
    "qty", QUANTITY,
    "mrn", PATIENT_ID,
    "patient", PATIENT_ID
  );

  private static final Pattern MRN = Pattern.compile("^\\d{6,8}$");
  private static final Pattern DOSE_FORMAT =
    Pattern.compile("^\\d+(\\.\\d+)?\\s*(mg|mcg|g|mL)$");
  private static final Pattern EMBEDDED_DOSE =
    Pattern.compile("^(.*?)\\s+(\\d+(?:\\.\\d+)?\\s*(?:mg|mcg|g|mL))$");

  private static final int MAX_QUANTITY = 365;

  private RefillSlots() {
  }

  /**
   * Canonical slot names, trimmed values, blank values dropped, and a dose embedded in the drug
   * name ("Lisinopril 10mg") split out when no dose was given separately.
   */
  public static Map<String, String> normalize(Map<String, String> raw) {
    Map<String, String> normalized = new TreeMap<>();
    if (raw == null) {
      return normalized;
    }
    raw.forEach((key, value) -> {
      if (key == null || !StringUtils.hasText(value)) {
        return;
      }
      String slot = key.trim().toLowerCase(Locale.ROOT);
      normalized.put(ALIASES.getOrDefault(slot, slot), value.trim());
    });

    String drug = normalized.get(DRUG_NAME);
    if (drug != null && !normalized.containsKey(DOSE)) {
      Matcher matcher = EMBEDDED_DOSE.matcher(drug);
      if (matcher.matches()) {
        normalized.put(DRUG_NAME, matcher.group(1).trim());
        normalized.put(DOSE, matcher.group(2).trim());
      }
    }
    return normalized;
  }

  public static boolean isValid(String slot, String value) {
    if (!StringUtils.hasText(value)) {
      return false;
    }
    switch (slot) {
      case PATIENT_ID:
        return MRN.matcher(value).matches();
      case DRUG_NAME:
        return value.trim().length() >= 2;
      case DOSE:
        return DOSE_FORMAT.matcher(value).matches();
      case QUANTITY:
        try {
          int quantity = Integer.parseInt(value.trim());
          return quantity > 0 && quantity <= MAX_QUANTITY;
        } catch (NumberFormatException e) {
          return false;
        }
      default:
        return true;
    }
  }

  public static Optional<String> firstMissing(Map<String, String> entities) {
    return REQUIRED.stream()
      .filter(slot -> !entities.containsKey(slot))
      .findFirst();
  }

  public static Optional<String> firstInvalid(Map<String, String> entities) {
    return REQUIRED.stream()
      .filter(entities::containsKey)
      .filter(slot -> !isValid(slot, entities.get(slot)))
      .findFirst();
  }
}
