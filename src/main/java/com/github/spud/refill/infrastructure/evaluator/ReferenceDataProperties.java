package com.github.spud.refill.infrastructure.evaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reference data behind the built-in evaluators: patient records, formulary, interaction and
 * cross-sensitivity tables
 */
@Data
@Component
@ConfigurationProperties(prefix = "refill.reference")
public class ReferenceDataProperties {

  /**
   * Patient records keyed by MRN
   */
  private Map<String, Patient> patients = new LinkedHashMap<>();

  private List<Drug> formulary = new ArrayList<>();

  private List<Interaction> interactions = new ArrayList<>();

  private List<CrossSensitivity> crossSensitivities = new ArrayList<>();

  public Optional<Patient> findPatient(String mrn) {
    return Optional.ofNullable(mrn == null ? null : patients.get(mrn.trim()));
  }

  public Optional<Drug> findDrug(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    return formulary.stream()
      .filter(d -> d.getName().toLowerCase(Locale.ROOT).equals(key))
      .findFirst();
  }

  @Data
  public static class Patient {

    private List<String> allergies = new ArrayList<>();

    private List<String> activeMedications = new ArrayList<>();
  }

  @Data
  public static class Drug {

    private String name;

    private String code;

    private String drugClass;

    private List<String> activeIngredients = new ArrayList<>();

    /**
     * DEA schedule (I to V), empty when not controlled
     */
    private String deaSchedule;

    private double minDoseMg;

    private double maxDoseMg = Double.MAX_VALUE;

    private int stock;

    private boolean priorAuthorization;
  }

  @Data
  public static class Interaction {

    private String drugA;

    private String drugB;

    /**
     * major, moderate or minor
     */
    private String severity;

    public boolean involves(String first, String second) {
      return (drugA.equalsIgnoreCase(first) && drugB.equalsIgnoreCase(second))
        || (drugA.equalsIgnoreCase(second) && drugB.equalsIgnoreCase(first));
    }
  }

  @Data
  public static class CrossSensitivity {

    private String allergen;

    private String drugClass;
  }
}
