package com.auditeng.backend.model;

/**
 * Phase combinations an insulation-resistance (megger) test must cover.
 */
public enum PhaseCombination {
    A_B("A-B"),
    A_C("A-C"),
    B_C("B-C"),
    A_G("A-G"),
    B_G("B-G"),
    C_G("C-G");

    private final String label;

    PhaseCombination(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String fieldName() {
        return FieldNames.insulationResistance(label);
    }
}
