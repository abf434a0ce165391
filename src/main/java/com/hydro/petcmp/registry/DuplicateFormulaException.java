package com.hydro.petcmp.registry;

/** A formula with the same name is already registered. */
public class DuplicateFormulaException extends RegistrationException {
    private final String formula;

    public DuplicateFormulaException(String formula) {
        super("Formula already registered: " + formula);
        this.formula = formula;
    }

    public String formula() {
        return formula;
    }
}
