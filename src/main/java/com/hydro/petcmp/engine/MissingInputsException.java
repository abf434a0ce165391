package com.hydro.petcmp.engine;

import java.util.List;

/**
 * A formula was invoked directly although the dataset lacks some of its
 * required inputs. Batch runs record the same condition as a skip instead.
 */
public class MissingInputsException extends IllegalStateException {
    private final String formula;
    private final List<String> missing;

    public MissingInputsException(String formula, List<String> missing) {
        super("Formula " + formula + " cannot run, missing: " + String.join(", ", missing));
        this.formula = formula;
        this.missing = List.copyOf(missing);
    }

    public String formula() {
        return formula;
    }

    public List<String> missing() {
        return missing;
    }
}
