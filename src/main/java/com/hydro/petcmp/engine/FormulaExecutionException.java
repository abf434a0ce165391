package com.hydro.petcmp.engine;

/**
 * A formula raised, or returned an invalid output, during direct
 * single-formula invocation.
 */
public class FormulaExecutionException extends RuntimeException {
    private final String formula;

    public FormulaExecutionException(String formula, Throwable cause) {
        super("Formula " + formula + " failed: " + cause.getMessage(), cause);
        this.formula = formula;
    }

    public String formula() {
        return formula;
    }
}
