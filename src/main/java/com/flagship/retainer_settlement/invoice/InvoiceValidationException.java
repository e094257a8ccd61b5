package com.flagship.retainer_settlement.invoice;

import java.util.List;

/**
 * An invoice form failed one or more submission checks.
 */
public class InvoiceValidationException extends IllegalArgumentException {

    private final List<String> problems;

    public InvoiceValidationException(List<String> problems) {
        super("Invoice cannot be submitted: " + String.join(", ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
