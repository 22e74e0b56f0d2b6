package org.obligato.solver;

/** Thrown when deciding a goal exceeds one of the solver's budgets. */
final class BudgetExceeded extends RuntimeException {

  BudgetExceeded(String message) {
    super(message);
  }
}
