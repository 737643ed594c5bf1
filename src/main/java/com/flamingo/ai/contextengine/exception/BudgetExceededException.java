package com.flamingo.ai.contextengine.exception;

/** Signal raised when spend over a window exceeds its budget. Never fatal. */
public class BudgetExceededException extends RuntimeException {

  private final double spent;
  private final double budget;

  public BudgetExceededException(String window, double spent, double budget) {
    super(String.format("%s spend %.4f exceeds budget %.4f", window, spent, budget));
    this.spent = spent;
    this.budget = budget;
  }

  public double getSpent() {
    return spent;
  }

  public double getBudget() {
    return budget;
  }
}
