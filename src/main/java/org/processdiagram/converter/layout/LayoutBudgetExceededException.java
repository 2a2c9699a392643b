package org.processdiagram.converter.layout;

/**
 * Ranking would need more work than allowed; the caller falls back to grid placement.
 */
public class LayoutBudgetExceededException extends RuntimeException {

    public LayoutBudgetExceededException(long estimate, long budget) {
        super("Ranking needs an estimated " + estimate + " steps, over the budget of " + budget);
    }
}
