package com.example.discrepancy.domain.model;

/**
 * Result of normalizing a raw quantity cell.
 * Normalization never fails by itself; unparseable input is kept as {@link Unparsed}
 * and rejected later by the table-wide integrity check.
 */
public sealed interface NormalizedQuantity
        permits NormalizedQuantity.Parsed, NormalizedQuantity.Missing, NormalizedQuantity.Unparsed {

	/**
	 * Coerces the result to a plain number.
	 *
	 * @return the parsed value, or {@link Double#NaN} for missing and unparsed cells
	 */
    double toDouble();

    /**
     * A finite number recovered from the cell.
     */
    record Parsed(double value) implements NormalizedQuantity {

        public Parsed {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Parsed quantity must be finite: " + value);
            }
        }

        @Override
        public double toDouble() {
            return value;
        }
    }

    /**
     * The source cell was empty.
     */
    record Missing() implements NormalizedQuantity {

        public static final Missing INSTANCE = new Missing();

        @Override
        public double toDouble() {
            return Double.NaN;
        }
    }

    /**
     * The cell could not be read as a number; keeps the value exactly as it was uploaded.
     */
    record Unparsed(Object original) implements NormalizedQuantity {

        @Override
        public double toDouble() {
            return Double.NaN;
        }
    }
}
