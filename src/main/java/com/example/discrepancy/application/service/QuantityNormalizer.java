package com.example.discrepancy.application.service;

import com.example.discrepancy.domain.model.NormalizedQuantity;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns heterogeneous quantity cells ({@code "80,0 М3"}, {@code "934 КГ"}, {@code 506.0}) into numbers.
 * Values that still do not parse are returned untouched so that the pipeline can reject the whole report.
 */
public class QuantityNormalizer {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final List<String> unitTokens;

	/**
	 * Creates the normalizer with the unit tokens stripped from every cell.
	 *
	 * @param unitTokens tokens removed by plain substring replacement, in list order
	 */
    public QuantityNormalizer(List<String> unitTokens) {
        this.unitTokens = List.copyOf(unitTokens);
    }

	/**
	 * Normalizes a raw cell value.
	 *
	 * @param raw cell content as read from the workbook, {@code null} for an empty cell
	 * @return parsed number, missing marker, or the untouched original value
	 */
    public NormalizedQuantity normalize(Object raw) {
        if (raw == null) {
            return NormalizedQuantity.Missing.INSTANCE;
        }
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value)
                    ? new NormalizedQuantity.Parsed(value)
                    : new NormalizedQuantity.Unparsed(raw);
        }

        String cleaned = String.valueOf(raw).replace(',', '.');
        for (String unit : unitTokens) {
            cleaned = cleaned.replace(unit, "").strip();
        }
        if (!DECIMAL.matcher(cleaned).matches()) {
            return new NormalizedQuantity.Unparsed(raw);
        }
        double value = Double.parseDouble(cleaned);
        // exponent overflow, e.g. "1e400"
        if (!Double.isFinite(value)) {
            return new NormalizedQuantity.Unparsed(raw);
        }
        return new NormalizedQuantity.Parsed(value);
    }
}
