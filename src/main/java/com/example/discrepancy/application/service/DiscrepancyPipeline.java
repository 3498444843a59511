package com.example.discrepancy.application.service;

import com.example.discrepancy.domain.exception.EmptyReportException;
import com.example.discrepancy.domain.exception.InvalidNumericDataException;
import com.example.discrepancy.domain.exception.MissingColumnsException;
import com.example.discrepancy.domain.model.ReportColumns;
import com.example.discrepancy.domain.model.ReportRow;
import com.example.discrepancy.domain.model.ReportTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that turns a procurement report into the list of under-delivered materials.
 * It validates the report, normalizes identifiers and quantities, rejects reports holding any unreadable
 * quantity, and returns the rows whose requested quantity exceeds the received one with their difference.
 */
@Service
public class DiscrepancyPipeline {

    private static final Logger log = LoggerFactory.getLogger(DiscrepancyPipeline.class);
    private static final int MAX_REPORTED_ROWS = 10;

    private final ReportSchemaValidator schemaValidator;
    private final QuantityNormalizer normalizer;
    private final ReportColumns columns;

	/**
	 * Creates the pipeline with its collaborators.
	 *
	 * @param schemaValidator checks rows and required columns
	 * @param normalizer      quantity cell normalizer
	 * @param columns         header names of the processed report
	 */
    public DiscrepancyPipeline(ReportSchemaValidator schemaValidator, QuantityNormalizer normalizer, ReportColumns columns) {
        this.schemaValidator = schemaValidator;
        this.normalizer = normalizer;
        this.columns = columns;
    }

	/**
	 * Runs the whole transformation. The input table is left unchanged.
	 *
	 * @param input parsed report
	 * @return rows with {@code requested > received} plus the discrepancy column; may have zero rows
	 * @throws EmptyReportException         when the report has no rows
	 * @throws MissingColumnsException      when required columns are absent
	 * @throws InvalidNumericDataException  when any quantity cell is not a number after normalization
	 */
    public ReportTable run(ReportTable input) {
        schemaValidator.validate(input, columns.required());

        ReportTable normalized = input
                .mapColumn(columns.materialId(), DiscrepancyPipeline::correctMaterialId)
                .mapColumn(columns.requestedQuantity(), this::toNumber)
                .mapColumn(columns.receivedQuantity(), this::toNumber);

        ensureNumericIntegrity(normalized);

        String requested = columns.requestedQuantity();
        String received = columns.receivedQuantity();
        ReportTable flagged = normalized
                .filter(row -> row.number(requested) > row.number(received))
                .withColumn(columns.discrepancy(), row -> row.number(requested) - row.number(received));

        log.info("Discrepancy check complete. rows={}, flagged={}", input.rowCount(), flagged.rowCount());
        return flagged;
    }

	/**
	 * Replaces the letter {@code I} with the digit {@code 1}, a frequent transcription artifact in material ids.
	 *
	 * @param raw material id cell
	 * @return corrected text, {@code null} when the cell is missing
	 */
    static Object correctMaterialId(Object raw) {
        if (raw == null) {
            return null;
        }
        return asText(raw).replace('I', '1');
    }

    private Object toNumber(Object raw) {
        return normalizer.normalize(raw).toDouble();
    }

    /**
     * Table-wide gate: one bad cell rejects the report, rows are never dropped one by one.
     */
    private void ensureNumericIntegrity(ReportTable table) {
        List<Integer> invalidRows = new ArrayList<>();
        List<ReportRow> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            ReportRow row = rows.get(i);
            if (Double.isNaN(row.number(columns.requestedQuantity())) || Double.isNaN(row.number(columns.receivedQuantity()))) {
                invalidRows.add(i + 1);
            }
        }
        if (!invalidRows.isEmpty()) {
            log.warn("Rejecting report with {} invalid quantity rows", invalidRows.size());
            throw new InvalidNumericDataException(invalidRows.subList(0, Math.min(MAX_REPORTED_ROWS, invalidRows.size())));
        }
    }

    private static String asText(Object value) {
        if (value instanceof Double number && number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString(number.longValue());
        }
        return String.valueOf(value);
    }
}
