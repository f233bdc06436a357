package com.frameforge.ingest;

import com.frameforge.exception.AxisLengthMismatchException;
import com.frameforge.logical.LocalRelation;
import com.frameforge.runtime.ColumnarTable;
import com.frameforge.types.StructType;
import com.frameforge.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes a built table and its schema agree before they are returned.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>If the caller constrained the column count, the table must have exactly that many columns.</li>
 *   <li>If a name list is pending, the table's columns are renamed positionally.</li>
 *   <li>The schema is the adapter's, or else derived from the table's Arrow schema, and its
 *       field names are aligned with the table's column names.</li>
 * </ol>
 *
 * <p>Reconciling a pair that already agrees changes nothing. On failure the table is closed.
 */
public class SchemaReconciler {

    private static final Logger logger = LoggerFactory.getLogger(SchemaReconciler.class);

    /**
     * Reconciles an adapter's result.
     *
     * @param result the table and its pending schema and naming
     * @return the consistent pair; it owns the table
     * @throws AxisLengthMismatchException if the table has a different column count than expected
     */
    public LocalRelation reconcile(AdapterResult result) {
        ColumnarTable table = result.table();
        try {
            Integer expected = result.expectedColumnCount();
            if (expected != null && expected != table.columnCount()) {
                throw new AxisLengthMismatchException(expected, table.columnCount());
            }

            if (result.columnNames() != null && !result.columnNames().isEmpty()) {
                table.renameColumns(result.columnNames());
            }

            StructType schema = result.schema() != null
                ? result.schema()
                : TypeMapper.fromArrowSchema(table.arrowSchema());
            if (!schema.fieldNames().equals(table.columnNames())) {
                schema = schema.withFieldNames(table.columnNames());
            }

            logger.debug("Reconciled {} with schema {}", table, schema.simpleString());
            return new LocalRelation(table, schema);
        } catch (RuntimeException e) {
            table.close();
            throw e;
        }
    }
}
