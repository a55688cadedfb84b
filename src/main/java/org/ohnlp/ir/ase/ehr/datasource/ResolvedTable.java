package org.ohnlp.ir.ase.ehr.datasource;

import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A {@link ClifTable} bound to the physical table and columns found in a data connection.
 */
public class ResolvedTable implements Serializable {
    private final ClifTable table;
    private final String physicalName;
    private final Map<String, String> physicalColumns;
    private final Schema schema;

    ResolvedTable(ClifTable table, String physicalName, Map<String, String> physicalColumns) {
        this.table = table;
        this.physicalName = physicalName;
        this.physicalColumns = physicalColumns;
        Schema.Builder builder = Schema.builder();
        for (ClifTable.Column column : table.getColumns()) {
            String physical = physicalColumns.get(column.getName());
            if (physical != null) {
                builder.addField(Schema.Field.nullable(physical, column.getType()));
            }
        }
        this.schema = builder.build();
    }

    /**
     * Binds each logical column of a table to the first accepted name present among the source columns.
     * Matching ignores case.
     * @return logical to physical column names; unmatched logical columns are absent from the map
     */
    static Map<String, String> bindColumns(ClifTable table, List<String> sourceColumns) {
        Map<String, String> byLowerCase = new LinkedHashMap<>();
        for (String c : sourceColumns) {
            byLowerCase.putIfAbsent(c.toLowerCase(Locale.ROOT), c);
        }
        Map<String, String> bound = new LinkedHashMap<>();
        for (ClifTable.Column column : table.getColumns()) {
            for (String accepted : column.getAcceptedNames()) {
                String physical = byLowerCase.get(accepted.toLowerCase(Locale.ROOT));
                if (physical != null) {
                    bound.put(column.getName(), physical);
                    break;
                }
            }
        }
        return bound;
    }

    public ClifTable getTable() {
        return table;
    }

    public String getPhysicalName() {
        return physicalName;
    }

    /**
     * @return the read schema: bound columns under their physical names, all nullable
     */
    public Schema getSchema() {
        return schema;
    }

    public boolean hasColumn(String logicalName) {
        return physicalColumns.containsKey(logicalName);
    }

    /**
     * @return the value of a logical column, or null when the column is not bound
     */
    public Object value(Row row, String logicalName) {
        String physical = physicalColumns.get(logicalName);
        return physical == null ? null : row.getValue(physical);
    }
}
