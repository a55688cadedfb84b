package org.ohnlp.ir.ase.connections;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;

import java.util.List;

public interface DataConnection {
    /**
     * Loads data connection settings from configuration
     * @param node The configuration node
     */
    void loadConfig(JsonNode node);

    /**
     * Lists the columns of a table. Called while the pipeline is being constructed.
     * @param table The table name
     * @return the physical column names in source order, or an empty list if the table does not exist
     */
    List<String> listColumns(String table);

    /**
     * Returns a Row PCollection for a given table
     * @param pipeline The pipeline object that this data retrieval is ran on
     * @param table The table to read
     * @param schema The Schema of the result rows. Field names are physical column names, all fields nullable
     * @return A parallelized collection of {@link Row}s representing the table contents
     */
    PCollection<Row> read(Pipeline pipeline, String table, Schema schema);

    void write(String table, PCollection<Row> data);
}
