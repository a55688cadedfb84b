package org.ohnlp.ir.ase.connections;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.coders.RowCoder;
import org.apache.beam.sdk.io.jdbc.JdbcIO;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTimeZone;
import org.joda.time.Instant;
import org.joda.time.ReadableInstant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class JDBCDataConnectionImpl implements DataConnection {
    private static final Logger LOG = LoggerFactory.getLogger(JDBCDataConnectionImpl.class);

    private String driverClass;
    private String jdbcURL;
    private String user;
    private String password;
    private String schemaName;
    private String timezone = "UTC";
    private JdbcIO.DataSourceConfiguration config;

    @Override
    public void loadConfig(JsonNode node) {
        this.driverClass = node.get("driverClass").asText();
        this.jdbcURL = node.get("url").asText();
        this.config = JdbcIO.DataSourceConfiguration.create(driverClass, jdbcURL);
        if (node.has("user")) {
            this.user = node.get("user").asText();
            this.password = node.has("password") ? node.get("password").asText() : null;
            config = config.withUsername(user).withPassword(password);
        }
        this.schemaName = node.has("schema") ? node.get("schema").asText() : null;
        this.timezone = node.has("timezone") ? node.get("timezone").asText() : this.timezone;
        DateTimeZone.forID(this.timezone);
    }

    private String qualified(String table) {
        return schemaName == null || schemaName.isEmpty() ? table : schemaName + "." + table;
    }

    private Connection connect() throws SQLException {
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("JDBC driver " + driverClass + " is not on the classpath", e);
        }
        return user == null ? DriverManager.getConnection(jdbcURL) : DriverManager.getConnection(jdbcURL, user, password);
    }

    /**
     * @throws IllegalStateException if the database cannot be reached; a table that cannot be queried is
     *                               reported at WARN and treated as absent
     */
    @Override
    public List<String> listColumns(String table) {
        try (Connection conn = connect()) {
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT * FROM " + qualified(table) + " WHERE 1 = 0")) {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(meta.getColumnLabel(i));
                }
                return columns;
            } catch (SQLException e) {
                LOG.warn("Table {} could not be queried, treating as absent: {}", qualified(table), e.getMessage());
                return Collections.emptyList();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Could not connect to " + jdbcURL + " to read table " + qualified(table), e);
        }
    }

    @Override
    public PCollection<Row> read(Pipeline pipeline, String table, Schema schema) {
        String query = "SELECT " + String.join(", ", schema.getFieldNames()) + " FROM " + qualified(table);
        String zoneId = this.timezone;
        JdbcIO.Read<Row> read = JdbcIO.<Row>read()
                .withDataSourceConfiguration(config)
                .withQuery(query)
                .withRowMapper(rs -> {
                    DateTimeZone zone = DateTimeZone.forID(zoneId);
                    List<Object> vals = new ArrayList<>();
                    for (Schema.Field field : schema.getFields()) {
                        String f = field.getName();
                        if (rs.getObject(f) == null) {
                            vals.add(null);
                            continue;
                        }
                        Object val;
                        Schema.FieldType type = field.getType();
                        switch (type.getTypeName()) {
                            case INT32:
                                val = rs.getInt(f);
                                break;
                            case INT64:
                                val = rs.getLong(f);
                                break;
                            case FLOAT:
                                val = rs.getFloat(f);
                                break;
                            case DOUBLE:
                                val = rs.getDouble(f);
                                break;
                            case STRING:
                                val = rs.getString(f);
                                break;
                            case DATETIME:
                                // Drivers disagree on temporal types, text form is read in the configured zone
                                Object raw = rs.getObject(f);
                                val = raw instanceof Timestamp
                                        ? new Instant(((Timestamp) raw).getTime())
                                        : Timestamps.parse(raw.toString(), zone);
                                break;
                            case BOOLEAN:
                                val = rs.getBoolean(f);
                                break;
                            default:
                                throw new UnsupportedOperationException("Unsupported sql query return type " + type.getTypeName());
                        }
                        vals.add(val);
                    }
                    return Row.withSchema(schema).addValues(vals).build();
                }).withCoder(RowCoder.of(schema));
        return pipeline.apply("Extract from JDBC " + table, read).setRowSchema(schema);
    }

    @Override
    public void write(String table, PCollection<Row> data) {
        // Dynamically create insert statement
        String[] fields = data.getSchema().getFieldNames().toArray(new String[0]);
        String insertPs = "INSERT INTO " + qualified(table) + "(" + String.join(",", fields) + ") VALUES ("
                + String.join(",", Collections.nCopies(fields.length, "?")) + ")";
        data.apply("Write to JDBC " + table, JdbcIO.<Row>write().withDataSourceConfiguration(config).withStatement(insertPs).withPreparedStatementSetter((r, preparedStatement) -> {
            for (int i = 0; i < fields.length; i++) {
                Object value = r.getValue(fields[i]);
                if (value instanceof ReadableInstant) {
                    value = new Instant(((ReadableInstant) value).getMillis()).toString();
                }
                preparedStatement.setObject(i + 1, value); // JDBC driver should dynamically determine type at runtime to insert
            }
        }));
    }
}
