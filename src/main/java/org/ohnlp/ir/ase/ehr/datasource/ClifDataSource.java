package org.ohnlp.ir.ase.ehr.datasource;

import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.connections.DataConnection;
import org.ohnlp.ir.ase.exceptions.MissingRequiredTableException;
import org.ohnlp.ir.ase.structs.AntimicrobialEvent;
import org.ohnlp.ir.ase.structs.BloodCulture;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.LabResult;
import org.ohnlp.ir.ase.structs.PatientDeath;
import org.ohnlp.ir.ase.structs.RespiratoryEvent;
import org.ohnlp.ir.ase.structs.VasopressorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Exposes the CLIF tables of a {@link DataConnection} as keyed collections of engine records.
 * <p>
 * Tables are resolved when the data source is created: a missing required table fails immediately, a
 * missing optional table is reported once and read as an empty collection.
 */
public class ClifDataSource {
    private static final Logger LOG = LoggerFactory.getLogger(ClifDataSource.class);

    private final DataConnection connection;
    private final AseSettings settings;
    private final Map<ClifTable, ResolvedTable> resolved = new EnumMap<>(ClifTable.class);

    public ClifDataSource(DataConnection connection, AseSettings settings) {
        this.connection = connection;
        this.settings = settings;
        for (ClifTable table : ClifTable.values()) {
            ResolvedTable r = resolve(table);
            if (r != null) {
                resolved.put(table, r);
            }
        }
    }

    private ResolvedTable resolve(ClifTable table) {
        for (String name : table.getTableNames()) {
            List<String> columns = connection.listColumns(name);
            if (columns.isEmpty()) {
                continue;
            }
            Map<String, String> bound = ResolvedTable.bindColumns(table, columns);
            List<String> missing = new ArrayList<>();
            for (ClifTable.Column column : table.getColumns()) {
                if (column.isRequired() && !bound.containsKey(column.getName())) {
                    missing.add(column.getName());
                }
            }
            // cultures are anchored on collect_dttm, falling back to order_dttm
            if (table == ClifTable.BLOOD_CULTURES && !bound.containsKey("collect_dttm") && !bound.containsKey("order_dttm")) {
                missing.add("collect_dttm or order_dttm");
            }
            if (!missing.isEmpty()) {
                if (table.isRequired()) {
                    throw new MissingRequiredTableException(name,
                            "Table " + name + " is missing required column(s) " + missing);
                }
                LOG.warn("Optional table {} is missing column(s) {} and will not be used", name, missing);
                return null;
            }
            LOG.info("Resolved {} to table {} with columns {}", table.getLogicalName(), name, bound);
            return new ResolvedTable(table, name, bound);
        }
        if (table.isRequired()) {
            throw new MissingRequiredTableException(table.getLogicalName(),
                    "Required table " + table.getLogicalName() + " not found, tried " + table.getTableNames());
        }
        LOG.warn("Optional table {} not found, dependent criteria are skipped for all hospitalizations",
                table.getLogicalName());
        return null;
    }

    public boolean isAvailable(ClifTable table) {
        return resolved.containsKey(table);
    }

    public ResolvedTable getResolvedTable(ClifTable table) {
        return resolved.get(table);
    }

    public PCollection<KV<String, Hospitalization>> getHospitalizations(Pipeline pipeline) {
        return read(pipeline, ClifTable.HOSPITALIZATION, SerializableCoder.of(Hospitalization.class),
                new ClifRowMapper(resolved.get(ClifTable.HOSPITALIZATION), settings)::toHospitalization);
    }

    public PCollection<KV<String, BloodCulture>> getBloodCultures(Pipeline pipeline) {
        return read(pipeline, ClifTable.BLOOD_CULTURES, SerializableCoder.of(BloodCulture.class),
                new ClifRowMapper(resolved.get(ClifTable.BLOOD_CULTURES), settings)::toBloodCulture);
    }

    public PCollection<KV<String, AntimicrobialEvent>> getAntimicrobials(Pipeline pipeline) {
        return read(pipeline, ClifTable.ANTIMICROBIALS, SerializableCoder.of(AntimicrobialEvent.class),
                new ClifRowMapper(resolved.get(ClifTable.ANTIMICROBIALS), settings)::toAntimicrobial);
    }

    public PCollection<KV<String, LabResult>> getLabs(Pipeline pipeline) {
        return read(pipeline, ClifTable.LABS, SerializableCoder.of(LabResult.class),
                new ClifRowMapper(resolved.get(ClifTable.LABS), settings)::toLab);
    }

    public PCollection<KV<String, VasopressorEvent>> getVasopressors(Pipeline pipeline) {
        return read(pipeline, ClifTable.CONTINUOUS_MEDS, SerializableCoder.of(VasopressorEvent.class),
                new ClifRowMapper(resolved.get(ClifTable.CONTINUOUS_MEDS), settings)::toVasopressor);
    }

    public PCollection<KV<String, RespiratoryEvent>> getRespiratorySupport(Pipeline pipeline) {
        return read(pipeline, ClifTable.RESPIRATORY_SUPPORT, SerializableCoder.of(RespiratoryEvent.class),
                new ClifRowMapper(resolved.get(ClifTable.RESPIRATORY_SUPPORT), settings)::toRespiratory);
    }

    /**
     * @return deaths keyed by patient_id
     */
    public PCollection<KV<String, PatientDeath>> getPatientDeaths(Pipeline pipeline) {
        return read(pipeline, ClifTable.PATIENT, SerializableCoder.of(PatientDeath.class),
                new ClifRowMapper(resolved.get(ClifTable.PATIENT), settings)::toPatientDeath);
    }

    public PCollection<KV<String, String>> getDiagnoses(Pipeline pipeline) {
        return read(pipeline, ClifTable.HOSPITAL_DIAGNOSIS, StringUtf8Coder.of(),
                new ClifRowMapper(resolved.get(ClifTable.HOSPITAL_DIAGNOSIS), settings)::toDiagnosis);
    }

    private <T> PCollection<KV<String, T>> read(Pipeline pipeline, ClifTable table, Coder<T> coder,
                                               SerializableFunction<Row, KV<String, T>> mapper) {
        KvCoder<String, T> kvCoder = KvCoder.of(StringUtf8Coder.of(), coder);
        ResolvedTable source = resolved.get(table);
        if (source == null) {
            return pipeline.apply("No " + table.getLogicalName(), Create.empty(kvCoder));
        }
        PCollection<Row> rows = connection.read(pipeline, source.getPhysicalName(), source.getSchema());
        return mapRows(rows, table.getLogicalName(), mapper).setCoder(kvCoder);
    }

    private static <T> PCollection<KV<String, T>> mapRows(PCollection<Row> rows, String name,
                                                         SerializableFunction<Row, KV<String, T>> mapper) {
        return rows.apply("Normalize " + name, ParDo.of(new DoFn<Row, KV<String, T>>() {
            private final Counter filtered = Metrics.counter(ClifDataSource.class, name + "_rows_filtered");

            @ProcessElement
            public void process(@Element Row in, OutputReceiver<KV<String, T>> out) {
                KV<String, T> mapped = mapper.apply(in);
                if (mapped == null) {
                    filtered.inc();
                } else {
                    out.output(mapped);
                }
            }
        }));
    }
}
