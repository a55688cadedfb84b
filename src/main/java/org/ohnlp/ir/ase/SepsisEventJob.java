package org.ohnlp.ir.ase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.join.CoGbkResult;
import org.apache.beam.sdk.transforms.join.CoGroupByKey;
import org.apache.beam.sdk.transforms.join.KeyedPCollectionTuple;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TupleTag;
import org.joda.time.DateTime;
import org.ohnlp.ir.ase.config.AseSettings;
import org.ohnlp.ir.ase.connections.DataConnection;
import org.ohnlp.ir.ase.ehr.datasource.ClifDataSource;
import org.ohnlp.ir.ase.ehr.datasource.ClifTable;
import org.ohnlp.ir.ase.engine.EpisodeOrchestrator;
import org.ohnlp.ir.ase.engine.EventNormalizer;
import org.ohnlp.ir.ase.output.EpisodeRowMapper;
import org.ohnlp.ir.ase.structs.AntimicrobialEvent;
import org.ohnlp.ir.ase.structs.AseEpisode;
import org.ohnlp.ir.ase.structs.BloodCulture;
import org.ohnlp.ir.ase.structs.Hospitalization;
import org.ohnlp.ir.ase.structs.HospitalizationRecord;
import org.ohnlp.ir.ase.structs.LabResult;
import org.ohnlp.ir.ase.structs.PatientDeath;
import org.ohnlp.ir.ase.structs.RespiratoryEvent;
import org.ohnlp.ir.ase.structs.VasopressorEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.util.Iterator;

/**
 * Batch job that identifies Adult Sepsis Events in CLIF-formatted hospitalization data and writes one row per
 * blood culture to the results connection.
 */
public class SepsisEventJob {
    private static final Logger LOG = LoggerFactory.getLogger(SepsisEventJob.class);

    static final TupleTag<Hospitalization> HOSPITALIZATIONS = new TupleTag<>() {};
    static final TupleTag<BloodCulture> BLOOD_CULTURES = new TupleTag<>() {};
    static final TupleTag<AntimicrobialEvent> ANTIMICROBIALS = new TupleTag<>() {};
    static final TupleTag<LabResult> LABS = new TupleTag<>() {};
    static final TupleTag<VasopressorEvent> VASOPRESSORS = new TupleTag<>() {};
    static final TupleTag<RespiratoryEvent> RESPIRATORY_SUPPORT = new TupleTag<>() {};
    static final TupleTag<String> DIAGNOSES = new TupleTag<>() {};
    static final TupleTag<PatientDeath> DEATHS = new TupleTag<>() {};

    public static void main(String... args) throws IOException {
        run(args);
    }

    /**
     * Builds and starts the pipeline, then blocks until it completes and reports the run counters.
     * @return the finished pipeline result
     */
    public static PipelineResult run(String... args) throws IOException {
        // Read in Pipeline Options
        PipelineOptionsFactory.register(JobConfiguration.class);
        JobConfiguration jobConfig = PipelineOptionsFactory.fromArgs(args).withValidation().create().as(JobConfiguration.class);
        // Provision connections and engine settings from config
        ObjectMapper om = new ObjectMapper();
        JsonNode config = readConfig(om, jobConfig.getConfig());
        AseSettings settings = AseSettings.fromJson(config.get("ase"))
                .applyOverrides(jobConfig.getApplyRit(), jobConfig.getRitOnlyHospitalOnset(), jobConfig.getIncludeLactate());
        DataConnection inputConnection = instantiateConnection(config.get("inputConnection"), "inputConnection");
        DataConnection resultsConnection = instantiateConnection(config.get("resultsConnection"), "resultsConnection");

        Pipeline p = Pipeline.create(jobConfig);
        ClifDataSource source = new ClifDataSource(inputConnection, settings);
        PCollection<AseEpisode> episodes = buildEpisodes(p, source, settings);
        resultsConnection.write(jobConfig.getOutputTable(), toRows(episodes));

        LOG.info("Running ASE detection (applyRit={}, ritOnlyHospitalOnset={}, includeLactate={}) into {}",
                settings.isApplyRit(), settings.isRitOnlyHospitalOnset(), settings.isIncludeLactate(),
                jobConfig.getOutputTable());
        PipelineResult result = p.run();
        result.waitUntilFinish();
        logCounters(result);
        return result;
    }

    static JsonNode readConfig(ObjectMapper om, String path) throws IOException {
        if (path != null) {
            return om.readTree(new File(path));
        }
        try (InputStream in = SepsisEventJob.class.getResourceAsStream("/config.json")) {
            if (in == null) {
                throw new IllegalArgumentException("No --config given and no config.json found on the classpath");
            }
            return om.readTree(in);
        }
    }

    static DataConnection instantiateConnection(JsonNode settings, String name) {
        if (settings == null || !settings.has("class")) {
            throw new IllegalArgumentException("Configuration is missing " + name + ".class");
        }
        try {
            DataConnection connection = (DataConnection) instantiateZeroArgumentConstructorClass(settings.get("class").asText());
            connection.loadConfig(settings.get("config"));
            return connection;
        } catch (ClassNotFoundException | NoSuchMethodException | InvocationTargetException |
                 InstantiationException | IllegalAccessException ex) {
            throw new RuntimeException(ex);
        }
    }

    public static Object instantiateZeroArgumentConstructorClass(String clazz)
            throws ClassNotFoundException, NoSuchMethodException, InvocationTargetException,
            InstantiationException, IllegalAccessException {
        return Class.forName(clazz).getDeclaredConstructor().newInstance();
    }

    /**
     * Joins all event tables by hospitalization and runs the engine once per hospitalization.
     */
    public static PCollection<AseEpisode> buildEpisodes(Pipeline p, ClifDataSource source, AseSettings settings) {
        PCollection<KV<String, Hospitalization>> hospitalizations =
                attachDeaths(source.getHospitalizations(p), source.getPatientDeaths(p));
        boolean vasopressorData = source.isAvailable(ClifTable.CONTINUOUS_MEDS);
        boolean ventilationData = source.isAvailable(ClifTable.RESPIRATORY_SUPPORT);
        return KeyedPCollectionTuple.of(HOSPITALIZATIONS, hospitalizations)
                .and(BLOOD_CULTURES, source.getBloodCultures(p))
                .and(ANTIMICROBIALS, source.getAntimicrobials(p))
                .and(LABS, source.getLabs(p))
                .and(VASOPRESSORS, source.getVasopressors(p))
                .and(RESPIRATORY_SUPPORT, source.getRespiratorySupport(p))
                .and(DIAGNOSES, source.getDiagnoses(p))
                .apply("Group events by hospitalization", CoGroupByKey.create())
                .apply("Detect Adult Sepsis Events", ParDo.of(new DetectSepsisEventsFn(settings, vasopressorData, ventilationData)))
                .setCoder(SerializableCoder.of(AseEpisode.class));
    }

    /**
     * Sets each hospitalization's death time from the patient table, re-keyed from patient_id back to
     * hospitalization_id.
     */
    static PCollection<KV<String, Hospitalization>> attachDeaths(PCollection<KV<String, Hospitalization>> hospitalizations,
                                                                 PCollection<KV<String, PatientDeath>> deaths) {
        PCollection<KV<String, Hospitalization>> byPatient = hospitalizations.apply("Key hospitalizations by patient", ParDo.of(
                new DoFn<KV<String, Hospitalization>, KV<String, Hospitalization>>() {
                    @ProcessElement
                    public void process(ProcessContext c) {
                        String patientId = c.element().getValue().getPatientId();
                        c.output(KV.of(patientId == null ? "" : patientId, c.element().getValue()));
                    }
                }
        )).setCoder(KvCoder.of(StringUtf8Coder.of(), SerializableCoder.of(Hospitalization.class)));
        return KeyedPCollectionTuple.of(HOSPITALIZATIONS, byPatient)
                .and(DEATHS, deaths)
                .apply("Group hospitalizations with deaths", CoGroupByKey.create())
                .apply("Attach death times", ParDo.of(
                        new DoFn<KV<String, CoGbkResult>, KV<String, Hospitalization>>() {
                            @ProcessElement
                            public void process(ProcessContext c) {
                                DateTime death = null;
                                if (!c.element().getKey().isEmpty()) {
                                    for (PatientDeath d : c.element().getValue().getAll(DEATHS)) {
                                        if (death == null || d.getDeathDttm().isBefore(death)) {
                                            death = d.getDeathDttm();
                                        }
                                    }
                                }
                                for (Hospitalization in : c.element().getValue().getAll(HOSPITALIZATIONS)) {
                                    Hospitalization out = new Hospitalization(in.getHospitalizationId(), in.getPatientId(),
                                            in.getAdmissionDttm(), in.getDischargeDttm(), in.getDischargeCategory());
                                    out.setDeathDttm(EventNormalizer.effectiveDeathDttm(in, death));
                                    c.output(KV.of(out.getHospitalizationId(), out));
                                }
                            }
                        }
                )).setCoder(KvCoder.of(StringUtf8Coder.of(), SerializableCoder.of(Hospitalization.class)));
    }

    public static PCollection<Row> toRows(PCollection<AseEpisode> episodes) {
        return episodes.apply("Convert episodes to rows", ParDo.of(
                new DoFn<AseEpisode, Row>() {
                    @ProcessElement
                    public void process(ProcessContext c) {
                        c.output(EpisodeRowMapper.toRow(c.element()));
                    }
                }
        )).setRowSchema(EpisodeRowMapper.SCHEMA);
    }

    private static void logCounters(PipelineResult result) {
        Iterable<MetricResult<Long>> counters = result.metrics().queryMetrics(
                MetricsFilter.builder().addNameFilter(MetricNameFilter.inNamespace(SepsisEventJob.class)).build()
        ).getCounters();
        for (MetricResult<Long> counter : counters) {
            LOG.info("{}: {}", counter.getName().getName(), counter.getAttempted());
        }
    }

    /**
     * Assembles a {@link HospitalizationRecord} from the grouped events and runs the {@link EpisodeOrchestrator}.
     * Grouped elements are copied before normalization since the engine annotates them in place.
     */
    static class DetectSepsisEventsFn extends DoFn<KV<String, CoGbkResult>, AseEpisode> {
        private final Counter hospitalizationsProcessed = Metrics.counter(SepsisEventJob.class, "hospitalizations_processed");
        private final Counter culturesEvaluated = Metrics.counter(SepsisEventJob.class, "blood_cultures_evaluated");
        private final Counter culturesSkipped = Metrics.counter(SepsisEventJob.class, "blood_cultures_skipped");
        private final Counter presumedInfections = Metrics.counter(SepsisEventJob.class, "presumed_infections");
        private final Counter sepsisEvents = Metrics.counter(SepsisEventJob.class, "sepsis_events");
        private final Counter ritSuppressed = Metrics.counter(SepsisEventJob.class, "rit_suppressed");

        private final AseSettings settings;
        private final boolean vasopressorData;
        private final boolean ventilationData;
        private transient EpisodeOrchestrator orchestrator;

        DetectSepsisEventsFn(AseSettings settings, boolean vasopressorData, boolean ventilationData) {
            this.settings = settings;
            this.vasopressorData = vasopressorData;
            this.ventilationData = ventilationData;
        }

        @Setup
        public void setup() {
            this.orchestrator = new EpisodeOrchestrator(settings);
        }

        @ProcessElement
        public void process(ProcessContext c) {
            String hospitalizationId = c.element().getKey();
            CoGbkResult events = c.element().getValue();
            Iterator<Hospitalization> hospitalizations = events.getAll(HOSPITALIZATIONS).iterator();
            if (!hospitalizations.hasNext()) {
                int orphans = 0;
                for (BloodCulture ignored : events.getAll(BLOOD_CULTURES)) {
                    orphans++;
                }
                if (orphans > 0) {
                    LOG.warn("Hospitalization {}: {} blood culture(s) without a hospitalization row skipped",
                            hospitalizationId, orphans);
                    culturesSkipped.inc(orphans);
                }
                return;
            }
            Hospitalization hospitalization = hospitalizations.next();
            if (hospitalizations.hasNext()) {
                LOG.warn("Hospitalization {} appears more than once, using the first row", hospitalizationId);
            }
            HospitalizationRecord record = new HospitalizationRecord(hospitalization);
            for (BloodCulture bc : events.getAll(BLOOD_CULTURES)) {
                record.getBloodCultures().add(bc);
                if (bc.getAnchorDttm() == null) {
                    culturesSkipped.inc();
                }
            }
            for (AntimicrobialEvent e : events.getAll(ANTIMICROBIALS)) {
                record.getAntimicrobials().add(new AntimicrobialEvent(e.getHospitalizationId(), e.getAdminDttm(), e.getDrugName(), e.getRoute()));
            }
            for (LabResult l : events.getAll(LABS)) {
                record.getLabs().add(new LabResult(l.getHospitalizationId(), l.getCategory(), l.getValue(), l.getResultDttm()));
            }
            events.getAll(VASOPRESSORS).forEach(record.getVasopressors()::add);
            events.getAll(RESPIRATORY_SUPPORT).forEach(record.getRespiratorySupport()::add);
            for (String code : events.getAll(DIAGNOSES)) {
                if (EventNormalizer.isEsrdCode(code)) {
                    record.setEsrd(true);
                    break;
                }
            }
            record.setVasopressorDataAvailable(vasopressorData);
            record.setVentilationDataAvailable(ventilationData);

            hospitalizationsProcessed.inc();
            for (AseEpisode episode : orchestrator.process(record)) {
                culturesEvaluated.inc();
                if (episode.isPresumedInfection()) {
                    presumedInfections.inc();
                }
                if (episode.isSepsis()) {
                    sepsisEvents.inc();
                }
                if (episode.isRitSuppressed()) {
                    ritSuppressed.inc();
                }
                c.output(episode);
            }
        }
    }
}
