package org.ohnlp.ir.ase;

import org.apache.beam.sdk.options.Default;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;

public interface JobConfiguration extends PipelineOptions {
    @Description("Path to the JSON job configuration. When unset, config.json is read from the classpath")
    String getConfig();
    void setConfig(String config);

    @Description("Apply the 14-day repeat infection timeframe, overriding the configured value")
    Boolean getApplyRit();
    void setApplyRit(Boolean applyRit);

    @Description("Apply the repeat infection timeframe to hospital-onset episodes only, overriding the configured value")
    Boolean getRitOnlyHospitalOnset();
    void setRitOnlyHospitalOnset(Boolean ritOnlyHospitalOnset);

    @Description("Count lactate as an organ dysfunction criterion, overriding the configured value")
    Boolean getIncludeLactate();
    void setIncludeLactate(Boolean includeLactate);

    @Description("The results table episodes are written to")
    @Default.String("ase_episodes")
    String getOutputTable();
    void setOutputTable(String outputTable);
}
