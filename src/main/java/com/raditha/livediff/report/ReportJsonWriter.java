package com.raditha.livediff.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.raditha.livediff.model.ComparisonReport;

import java.io.PrintStream;

/**
 * Writes a {@link ComparisonReport} as pretty-printed JSON.
 */
public class ReportJsonWriter {

    private static final String VERSION = "1.0.0";

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Envelope written to the output.
     */
    public record JsonReport(String version, boolean differencesFound, ComparisonReport report) {
    }

    public String toJson(ComparisonReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(new JsonReport(VERSION, report.hasDifferences(), report));
    }

    /**
     * @return the report's exit status
     */
    public int print(ComparisonReport report, PrintStream out) throws JsonProcessingException {
        out.println(toJson(report));
        return report.exitStatus();
    }
}
