package com.raditha.livediff.workflow;

import com.raditha.livediff.analyzer.DumpComparator;
import com.raditha.livediff.config.DiffConfig;
import com.raditha.livediff.model.ComparisonReport;
import com.raditha.livediff.model.DumpModel;
import com.raditha.livediff.parser.DumpParser;
import com.raditha.livediff.report.FileLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads both dumps to completion, then compares them. A file that cannot be read ends the
 * comparison before any report exists.
 */
public class ComparisonWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonWorkflow.class);

    private final DumpParser parser;
    private final DumpComparator comparator;
    private final DiffConfig config;

    public ComparisonWorkflow(DiffConfig config) {
        this(new DumpParser(), new DumpComparator(config.maxChangedVarsPerBlock()), config);
    }

    public ComparisonWorkflow(DumpParser parser, DumpComparator comparator, DiffConfig config) {
        this.parser = parser;
        this.comparator = comparator;
        this.config = config;
    }

    /**
     * Both parsed dumps and the report computed from them.
     */
    public record Outcome(DumpModel left, DumpModel right, ComparisonReport report) {
    }

    /**
     * Parse {@code leftPath} and {@code rightPath} and compare them.
     *
     * @throws IOException if either file cannot be read
     */
    public Outcome run(Path leftPath, Path rightPath) throws IOException {
        logger.info("Comparing {} against {}", leftPath, rightPath);

        DumpModel left = load(leftPath);
        DumpModel right = load(rightPath);
        ComparisonReport report = comparator.compare(left, right);

        logger.info("{} functions only in {}, {} only in {}, {} with differences",
                report.functionsOnlyInLeft().size(), report.leftLabel(),
                report.functionsOnlyInRight().size(), report.rightLabel(),
                report.functionDiffs().size());
        return new Outcome(left, right, report);
    }

    /**
     * Parse one dump, labelling it after its file name.
     */
    public DumpModel load(Path path) throws IOException {
        return parser.parse(path, FileLabels.fileLabel(path, config.labelPrefix()));
    }
}
