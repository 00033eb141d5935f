package gr.imsi.athenarc.cli.util;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.regexnfa.manager.TestCaseResult;
import gr.imsi.athenarc.regexnfa.manager.TestSuiteResult;

/**
 * Writes test suite verdicts as CSV: one row per tested string.
 */
public class TestSuiteCsvWriter {
    private static final Logger LOG = LoggerFactory.getLogger(TestSuiteCsvWriter.class);

    public static void write(TestSuiteResult suite, Path outFile) throws IOException {
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }

        try (FileWriter fileWriter = new FileWriter(outFile.toFile(), StandardCharsets.UTF_8, false)) {
            CsvWriterSettings csvWriterSettings = new CsvWriterSettings();
            CsvWriter csvWriter = new CsvWriter(fileWriter, csvWriterSettings);

            csvWriter.writeHeaders("regex", "test #", "string", "result");
            int index = 0;
            for (TestCaseResult result : suite.getResults()) {
                csvWriter.addValue(suite.getExpression());
                csvWriter.addValue(index++);
                csvWriter.addValue(result.getInput());
                csvWriter.addValue(result.getVerdict());
                csvWriter.writeValuesToRow();
            }
            csvWriter.flush();
        }
        LOG.info("Wrote {} test results to {}", suite.size(), outFile);
    }
}
