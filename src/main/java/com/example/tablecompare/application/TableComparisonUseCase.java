package com.example.tablecompare.application;

import com.example.tablecompare.domain.ComparisonRequest;
import com.example.tablecompare.domain.ComparisonResult;
import com.example.tablecompare.domain.ComparisonTiming;
import com.example.tablecompare.domain.CorrectedFile;
import com.example.tablecompare.domain.Difference;
import com.example.tablecompare.domain.StepTiming;
import com.example.tablecompare.domain.Table;
import com.example.tablecompare.domain.TableInput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Service
public class TableComparisonUseCase {
    private static final Logger log = LogManager.getLogger(TableComparisonUseCase.class);
    private static final String FALLBACK_FILE_NAME = "file.csv";

    private final TableReader tableReader;
    private final TableWriter tableWriter;
    private final TableDiffer tableDiffer;
    private final PatchApplier patchApplier;
    private final String correctedFilePrefix;

    public TableComparisonUseCase(
            TableReader tableReader,
            TableWriter tableWriter,
            TableDiffer tableDiffer,
            PatchApplier patchApplier,
            @Value("${table-compare.corrected-file-prefix:corrected_}") String correctedFilePrefix) {
        this.tableReader = tableReader;
        this.tableWriter = tableWriter;
        this.tableDiffer = tableDiffer;
        this.patchApplier = patchApplier;
        this.correctedFilePrefix = correctedFilePrefix != null ? correctedFilePrefix : "";
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(List<StepTiming> timings, String label, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        timings.add(new StepTiming(label, seconds));
        return seconds;
    }

    /** Both inputs are read completely before either is parsed. */
    public ComparisonResult compare(ComparisonRequest request) throws IOException {
        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();

        long readStart = System.nanoTime();
        String originalText = request.original().readText();
        String updatedText = request.updated().readText();
        double readSeconds = recordStep(timings, "Read inputs", readStart);
        log.info(
                "Read {} and {} in {}s",
                request.original().filename(),
                request.updated().filename(),
                readSeconds);

        long originalParseStart = System.nanoTime();
        Table original = tableReader.read(originalText);
        double originalParseSeconds =
                recordStep(timings, "Parse table (original)", originalParseStart);
        log.info("Parsed original table in {}s", originalParseSeconds);

        long updatedParseStart = System.nanoTime();
        Table updated = tableReader.read(updatedText);
        double updatedParseSeconds = recordStep(timings, "Parse table (updated)", updatedParseStart);
        log.info("Parsed updated table in {}s", updatedParseSeconds);

        ComparisonResult result =
                diff(
                        request.original().filename(),
                        original,
                        request.updated().filename(),
                        updated,
                        timings);
        result.setTiming(
                new ComparisonTiming(timings, nanosToSeconds(System.nanoTime() - overallStart)));
        return result;
    }

    /**
     * Compares the session's original table against a new updated file and replaces the
     * session's difference batch with the result.
     */
    public ComparisonResult recompare(ReconciliationSession session, TableInput updatedInput)
            throws IOException {
        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();

        long readStart = System.nanoTime();
        String updatedText = updatedInput.readText();
        recordStep(timings, "Read inputs", readStart);

        long parseStart = System.nanoTime();
        Table updated = tableReader.read(updatedText);
        recordStep(timings, "Parse table (updated)", parseStart);

        ComparisonResult result =
                diff(
                        session.getOriginalName(),
                        session.getOriginal(),
                        updatedInput.filename(),
                        updated,
                        timings);
        result.setTiming(
                new ComparisonTiming(timings, nanosToSeconds(System.nanoTime() - overallStart)));
        session.replaceRun(result);
        log.info(
                "Re-ran comparison {} against {}: {} differences",
                session.getId(),
                updatedInput.filename(),
                result.getDifferences().size());
        return result;
    }

    public CorrectedFile correct(ReconciliationSession session) {
        long start = System.nanoTime();
        ReconciliationStore store = session.getStore();
        List<Difference> accepted = store.accepted();
        Table corrected = patchApplier.apply(session.getOriginal(), accepted);
        String content = tableWriter.write(corrected);
        log.info(
                "Built corrected table for comparison {} from {} accepted differences in {}s",
                session.getId(),
                accepted.size(),
                nanosToSeconds(System.nanoTime() - start));
        return new CorrectedFile(
                correctedFileName(session.getOriginalName()), content, accepted.size());
    }

    String correctedFileName(String originalName) {
        String base =
                originalName == null || originalName.isBlank()
                        ? FALLBACK_FILE_NAME
                        : originalName.trim();
        return correctedFilePrefix + base;
    }

    private ComparisonResult diff(
            String originalName,
            Table original,
            String updatedName,
            Table updated,
            List<StepTiming> timings) {
        long diffStart = System.nanoTime();
        List<Difference> differences = tableDiffer.diff(original, updated);
        double diffSeconds = recordStep(timings, "Diff tables", diffStart);
        log.info("Found {} differences in {}s", differences.size(), diffSeconds);
        return new ComparisonResult(originalName, updatedName, original, updated, differences);
    }
}
