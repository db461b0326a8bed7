package org.mitoseeker.tools;

import com.opencsv.CSVWriter;
import org.mitoseeker.pipeline.AnnotatedResult;
import org.mitoseeker.pipeline.PipelineResult;
import org.mitoseeker.pipeline.SetFailure;
import org.mitoseeker.pipeline.SkippedRecord;
import org.mitoseeker.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Writes the inputs a {@link PipelineResult} left out as a tab separated table, ordered by variant set.
 * <p>
 * A failed set gets one row with scope {@value #SET_SCOPE} and an empty record column.  Every skipped record of a
 * completed set gets one row with scope {@value #RECORD_SCOPE}.  A run that left nothing out produces only the header.
 * </p>
 */
public final class SkippedInputWriter implements Closeable {

    public static final String SET_SCOPE = "set";
    public static final String RECORD_SCOPE = "record";

    public static final List<String> COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "set_index", "sample", "scope", "record", "reason"));

    private final CSVWriter outputWriter;

    public SkippedInputWriter(final Path path) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(path, "The path cannot be null."), StandardCharsets.UTF_8));
    }

    /**
     * @param writer the destination writer.  Closed by {@link #close()}.
     */
    public SkippedInputWriter(final Writer writer) {
        outputWriter = new CSVWriter(Utils.nonNull(writer, "writer"), AnnotatedResultWriter.COLUMN_SEPARATOR,
                CSVWriter.NO_QUOTE_CHARACTER, CSVWriter.NO_ESCAPE_CHARACTER, CSVWriter.DEFAULT_LINE_END);
    }

    public void write(final PipelineResult result) {
        Utils.nonNull(result, "result");
        outputWriter.writeNext(COLUMNS.toArray(new String[0]), false);

        final List<String[]> rows = new ArrayList<>();
        for ( final SetFailure failure : result.getFailures() ) {
            rows.add(row(failure.getIndex(), failure.getSampleName(), SET_SCOPE, "", failure.getReason()));
        }
        for ( final AnnotatedResult annotated : result.getResults() ) {
            for ( final SkippedRecord skipped : annotated.getSkippedRecords() ) {
                rows.add(row(annotated.getIndex(), annotated.getSampleName(), RECORD_SCOPE, skipped.getRecord(), skipped.getReason()));
            }
        }
        // stable, so records keep their input order within a set
        rows.sort(Comparator.comparingInt(r -> Integer.parseInt(r[0])));
        rows.forEach(r -> outputWriter.writeNext(r, false));
    }

    private static String[] row(final int index, final String sample, final String scope, final String record, final String reason) {
        // one line per row, whatever the reason text holds
        return new String[] { String.valueOf(index), sample, scope, record, reason.replaceAll("[\t\r\n]+", " ") };
    }

    @Override
    public void close() throws IOException {
        outputWriter.close();
    }
}
