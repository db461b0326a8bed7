package org.mitoseeker.tools;

import com.opencsv.CSVWriter;
import org.mitoseeker.coding.ConsequenceAnnotation;
import org.mitoseeker.enrichment.ImpactRecord;
import org.mitoseeker.exceptions.MitoSeekerException;
import org.mitoseeker.pipeline.AnnotatedResult;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.variant.AnnotatedVariant;
import org.mitoseeker.variant.VariantCall;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes {@link AnnotatedResult}s as a tab separated table.
 * <p>
 * There is one row per consequence; a variant without consequences (non-coding, or amino acid changes not computed)
 * gets a single row whose consequence columns are empty.  Columns that do not apply to a row are left empty.
 * </p>
 */
public final class AnnotatedResultWriter implements Closeable {

    public static final char COLUMN_SEPARATOR = '\t';

    public static final List<String> COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "sample", "chrom", "pos", "ref", "alt", "type", "depth", "pass",
            "gene", "overlap_genes", "region", "local_start", "local_end", "start_codon", "end_codon",
            "codon", "ref_aa", "alt_aa", "consequence", "protein_change", "impact"));

    private final CSVWriter outputWriter;
    private final Map<String, Integer> headerMap = new HashMap<>();
    private boolean headerWritten = false;

    /**
     * @param path the destination path.
     * @throws IOException if one was raised when opening the destination file for writing.
     */
    public AnnotatedResultWriter(final Path path) throws IOException {
        this(Files.newBufferedWriter(Utils.nonNull(path, "The path cannot be null."), StandardCharsets.UTF_8));
    }

    /**
     * @param writer the destination writer.  Closed by {@link #close()}.
     */
    public AnnotatedResultWriter(final Writer writer) {
        outputWriter = new CSVWriter(Utils.nonNull(writer, "writer"), COLUMN_SEPARATOR,
                CSVWriter.NO_QUOTE_CHARACTER, CSVWriter.NO_ESCAPE_CHARACTER, CSVWriter.DEFAULT_LINE_END);
        for ( int i = 0; i < COLUMNS.size(); i++ ) {
            headerMap.put(COLUMNS.get(i), i);
        }
    }

    /**
     * Write every variant of {@code result}, writing the header first if it has not been written yet.
     */
    public void write(final AnnotatedResult result) {
        Utils.nonNull(result, "result");
        writeHeaderIfNeeded();

        for ( final AnnotatedVariant variant : result.getAnnotatedVariants() ) {
            final String key = variant.getCall().getGenomicKey();
            final String impact = formatImpact(result.getImpacts().get(key));
            final List<ConsequenceAnnotation> consequences = result.getConsequences(key);

            if ( consequences.isEmpty() ) {
                final String[] row = newRow(result.getSampleName(), variant, impact);
                writeRow(row);
                continue;
            }
            for ( final ConsequenceAnnotation consequence : consequences ) {
                final String[] row = newRow(result.getSampleName(), variant, impact);
                set(row, "codon", String.valueOf(consequence.getCodonIndex()));
                set(row, "ref_aa", consequence.getRefAA());
                set(row, "alt_aa", consequence.getAltAA());
                set(row, "consequence", consequence.getConsequenceClass().getTag());
                set(row, "protein_change", consequence.getProteinChange());
                writeRow(row);
            }
        }
    }

    public void writeAll(final List<AnnotatedResult> results) {
        Utils.nonNull(results, "results");
        writeHeaderIfNeeded();
        results.forEach(this::write);
    }

    private void writeHeaderIfNeeded() {
        if ( !headerWritten ) {
            outputWriter.writeNext(COLUMNS.toArray(new String[0]), false);
            headerWritten = true;
        }
    }

    private String[] newRow(final String sampleName, final AnnotatedVariant variant, final String impact) {
        final VariantCall call = variant.getCall();
        final String[] row = new String[COLUMNS.size()];
        set(row, "sample", sampleName);
        set(row, "chrom", call.getContig());
        set(row, "pos", call.getPositionString());
        set(row, "ref", call.getRefAllele());
        set(row, "alt", call.getAltAllele());
        set(row, "type", call.getType().name());
        set(row, "depth", String.valueOf(call.getDepth()));
        set(row, "pass", String.valueOf(call.isPassFilter()));
        set(row, "gene", variant.getGene());
        set(row, "overlap_genes", variant.getOverlapGeneString());
        set(row, "region", variant.getRegion() == null ? null : variant.getRegion().getTag());
        set(row, "local_start", toStringOrNull(variant.getLocalStart()));
        set(row, "local_end", toStringOrNull(variant.getLocalEnd()));
        set(row, "start_codon", toStringOrNull(variant.getStartCodon()));
        set(row, "end_codon", toStringOrNull(variant.getEndCodon()));
        set(row, "impact", impact);
        return row;
    }

    private void set(final String[] row, final String column, final String value) {
        final Integer index = headerMap.get(column);
        if ( index == null ) {
            throw new MitoSeekerException.ShouldNeverReachHereException("Unknown output column " + column);
        }
        row[index] = value;
    }

    private void writeRow(final String[] row) {
        for ( int i = 0; i < row.length; i++ ) {
            if ( row[i] == null ) {
                row[i] = "";
            }
        }
        outputWriter.writeNext(row, false);
    }

    private static String toStringOrNull(final Integer value) {
        return value == null ? null : value.toString();
    }

    private static String formatImpact(final List<ImpactRecord> records) {
        if ( records == null ) {
            return null;
        }
        return records.stream().map(ImpactRecord::getChange).collect(Collectors.joining(";"));
    }

    @Override
    public void close() throws IOException {
        outputWriter.close();
    }
}
