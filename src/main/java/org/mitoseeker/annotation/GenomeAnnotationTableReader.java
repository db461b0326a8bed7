package org.mitoseeker.annotation;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import htsjdk.tribble.annotation.Strand;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a tab separated gene/region annotation table into {@link GenomicInterval}s.
 * <p>
 * The first non-comment line is a header naming (in any order) the columns
 * {@code chrom}, {@code start}, {@code end}, {@code strand}, {@code gene} and {@code region}.
 * Lines starting with {@link #COMMENT_PREFIX} and blank lines are ignored.
 * Strand is one of {@code +}, {@code -}, {@code *} or {@code .}; region is one of the {@link RegionClass} tags.
 * </p>
 */
public final class GenomeAnnotationTableReader {

    private static final Logger logger = LogManager.getLogger(GenomeAnnotationTableReader.class);

    public static final String COMMENT_PREFIX = "#";
    public static final char COLUMN_SEPARATOR = '\t';

    public static final String CHROM_COLUMN = "chrom";
    public static final String START_COLUMN = "start";
    public static final String END_COLUMN = "end";
    public static final String STRAND_COLUMN = "strand";
    public static final String GENE_COLUMN = "gene";
    public static final String REGION_COLUMN = "region";

    private static final List<String> MANDATORY_COLUMNS =
            Arrays.asList(CHROM_COLUMN, START_COLUMN, END_COLUMN, STRAND_COLUMN, GENE_COLUMN, REGION_COLUMN);

    private GenomeAnnotationTableReader() {}

    /**
     * @param tablePath annotation table on disk.
     * @return the records of the table in table order.
     * @throws UserException.BadConfiguration if the table does not exist or is malformed.
     */
    public static List<GenomicInterval> readTable(final Path tablePath) {
        Utils.nonNull(tablePath, "the annotation table path cannot be null");
        if ( !Files.isReadable(tablePath) ) {
            throw new UserException.BadConfiguration("Annotation table " + tablePath.toAbsolutePath() + " does not exist or is not readable.");
        }
        try ( final Reader reader = Files.newBufferedReader(tablePath, StandardCharsets.UTF_8) ) {
            return read(tablePath.toString(), reader);
        }
        catch ( final IOException ex ) {
            throw new UserException.BadConfiguration("Could not read annotation table " + tablePath.toAbsolutePath(), ex);
        }
    }

    /**
     * @param resourcePath class path location of an annotation table.
     * @return the records of the table in table order.
     * @throws UserException.BadConfiguration if the resource does not exist or is malformed.
     */
    public static List<GenomicInterval> readResource(final String resourcePath) {
        Utils.nonNull(resourcePath, "the annotation resource cannot be null");
        final InputStream stream = GenomeAnnotationTableReader.class.getClassLoader().getResourceAsStream(resourcePath);
        if ( stream == null ) {
            throw new UserException.BadConfiguration("Annotation table resource " + resourcePath + " is not on the class path.");
        }
        logger.info("Loading annotation table from class path resource " + resourcePath);
        try ( final Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8) ) {
            return read(resourcePath, reader);
        }
        catch ( final IOException ex ) {
            throw new UserException.BadConfiguration("Could not read annotation resource " + resourcePath, ex);
        }
    }

    /**
     * @param sourceName name of the table, used in error messages.
     * @param sourceReader reader over the table contents.  Not closed by this method.
     * @return the records of the table in table order.
     * @throws UserException.BadConfiguration if the table is malformed.
     * @throws IOException if reading fails.
     */
    public static List<GenomicInterval> read(final String sourceName, final Reader sourceReader) throws IOException {
        Utils.nonNull(sourceReader, "the annotation table reader cannot be null");

        final CSVReader csvReader = new CSVReaderBuilder(sourceReader)
                .withCSVParser(new CSVParserBuilder().withSeparator(COLUMN_SEPARATOR).withIgnoreQuotations(true).build())
                .build();

        final List<GenomicInterval> intervals = new ArrayList<>();
        Map<String, Integer> columnIndices = null;

        try {
            String[] line;
            while ( (line = csvReader.readNext()) != null ) {
                if ( isSkippable(line) ) {
                    continue;
                }
                if ( columnIndices == null ) {
                    columnIndices = processColumns(sourceName, csvReader.getLinesRead(), line);
                    continue;
                }
                intervals.add(createRecord(sourceName, csvReader.getLinesRead(), line, columnIndices));
            }
        }
        catch ( final CsvValidationException ex ) {
            throw new UserException.BadConfiguration(sourceName, ex.getLineNumber(), ex.getMessage());
        }

        if ( columnIndices == null ) {
            throw new UserException.BadConfiguration("Annotation table " + sourceName + " has no header line.");
        }
        if ( intervals.isEmpty() ) {
            throw new UserException.BadConfiguration("Annotation table " + sourceName + " contains no records.");
        }
        logger.info("Read " + intervals.size() + " annotation records from " + sourceName);
        return intervals;
    }

    private static boolean isSkippable(final String[] line) {
        return (line.length == 1 && line[0].trim().isEmpty()) || line[0].startsWith(COMMENT_PREFIX);
    }

    private static Map<String, Integer> processColumns(final String sourceName, final long lineNumber, final String[] header) {
        final Map<String, Integer> indices = new HashMap<>();
        for ( int i = 0; i < header.length; ++i ) {
            if ( indices.put(header[i].trim(), i) != null ) {
                throw new UserException.BadConfiguration(sourceName, lineNumber, "duplicate column name " + header[i]);
            }
        }
        for ( final String column : MANDATORY_COLUMNS ) {
            if ( !indices.containsKey(column) ) {
                throw new UserException.BadConfiguration(sourceName, lineNumber, "missing mandatory column " + column);
            }
        }
        return indices;
    }

    private static GenomicInterval createRecord(final String sourceName,
                                                final long lineNumber,
                                                final String[] line,
                                                final Map<String, Integer> columnIndices) {
        if ( line.length < columnIndices.size() ) {
            throw new UserException.BadConfiguration(sourceName, lineNumber,
                    "expected " + columnIndices.size() + " columns but found " + line.length);
        }

        final String contig = line[columnIndices.get(CHROM_COLUMN)].trim();
        final int start = parseCoordinate(sourceName, lineNumber, START_COLUMN, line[columnIndices.get(START_COLUMN)]);
        final int end = parseCoordinate(sourceName, lineNumber, END_COLUMN, line[columnIndices.get(END_COLUMN)]);
        final Strand strand = parseStrand(sourceName, lineNumber, line[columnIndices.get(STRAND_COLUMN)]);
        final String gene = line[columnIndices.get(GENE_COLUMN)].trim();
        final String regionTag = line[columnIndices.get(REGION_COLUMN)].trim();
        final RegionClass region = RegionClass.fromTag(regionTag);

        if ( contig.isEmpty() ) {
            throw new UserException.BadConfiguration(sourceName, lineNumber, "empty chrom");
        }
        if ( gene.isEmpty() ) {
            throw new UserException.BadConfiguration(sourceName, lineNumber, "empty gene name");
        }
        if ( region == null ) {
            throw new UserException.BadConfiguration(sourceName, lineNumber, "unknown region class '" + regionTag + "'");
        }
        if ( start < 1 || end < start ) {
            throw new UserException.BadConfiguration(sourceName, lineNumber, "invalid interval " + start + "-" + end);
        }

        return new GenomicInterval(contig, start, end, strand, gene, region);
    }

    private static int parseCoordinate(final String sourceName, final long lineNumber, final String column, final String value) {
        try {
            return Integer.parseInt(value.trim());
        }
        catch ( final NumberFormatException ex ) {
            throw new UserException.BadConfiguration(sourceName, lineNumber, "non-numeric " + column + " coordinate '" + value + "'");
        }
    }

    private static Strand parseStrand(final String sourceName, final long lineNumber, final String value) {
        switch ( value.trim() ) {
            case "+":
                return Strand.POSITIVE;
            case "-":
                return Strand.NEGATIVE;
            case "*":
            case ".":
                return Strand.NONE;
            default:
                throw new UserException.BadConfiguration(sourceName, lineNumber, "unknown strand '" + value + "'");
        }
    }
}
