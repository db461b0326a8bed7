package org.mitoseeker.enrichment;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ImpactLookup} over a local tab separated impact table, for offline runs.
 * <p>
 * The header must contain {@code genomic_key}, {@code gene} and {@code protein_change}; every other column is kept
 * in {@link ImpactRecord#getFields()}.  Records are indexed by position, so a lookup returns all alleles known at
 * the queried position.
 * </p>
 */
public final class TableImpactLookup implements ImpactLookup {

    private static final Logger logger = LogManager.getLogger(TableImpactLookup.class);

    public static final String GENOMIC_KEY_COLUMN = "genomic_key";
    public static final String GENE_COLUMN = "gene";
    public static final String PROTEIN_CHANGE_COLUMN = "protein_change";

    private final Map<String, List<ImpactRecord>> recordsByPosition;

    public TableImpactLookup(final List<ImpactRecord> records) {
        Utils.nonNull(records, "records");
        final Map<String, List<ImpactRecord>> byPosition = new HashMap<>();
        for ( final ImpactRecord record : records ) {
            byPosition.computeIfAbsent(getPositionKey(record.getGenomicKey()), k -> new ArrayList<>()).add(record);
        }
        byPosition.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.recordsByPosition = Collections.unmodifiableMap(byPosition);
    }

    @Override
    public List<ImpactRecord> lookup(final String genomicKey) {
        Utils.nonNull(genomicKey, "genomicKey");
        return recordsByPosition.getOrDefault(getPositionKey(genomicKey), Collections.emptyList());
    }

    /**
     * @return the {@code chrom:pos} part of a {@code chrom:pos ref>alt} key.
     */
    static String getPositionKey(final String genomicKey) {
        final int space = genomicKey.indexOf(' ');
        return space < 0 ? genomicKey : genomicKey.substring(0, space);
    }

    /**
     * @param tablePath impact table on disk.
     * @throws UserException.CouldNotReadInputFile if the table cannot be read or lacks a mandatory column.
     */
    public static TableImpactLookup fromTable(final Path tablePath) {
        Utils.nonNull(tablePath, "tablePath");
        try ( final Reader reader = Files.newBufferedReader(tablePath, StandardCharsets.UTF_8) ) {
            final List<ImpactRecord> records = readRecords(tablePath, reader);
            logger.info("Read " + records.size() + " impact records from " + tablePath);
            return new TableImpactLookup(records);
        }
        catch ( final IOException ex ) {
            throw new UserException.CouldNotReadInputFile(tablePath, ex);
        }
    }

    private static List<ImpactRecord> readRecords(final Path tablePath, final Reader reader) throws IOException {
        final CSVReader csvReader = new CSVReaderBuilder(reader)
                .withCSVParser(new CSVParserBuilder().withSeparator('\t').withIgnoreQuotations(true).build())
                .build();
        final List<ImpactRecord> records = new ArrayList<>();
        try {
            final String[] header = csvReader.readNext();
            if ( header == null ) {
                throw new UserException.CouldNotReadInputFile(tablePath, "impact table is empty");
            }
            final List<String> columns = new ArrayList<>();
            for ( final String column : header ) {
                columns.add(column.trim());
            }
            final int keyIndex = requireColumn(tablePath, columns, GENOMIC_KEY_COLUMN);
            final int geneIndex = requireColumn(tablePath, columns, GENE_COLUMN);
            final int proteinIndex = requireColumn(tablePath, columns, PROTEIN_CHANGE_COLUMN);

            String[] line;
            while ( (line = csvReader.readNext()) != null ) {
                if ( line.length == 1 && line[0].trim().isEmpty() ) {
                    continue;
                }
                if ( line.length != columns.size() ) {
                    throw new UserException.CouldNotReadInputFile(tablePath,
                            "line " + csvReader.getLinesRead() + " has " + line.length + " columns, expected " + columns.size());
                }
                final Map<String, String> fields = new LinkedHashMap<>();
                for ( int i = 0; i < line.length; ++i ) {
                    if ( i != keyIndex && i != geneIndex && i != proteinIndex ) {
                        fields.put(columns.get(i), line[i]);
                    }
                }
                records.add(new ImpactRecord(line[keyIndex], line[geneIndex], line[proteinIndex], fields));
            }
        }
        catch ( final CsvValidationException ex ) {
            throw new UserException.CouldNotReadInputFile(tablePath, ex);
        }
        return records;
    }

    private static int requireColumn(final Path tablePath, final List<String> columns, final String column) {
        final int index = columns.indexOf(column);
        if ( index < 0 ) {
            throw new UserException.CouldNotReadInputFile(tablePath, "impact table is missing column " + column);
        }
        return index;
    }
}
