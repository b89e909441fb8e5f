/**
 *
 */
package org.theseed.curation.io;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object reads a tab-delimited file into a list of field-named records.  If column names are
 * specified in the constructor, the file has no header line and the names are applied to the
 * columns in order.  Otherwise, the first line is the header.
 *
 * Lines beginning with a pound sign (#) are comments.  Quotes have no special meaning.  A record
 * that is shorter than the header has empty strings in the missing fields.
 *
 * @author Bruce Parrello
 *
 */
public class TabularReader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TabularReader.class);
    /** column names (empty if the file has a header) */
    private String[] names;
    /** list of records read */
    private List<Map<String, String>> results;
    /** column names found */
    private List<String> header;

    /**
     * Construct a tabular reader.
     *
     * @param names		column names for a headerless file; if none, the file has a header line
     */
    public TabularReader(String... names) {
        this.names = names;
        this.results = Collections.emptyList();
        this.header = Collections.emptyList();
    }

    /**
     * @return the CSV format for this reader
     */
    private CSVFormat getFormat() {
        CSVFormat.Builder builder = CSVFormat.TDF.builder().setQuote(null).setCommentMarker('#')
                .setIgnoreEmptyLines(true).setTrim(false).setIgnoreSurroundingSpaces(false);
        if (this.names.length > 0)
            builder.setHeader(this.names);
        else
            builder.setHeader().setSkipHeaderRecord(true);
        return builder.build();
    }

    /**
     * Read the records from a file.
     *
     * @param file		file to read
     *
     * @return this object, for chaining
     *
     * @throws IOException
     */
    public TabularReader parse(File file) throws IOException {
        try (InputStream inStream = new FileInputStream(file)) {
            this.parse(inStream);
        }
        log.info("{} records read from {}.", this.results.size(), file);
        return this;
    }

    /**
     * Read the records from an input stream.
     *
     * @param inStream	input stream to read
     *
     * @return this object, for chaining
     *
     * @throws IOException
     */
    public TabularReader parse(InputStream inStream) throws IOException {
        List<Map<String, String>> records = new ArrayList<Map<String, String>>();
        try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), this.getFormat())) {
            this.header = parser.getHeaderNames();
            for (CSVRecord r : parser) {
                Map<String, String> record = new LinkedHashMap<String, String>(this.header.size() * 4 / 3 + 1);
                for (int i = 0; i < this.header.size(); i++)
                    record.put(this.header.get(i), (i < r.size() ? r.get(i) : ""));
                records.add(record);
            }
        }
        this.results = records;
        return this;
    }

    /**
     * @return the records read
     */
    public List<Map<String, String>> getResults() {
        return this.results;
    }

    /**
     * @return the column names
     */
    public List<String> getHeader() {
        return this.header;
    }

    /**
     * Convenience method to read a headerless file with known column names.
     *
     * @param file		file to read
     * @param names		column names
     *
     * @return the records in the file
     *
     * @throws IOException
     */
    public static List<Map<String, String>> readAll(File file, String... names) throws IOException {
        return new TabularReader(names).parse(file).getResults();
    }

}
