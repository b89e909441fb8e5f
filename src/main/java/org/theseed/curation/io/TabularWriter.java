/**
 *
 */
package org.theseed.curation.io;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * This object writes field-named records to a tab-delimited output stream.  A header line with the
 * column names is written first.  Fields missing from a record are written as empty strings.
 *
 * @author Bruce Parrello
 *
 */
public class TabularWriter implements AutoCloseable {

    // FIELDS
    /** underlying printer */
    private CSVPrinter printer;
    /** column names */
    private String[] names;

    /**
     * Open a tabular writer and emit the header line.
     *
     * @param writer	output writer
     * @param names		column names
     *
     * @throws IOException
     */
    public TabularWriter(Writer writer, String... names) throws IOException {
        CSVFormat format = CSVFormat.TDF.builder().setQuote(null).setEscape('\\')
                .setRecordSeparator('\n').setHeader(names).build();
        this.printer = new CSVPrinter(writer, format);
        this.names = names;
    }

    /**
     * Write one record.
     *
     * @param record	map of column names to values
     *
     * @throws IOException
     */
    public void write(Map<String, String> record) throws IOException {
        for (String name : this.names)
            this.printer.print(record.getOrDefault(name, ""));
        this.printer.println();
    }

    /**
     * Write a list of records.
     *
     * @param records	records to write
     *
     * @throws IOException
     */
    public void writeAll(List<Map<String, String>> records) throws IOException {
        for (Map<String, String> record : records)
            this.write(record);
    }

    @Override
    public void close() throws IOException {
        this.printer.close(true);
    }

}
