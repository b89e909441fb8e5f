/**
 *
 */
package org.theseed.curation.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
class TabularReaderTest {

    @Test
    void testHeaderless() throws IOException {
        List<Map<String, String>> records = TabularReader.readAll(new File("data", "compartments.tsv"),
                "identifier", "name", "source");
        assertThat(records.size(), equalTo(3));
        assertThat(records.get(0).get("identifier"), equalTo("MNXD1"));
        assertThat(records.get(1).get("name"), equalTo("extracellular region"));
        assertThat(records.get(2).get("source"), equalTo(""));
    }

    @Test
    void testHeadered() throws IOException {
        TabularReader reader = new TabularReader().parse(new File("data", "overrides.tsv"));
        assertThat(reader.getHeader(), contains("identifier", "field", "value"));
        List<Map<String, String>> records = reader.getResults();
        assertThat(records.size(), equalTo(4));
        assertThat(records.get(3).get("identifier"), equalTo("R3"));
        assertThat(records.get(3).get("value"), equalTo("hexokinase"));
    }

    @Test
    void testShortLinesAndQuotes() throws IOException {
        String text = "a\tb\tc\n\"x\ty\n# comment\n\n1\t2\t3\n";
        TabularReader reader = new TabularReader().parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
        List<Map<String, String>> records = reader.getResults();
        assertThat(records.size(), equalTo(2));
        assertThat(records.get(0).get("a"), equalTo("\"x"));
        assertThat(records.get(0).get("c"), equalTo(""));
        assertThat(records.get(1).get("c"), equalTo("3"));
    }

    @Test
    void testWriter() throws IOException {
        StringWriter buffer = new StringWriter();
        try (TabularWriter writer = new TabularWriter(buffer, "identifier", "name")) {
            writer.write(Map.of("identifier", "R1", "name", "hexokinase"));
            writer.write(Map.of("identifier", "R2"));
        }
        assertThat(buffer.toString(), equalTo("identifier\tname\nR1\thexokinase\nR2\t\n"));
    }

}
