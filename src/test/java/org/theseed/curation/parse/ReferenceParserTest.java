/**
 *
 */
package org.theseed.curation.parse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
class ReferenceParserTest {

    @Test
    void testExtract() {
        assertThat(ReferenceParser.extract("chebi:15377;kegg:C00001;chebi:1234", "chebi:"), contains("15377", "1234"));
        assertThat(ReferenceParser.extract("chebi:15377;kegg:C00001;chebi:1234", "kegg:"), contains("C00001"));
        assertThat(ReferenceParser.extract("chebi:15377;kegg:C00001", "hmdb:"), empty());
        assertThat(ReferenceParser.extract(null, "hmdb:"), empty());
        assertThat(ReferenceParser.extract("", "hmdb:"), empty());
        // The key need not be at the start of the item.
        assertThat(ReferenceParser.extract("xchebi:99;chebi:15377", "chebi:"), contains("x99", "15377"));
    }

    @Test
    void testExtractAll() {
        assertThat(ReferenceParser.extractAll("bigg:", "bigg:glc__D;chebi:4167", "bigg:glc_D;bigg:glc__D"),
                contains("glc__D", "glc_D"));
        assertThat(ReferenceParser.extractAll("bigg:", null, "bigg:h2o"), contains("h2o"));
    }

    @Test
    void testSplit() {
        assertThat(ReferenceParser.split("2.7.1.1; 2.7.1.2;;"), contains("2.7.1.1", "2.7.1.2"));
        assertThat(ReferenceParser.split(""), empty());
        assertThat(ReferenceParser.split(null), empty());
    }

}
