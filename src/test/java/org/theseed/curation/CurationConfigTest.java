/**
 *
 */
package org.theseed.curation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
class CurationConfigTest {

    @Test
    void testPropertyFile() throws IOException {
        CurationConfig config = new CurationConfig(new File("data", "curation.properties"));
        assertThat(config.getBoundaryName(), equalTo("límite del modelo"));
        assertThat(config.getSpeciesPrefix(), equalTo("S_"));
        assertThat(config.getBoundaryId(), equalTo("b"));
        assertThat(config.getExtracellularName(), equalTo("extracellular region"));
    }

}
