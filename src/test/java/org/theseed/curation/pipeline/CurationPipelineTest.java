/**
 *
 */
package org.theseed.curation.pipeline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;

/**
 * @author Bruce Parrello
 *
 */
class CurationPipelineTest {

    /**
     * Stage that appends its name to a list of strings.
     */
    private static class AppendStage implements CurationStage<List<String>> {

        private final String name;
        private final StageState provided;
        private final Set<StageState> required;

        public AppendStage(String name, StageState provided, StageState required) {
            this.name = name;
            this.provided = provided;
            this.required = EnumSet.of(required);
        }

        @Override
        public String getName() {
            return this.name;
        }

        @Override
        public Set<StageState> getRequired() {
            return this.required;
        }

        @Override
        public StageState getProvided() {
            return this.provided;
        }

        @Override
        public List<String> apply(List<String> input, CurationReport report) {
            List<String> retVal = new ArrayList<String>(input);
            retVal.add(this.name);
            report.addNote(this.name);
            return retVal;
        }

    }

    @Test
    void testOrdering() throws CurationException {
        List<Integer> checked = new ArrayList<Integer>();
        CurationPipeline<List<String>> pipeline = new CurationPipeline<List<String>>(StageState.LOADED,
                x -> checked.add(x.size()));
        pipeline.add(new AppendStage("names", StageState.COMPARTMENTS_NAMED, StageState.LOADED))
                .add(new AppendStage("boundary", StageState.BOUNDARY_REWRITTEN, StageState.COMPARTMENTS_NAMED))
                .add(new AppendStage("prefix", StageState.PREFIX_STRIPPED, StageState.BOUNDARY_REWRITTEN));
        assertThat("Pipeline does not reach prefix state.", pipeline.reaches(StageState.PREFIX_STRIPPED));
        assertThat("Pipeline reaches translation state.", ! pipeline.reaches(StageState.IDENTIFIERS_TRANSLATED));
        assertThat(pipeline.getStages().size(), equalTo(3));
        List<String> input = new ArrayList<String>();
        CurationReport report = new CurationReport();
        List<String> output = pipeline.run(input, report);
        assertThat(output, contains("names", "boundary", "prefix"));
        assertThat(input, empty());
        assertThat(checked, contains(1, 2, 3));
        assertThat(report.getNotes(), contains("names", "boundary", "prefix"));
        assertThat("Report has problems.", report.isClean());
    }

    @Test
    void testBadOrder() {
        CurationPipeline<List<String>> pipeline = new CurationPipeline<List<String>>(StageState.LOADED, x -> { });
        pipeline.add(new AppendStage("names", StageState.COMPARTMENTS_NAMED, StageState.LOADED));
        assertThrows(IllegalStateException.class,
                () -> pipeline.add(new AppendStage("prefix", StageState.PREFIX_STRIPPED, StageState.BOUNDARY_REWRITTEN)));
    }

    @Test
    void testCheckFailure() {
        CurationPipeline<List<String>> pipeline = new CurationPipeline<List<String>>(StageState.LOADED, x -> {
            if (x.contains("bad"))
                throw new CurationException("bad stage output");
        });
        pipeline.add(new AppendStage("good", StageState.COMPARTMENTS_NAMED, StageState.LOADED))
                .add(new AppendStage("bad", StageState.BOUNDARY_REWRITTEN, StageState.COMPARTMENTS_NAMED))
                .add(new AppendStage("never", StageState.PREFIX_STRIPPED, StageState.BOUNDARY_REWRITTEN));
        CurationReport report = new CurationReport();
        CurationException e = assertThrows(CurationException.class, () -> pipeline.run(new ArrayList<String>(), report));
        assertThat(e.getMessage(), equalTo("bad stage output"));
        assertThat(report.getNotes(), contains("good", "bad"));
    }

}
