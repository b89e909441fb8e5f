/**
 *
 */
package org.theseed.curation.refine;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.sbml.jsbml.Reaction;
import org.theseed.curation.CurationConfig;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;
import org.theseed.curation.meta.NormalizeProcessor;
import org.theseed.curation.pipeline.CurationPipeline;
import org.theseed.curation.sbml.ModelTree;

/**
 * @author Bruce Parrello
 *
 */
class TreeTranslationStageTest {

    /**
     * @return a normalized copy of the test model, ready for translation
     */
    private static ModelTree strippedModel() throws IOException, CurationException {
        ModelTree tree = ModelTree.load(new File("data", "model.xml"));
        CurationPipeline<ModelTree> pipeline = NormalizeProcessor.buildPipeline(new CurationConfig(), null);
        return pipeline.run(tree, new CurationReport());
    }

    @Test
    void testTranslationTable() throws IOException, CurationException {
        List<TranslationEdit> edits = EditTables.readTranslations(new File("data", "tree_translations.tsv"));
        CurationPipeline<ModelTree> pipeline = NormalizeProcessor.buildPipeline(new CurationConfig(), edits);
        assertThat(pipeline.getStages().size(), equalTo(4));
        CurationReport report = new CurationReport();
        ModelTree result = pipeline.run(ModelTree.load(new File("data", "model.xml")), report);
        assertThat(result.getSpecies("glucose_c"), not(nullValue()));
        assertThat(result.getSpecies("glucose_e"), not(nullValue()));
        assertThat(result.getSpecies("glucose_b").getCompartment(), equalTo("b"));
        assertThat(result.getSpecies("glc__D_c"), nullValue());
        assertThat(result.getSpecies("adp_c"), nullValue());
        assertThat(result.getSpecies().size(), equalTo(8));
        Reaction hex = result.getReaction("R_HEX1");
        List<String> reactants = hex.getListOfReactants().stream().map(x -> x.getSpecies()).collect(Collectors.toList());
        List<String> products = hex.getListOfProducts().stream().map(x -> x.getSpecies()).collect(Collectors.toList());
        assertThat(reactants, contains("glucose_c", "atp_c"));
        assertThat(products, contains("g6p_c", "atp_c"));
        assertThat(report.getNotes(), hasItem("Species adp_c merged into atp_c."));
        // The only problem is the prefix that could not be stripped.
        assertThat(report.getProblems().size(), equalTo(1));
    }

    @Test
    void testAmbiguity() throws IOException, CurationException {
        ModelTree stripped = strippedModel();
        CurationReport report = new CurationReport();
        TreeTranslationStage stage = new TreeTranslationStage(new CurationConfig(),
                Arrays.asList(new TranslationEdit("10", "ten")));
        ModelTree result = stage.apply(stripped, report);
        List<AmbiguousSubstitutionException> problems = report.getProblems(AmbiguousSubstitutionException.class);
        assertThat(problems.stream().map(x -> x.getMatchedId()).collect(Collectors.toList()),
                containsInAnyOrder("MNXM10_c", "MNXM110_c"));
        assertThat(result.getSpecies("MNXM10_c"), not(nullValue()));
        assertThat(result.getSpecies("MNXM110_c"), not(nullValue()));
        assertThat(result.getSpecies("M_10fthf_c"), not(nullValue()));
    }

    @Test
    void testWholeIdentifier() throws IOException, CurationException {
        ModelTree stripped = strippedModel();
        CurationReport report = new CurationReport();
        TreeTranslationStage stage = new TreeTranslationStage(new CurationConfig(),
                Arrays.asList(new TranslationEdit("MNXM10", "h2o")));
        ModelTree result = stage.apply(stripped, report);
        assertThat(result.getSpecies("h2o_c"), not(nullValue()));
        assertThat(result.getSpecies("MNXM10_c"), nullValue());
        assertThat(result.getSpecies("MNXM110_c"), not(nullValue()));
        assertThat(result.getReaction("R_TEST").getListOfProducts().get(0).getSpecies(), equalTo("h2o_c"));
        assertThat("Report has problems.", report.isClean());
        // The input tree is unchanged.
        assertThat(stripped.getSpecies("MNXM10_c"), not(nullValue()));
    }

}
