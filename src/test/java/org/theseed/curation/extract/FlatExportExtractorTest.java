/**
 *
 */
package org.theseed.curation.extract;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.model.Metabolite;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.model.Reaction.Participant;
import org.theseed.curation.model.Reaction.Role;
import org.theseed.curation.parse.MalformedEquationException;
import org.theseed.curation.refine.DanglingReferenceException;
import org.theseed.curation.refine.ModelIntegrityCheck;
import org.theseed.curation.refine.ModelRefiner;

/**
 * @author Bruce Parrello
 *
 */
class FlatExportExtractorTest {

    /**
     * @return an extractor for the test export
     *
     * @throws IOException
     */
    private static FlatExportExtractor testExtractor() throws IOException {
        return FlatExportExtractor.load(new File("data", "genes.tsv"), new File("data", "compartments.tsv"),
                new File("data", "metabolites.tsv"), new File("data", "reactions.tsv"));
    }

    @Test
    void testExtraction() throws IOException {
        CurationReport report = new CurationReport();
        CuratedModel model = testExtractor().extract(report);
        assertThat(model.getCompartmentCount(), equalTo(3));
        assertThat(model.getCompartment("MNXD2").getName(), equalTo("extracellular region"));
        assertThat(model.getMetaboliteCount(), equalTo(7));
        // Check a fully-specified metabolite.
        Metabolite glc = model.getMetabolite("MNXM41");
        assertThat(glc.getName(), equalTo("D-glucose"));
        assertThat(glc.getFormula(), equalTo("C6H12O6"));
        assertThat(glc.getMass(), closeTo(180.156, 0.0001));
        assertThat(glc.getCharge(), equalTo(0));
        assertThat(glc.getReferences().get("chebi"), contains("4167"));
        assertThat(glc.getReferences().get("hmdb"), contains("HMDB0000122"));
        assertThat(glc.getReferences().get("metanetx"), contains("MNXM41", "MNXM99"));
        assertThat(glc.getReferences().get("bigg"), contains("glc__D"));
        assertThat(glc.getReferences().get("kegg"), empty());
        Metabolite water = model.getMetabolite("MNXM2");
        assertThat(water.getReferences().get("chebi"), contains("15377", "1234"));
        assertThat(water.getReferences().get("metanetx"), contains("MNXM2"));
        // Missing and invalid numbers.
        Metabolite g6p = model.getMetabolite("MNXM160");
        assertThat("Blank mass was parsed.", ! g6p.hasMass());
        assertThat(g6p.getCharge(), equalTo(-2));
        Metabolite pi = model.getMetabolite("MNXM9");
        assertThat("Invalid mass was parsed.", ! pi.hasMass());
        assertThat(pi.getCharge(), nullValue());
        // R4 has a malformed equation and R6 refers to a missing metabolite.
        assertThat(model.getReactionCount(), equalTo(4));
        assertThat(model.getReaction("R4"), nullValue());
        assertThat(model.getReaction("R6"), nullValue());
        Reaction hex = model.getReaction("R3");
        assertThat("R3 is reversible.", ! hex.isReversible());
        assertThat(hex.getEquation(), startsWith("1 MNXM41@MNXD1 + 1 MNXM3@MNXD1"));
        assertThat(hex.getParticipants().size(), equalTo(5));
        assertThat(hex.getReactants(), contains(new Participant("MNXM41", "MNXD1", 1.0, Role.REACTANT),
                new Participant("MNXM3", "MNXD1", 1.0, Role.REACTANT)));
        assertThat(hex.getProducts().size(), equalTo(3));
        assertThat(hex.getGenes(), contains("HGNC:4922", "HGNC:4923"));
        assertThat(hex.getProcesses(), contains("Glycolysis", "Hexose metabolism"));
        assertThat(hex.getReferences().get("model"), contains("HEX1"));
        assertThat(hex.getReferences().get("metanetx"), contains("MNXR3"));
        assertThat(hex.getReferences().get("enzyme_commission"), contains("2.7.1.1", "2.7.1.2"));
        assertThat(hex.getReferences().get("rhea"), contains("22740"));
        assertThat(hex.getReferences().get("kegg"), contains("R00299"));
        Reaction ex = model.getReaction("R1");
        assertThat("R1 is not reversible.", ex.isReversible());
        assertThat(ex.getGenes(), empty());
        assertThat(ex.getReferences().get("enzyme_commission"), empty());
        Reaction trans = model.getReaction("R2");
        assertThat(trans.getReferences().get("metanetx"), contains("MNXR2", "MNXR9"));
        Reaction rev = model.getReaction("R5");
        assertThat(rev.getParticipants(), contains(new Participant("MNXM9", "MNXD1", 2.0, Role.REACTANT),
                new Participant("MNXM2", "MNXD1", 1.0, Role.PRODUCT)));
        assertThat(rev.getGenes(), empty());
        // Verify the problems.
        List<MalformedEquationException> badEquations = report.getProblems(MalformedEquationException.class);
        assertThat(badEquations.size(), equalTo(1));
        assertThat(badEquations.get(0).getReactionId(), equalTo("R4"));
        List<MissingReferenceRecordException> missing = report.getProblems(MissingReferenceRecordException.class);
        assertThat(missing.size(), equalTo(1));
        assertThat(missing.get(0).getEntityId(), equalTo("R5"));
        List<DanglingReferenceException> dangling = report.getProblems(DanglingReferenceException.class);
        assertThat(dangling.size(), equalTo(1));
        assertThat(dangling.get(0).getViolations().get(0).getOwnerId(), equalTo("R6"));
        assertThat(dangling.get(0).getViolations().get(0).getReferenceId(), equalTo("MNXM999"));
        assertThat(report.getProblems().size(), equalTo(3));
        assertThat(ModelIntegrityCheck.findViolations(model), empty());
    }

    @Test
    void testMetaboliteRecord() {
        Map<String, String> record = Map.of(FlatExportExtractor.METABOLITE_ID, "MNXM1",
                FlatExportExtractor.METABOLITE_NAME, "H(+)", FlatExportExtractor.METABOLITE_SOURCE, "bigg:h",
                FlatExportExtractor.METABOLITE_FORMULA, "H", FlatExportExtractor.METABOLITE_MASS, "1.00794",
                FlatExportExtractor.METABOLITE_CHARGE, " 1 ",
                FlatExportExtractor.METABOLITE_REFERENCE, "chebi:15378;bigg:h;deprecated:MNXM145872;deprecated:MNXM1");
        Metabolite met = FlatExportExtractor.extractMetabolite(record);
        assertThat(met.getCharge(), equalTo(1));
        assertThat(met.getReferences().get("bigg"), contains("h"));
        assertThat(met.getReferences().get("metanetx"), contains("MNXM1", "MNXM145872"));
        for (MetaboliteCategory category : MetaboliteCategory.values())
            assertThat(category.toString(), met.getReferences().asMap(), hasKey(category.toString()));
    }

    @Test
    void testRefineExtracted() throws IOException, CurationException {
        CuratedModel model = testExtractor().extract(new CurationReport());
        CurationReport report = new CurationReport();
        ModelRefiner refiner = new ModelRefiner().load(new File("data", "translations.tsv"),
                new File("data", "metabolite_removals.tsv"), new File("data", "reaction_removals.tsv"),
                new File("data", "overrides.tsv"));
        CuratedModel refined = refiner.refine(model, report);
        assertThat(refined.getMetabolite("glc__D").getName(), equalTo("glucose"));
        assertThat(refined.getMetabolite("atp"), not(nullValue()));
        assertThat(refined.getMetabolite("MNXM9"), nullValue());
        assertThat(refined.getMetabolite("MNXM160").getMass(), closeTo(259.1, 0.001));
        assertThat(refined.getReaction("R5"), nullValue());
        assertThat(refined.getReaction("R3").getName(), equalTo("hexokinase"));
        assertThat(refined.getReaction("R3").getReactants(), contains(
                new Participant("glc__D", "MNXD1", 1.0, Role.REACTANT), new Participant("atp", "MNXD1", 1.0, Role.REACTANT)));
        assertThat(refined.getReaction("R1").getParticipants().get(1).getMetaboliteId(), equalTo("glc__D"));
        assertThat("Report has problems.", report.isClean());
    }

}
