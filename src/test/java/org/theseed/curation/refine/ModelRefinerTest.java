/**
 *
 */
package org.theseed.curation.refine;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;
import org.theseed.curation.model.Compartment;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.model.Metabolite;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.model.Reaction.Participant;
import org.theseed.curation.model.Reaction.Role;

/**
 * @author Bruce Parrello
 *
 */
class ModelRefinerTest {

    /**
     * @return a small model with four metabolites and two reactions
     */
    private static CuratedModel smallModel() {
        CuratedModel retVal = new CuratedModel();
        retVal.addCompartment(new Compartment("c", "cytosol"));
        retVal.addCompartment(new Compartment("e", "extracellular region"));
        for (String id : new String[] { "MNXM41", "MNXM3", "MNXM7", "MNXM160", "glc_alt" }) {
            Metabolite met = new Metabolite(id, id + " name", "");
            met.getReferences().put("metanetx", List.of(id));
            retVal.addMetabolite(met);
        }
        Reaction hex = new Reaction("HEX", "", false);
        hex.setParticipants(List.of(new Participant("MNXM41", "c", 1.0, Role.REACTANT),
                new Participant("MNXM3", "c", 1.0, Role.REACTANT), new Participant("MNXM160", "c", 1.0, Role.PRODUCT),
                new Participant("MNXM7", "c", 1.0, Role.PRODUCT)));
        retVal.addReaction(hex);
        Reaction trans = new Reaction("GLCt", "", true);
        trans.setParticipants(List.of(new Participant("glc_alt", "e", 1.0, Role.REACTANT),
                new Participant("MNXM41", "c", 1.0, Role.PRODUCT)));
        retVal.addReaction(trans);
        return retVal;
    }

    @Test
    void testTranslation() throws CurationException {
        CuratedModel model = smallModel();
        CurationReport report = new CurationReport();
        ModelRefiner refiner = new ModelRefiner().setTranslations(List.of(new TranslationEdit("MNXM41", "glc__D"),
                new TranslationEdit("glc__D", "glucose"), new TranslationEdit("MNXM4", "bogus")));
        CuratedModel refined = refiner.refine(model, report);
        // Table order is execution order, so the second row sees the result of the first.
        assertThat(refined.getMetabolite("glucose"), not(nullValue()));
        assertThat(refined.getMetabolite("glc__D"), nullValue());
        assertThat(refined.getMetabolite("MNXM41"), nullValue());
        assertThat(refined.getMetabolite("glucose").getName(), equalTo("MNXM41 name"));
        assertThat(refined.getReaction("HEX").getParticipants().get(0).getMetaboliteId(), equalTo("glucose"));
        assertThat(refined.getReaction("GLCt").getParticipants().get(1).getMetaboliteId(), equalTo("glucose"));
        // Exact match means no collision with MNXM41.
        assertThat(refined.getMetabolite("MNXM3"), not(nullValue()));
        assertThat("Report has problems.", report.isClean());
        // The input is unchanged.
        assertThat(model.getMetabolite("MNXM41"), not(nullValue()));
        assertThat(model.getReaction("HEX").getParticipants().get(0).getMetaboliteId(), equalTo("MNXM41"));
    }

    @Test
    void testMerge() throws CurationException {
        CuratedModel model = smallModel();
        CurationReport report = new CurationReport();
        ModelRefiner refiner = new ModelRefiner().setTranslations(List.of(new TranslationEdit("glc_alt", "MNXM41")));
        CuratedModel refined = refiner.refine(model, report);
        assertThat(refined.getMetaboliteCount(), equalTo(4));
        assertThat(refined.getMetabolite("glc_alt"), nullValue());
        assertThat(refined.getMetabolite("MNXM41").getReferences().get("metanetx"), contains("MNXM41", "glc_alt"));
        assertThat(refined.getReaction("GLCt").getParticipants().get(0).getMetaboliteId(), equalTo("MNXM41"));
        assertThat(report.getNotes(), hasItem(containsString("glc_alt merged into MNXM41")));
    }

    @Test
    void testRemovals() throws CurationException {
        CuratedModel model = smallModel();
        CurationReport report = new CurationReport();
        ModelRefiner refiner = new ModelRefiner()
                .setMetaboliteRemovals(List.of(new MetaboliteRemoval("glc_alt", "MNXM41"),
                        new MetaboliteRemoval("MNXM999", "MNXM41")))
                .setReactionRemovals(List.of("HEX", "NONE"));
        CuratedModel refined = refiner.refine(model, report);
        assertThat(refined.getMetabolite("glc_alt"), nullValue());
        assertThat(refined.getMetaboliteCount(), equalTo(4));
        assertThat(refined.getReaction("HEX"), nullValue());
        assertThat(refined.getReactionCount(), equalTo(1));
        Reaction trans = refined.getReaction("GLCt");
        assertThat(trans.getParticipants().get(0), equalTo(new Participant("MNXM41", "e", 1.0, Role.REACTANT)));
        assertThat(report.getNotes(), hasItem(containsString("NONE")));
    }

    @Test
    void testDangling() {
        CuratedModel model = smallModel();
        ModelRefiner refiner = new ModelRefiner()
                .setMetaboliteRemovals(List.of(new MetaboliteRemoval("MNXM3", "")));
        DanglingReferenceException e = assertThrows(DanglingReferenceException.class,
                () -> refiner.refine(model, new CurationReport()));
        assertThat(e.getViolations().size(), equalTo(1));
        DanglingReferenceException.Violation v = e.getViolations().get(0);
        assertThat(v.getOwnerId(), equalTo("HEX"));
        assertThat(v.getType(), equalTo("metabolite"));
        assertThat(v.getReferenceId(), equalTo(""));
        ModelRefiner refiner2 = new ModelRefiner()
                .setMetaboliteRemovals(List.of(new MetaboliteRemoval("MNXM3", "MNXM12345")));
        e = assertThrows(DanglingReferenceException.class, () -> refiner2.refine(model, new CurationReport()));
        assertThat(e.getViolations().get(0).getReferenceId(), equalTo("MNXM12345"));
        assertThat(e.getMessage(), containsString("HEX refers to missing metabolite MNXM12345"));
    }

    @Test
    void testOverrides() throws CurationException {
        CuratedModel model = smallModel();
        ModelRefiner refiner = new ModelRefiner().setOverrides(List.of(new FieldOverride("MNXM41", "name", "glucose"),
                new FieldOverride("MNXM41", "FORMULA", "C6H12O6"), new FieldOverride("MNXM41", "mass", "180.156"),
                new FieldOverride("MNXM41", "charge", "0"), new FieldOverride("HEX", "name", "hexokinase")));
        CuratedModel refined = refiner.refine(model, new CurationReport());
        Metabolite glc = refined.getMetabolite("MNXM41");
        assertThat(glc.getName(), equalTo("glucose"));
        assertThat(glc.getFormula(), equalTo("C6H12O6"));
        assertThat(glc.getMass(), closeTo(180.156, 0.0001));
        assertThat(glc.getCharge(), equalTo(0));
        assertThat(refined.getReaction("HEX").getName(), equalTo("hexokinase"));
        assertThat(model.getMetabolite("MNXM41").getName(), equalTo("MNXM41 name"));
        // Bad overrides.
        assertThrows(MalformedEditTableException.class, () -> new FieldOverride("MNXM41", "color", "blue"));
        ModelRefiner bad1 = new ModelRefiner().setOverrides(List.of(new FieldOverride("MNXM41", "mass", "heavy")));
        assertThrows(MalformedEditTableException.class, () -> bad1.refine(model, new CurationReport()));
        ModelRefiner bad2 = new ModelRefiner().setOverrides(List.of(new FieldOverride("HEX", "formula", "C")));
        assertThrows(MalformedEditTableException.class, () -> bad2.refine(model, new CurationReport()));
        ModelRefiner bad3 = new ModelRefiner().setOverrides(List.of(new FieldOverride("XYZ", "name", "C")));
        assertThrows(MalformedEditTableException.class, () -> bad3.refine(model, new CurationReport()));
    }

    @Test
    void testEditTables() throws IOException, CurationException {
        List<TranslationEdit> translations = EditTables.readTranslations(new File("data", "translations.tsv"));
        assertThat(translations.size(), equalTo(3));
        assertThat(translations.get(0).getOriginal(), equalTo("MNXM41"));
        assertThat(translations.get(0).getNovel(), equalTo("glc__D"));
        List<MetaboliteRemoval> removals = EditTables.readMetaboliteRemovals(new File("data", "metabolite_removals.tsv"));
        assertThat(removals.size(), equalTo(2));
        assertThat(removals.get(1).getRemovalId(), equalTo("MNXM404"));
        assertThat(removals.get(1).getReplacementId(), equalTo("MNXM2"));
        assertThat(EditTables.readReactionRemovals(new File("data", "reaction_removals.tsv")), contains("R5"));
        List<FieldOverride> overrides = EditTables.readFieldOverrides(new File("data", "overrides.tsv"));
        assertThat(overrides.size(), equalTo(4));
        assertThat(overrides.get(1).getField(), equalTo(FieldOverride.Field.CHARGE));
        assertThrows(MalformedEditTableException.class,
                () -> EditTables.readFieldOverrides(new File("data", "bad_override.tsv")));
        assertThrows(MalformedEditTableException.class,
                () -> EditTables.readTranslations(new File("data", "bad_translations.tsv")));
        MalformedEditTableException e = assertThrows(MalformedEditTableException.class,
                () -> EditTables.readTranslations(new File("data", "blank_translations.tsv")));
        assertThat(e.getMessage(), containsString("MNXM1"));
        assertThrows(MalformedEditTableException.class,
                () -> EditTables.readMetaboliteRemovals(new File("data", "blank_removals.tsv")));
    }

    @RepeatedTest(20)
    void testRandomRemovals(RepetitionInfo info) throws CurationException {
        Random rand = new Random(1000L + info.getCurrentRepetition());
        // Build a random model.
        CuratedModel model = new CuratedModel();
        model.addCompartment(new Compartment("c", "cytosol"));
        final int nMets = 20;
        List<String> metIds = new ArrayList<String>(nMets);
        for (int i = 0; i < nMets; i++) {
            String id = "MNXM" + i;
            metIds.add(id);
            model.addMetabolite(new Metabolite(id, "compound " + i, ""));
        }
        for (int r = 0; r < 30; r++) {
            Reaction rxn = new Reaction("R" + r, "", rand.nextBoolean());
            List<Participant> parts = new ArrayList<Participant>();
            int nParts = 1 + rand.nextInt(5);
            for (int p = 0; p < nParts; p++)
                parts.add(new Participant(metIds.get(rand.nextInt(nMets)), "c", 1.0 + rand.nextInt(3),
                        (p % 2 == 0 ? Role.REACTANT : Role.PRODUCT)));
            rxn.setParticipants(parts);
            model.addReaction(rxn);
        }
        // Build a random removal table.  Each replacement is a metabolite not removed by this or an earlier row.
        List<String> available = new ArrayList<String>(metIds);
        Set<String> removed = new HashSet<String>();
        List<MetaboliteRemoval> removals = new ArrayList<MetaboliteRemoval>();
        int nRemovals = 1 + rand.nextInt(nMets / 2);
        for (int i = 0; i < nRemovals; i++) {
            String removal = available.remove(rand.nextInt(available.size()));
            String replacement = available.get(rand.nextInt(available.size()));
            removals.add(new MetaboliteRemoval(removal, replacement));
            removed.add(removal);
        }
        // Occasionally remove something that is not there.
        if (rand.nextBoolean())
            removals.add(new MetaboliteRemoval("MNXM999", available.get(0)));
        CuratedModel refined = new ModelRefiner().setMetaboliteRemovals(removals).refine(model, new CurationReport());
        for (String id : removed)
            assertThat(id, refined.getMetabolite(id), nullValue());
        assertThat(refined.getMetaboliteCount(), equalTo(nMets - removed.size()));
        assertThat(refined.getReactionCount(), equalTo(30));
        for (Reaction rxn : refined.getReactions()) {
            for (Participant part : rxn.getParticipants())
                assertThat(rxn.getId(), refined.getMetabolite(part.getMetaboliteId()), not(nullValue()));
            assertThat(rxn.getParticipants().size(), equalTo(model.getReaction(rxn.getId()).getParticipants().size()));
        }
        assertThat(ModelIntegrityCheck.findViolations(refined), empty());
        // The input is unchanged.
        assertThat(model.getMetaboliteCount(), equalTo(nMets));
        for (String id : Arrays.asList("MNXM0", "MNXM19"))
            assertThat(model.getMetabolite(id), not(nullValue()));
    }

}
