/**
 *
 */
package org.theseed.curation.extract;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationReport;
import org.theseed.curation.io.TabularReader;
import org.theseed.curation.model.Compartment;
import org.theseed.curation.model.CuratedModel;
import org.theseed.curation.model.Metabolite;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.parse.EquationParser;
import org.theseed.curation.parse.MalformedEquationException;
import org.theseed.curation.parse.ReferenceParser;
import org.theseed.curation.refine.DanglingReferenceException;
import org.theseed.curation.refine.ModelIntegrityCheck;

/**
 * This object builds a structured model from the flat export of a metabolic network.  The export
 * consists of four headerless tab-delimited tables:  gene links by reaction, compartments, metabolites,
 * and reactions.
 *
 * Problems with individual records do not stop extraction.  A reaction with a malformed equation is
 * left out of the model.  A reaction with no gene record is kept with an empty gene list.  A reaction
 * whose participants refer to a metabolite or compartment not in the export is removed after
 * extraction.  Each of these is recorded in the curation report.
 *
 * @author Bruce Parrello
 *
 */
public class FlatExportExtractor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FlatExportExtractor.class);
    /** gene records, keyed by reaction ID */
    private Map<String, Map<String, String>> geneIndex;
    /** compartment records */
    private List<Map<String, String>> compartmentRecords;
    /** metabolite records */
    private List<Map<String, String>> metaboliteRecords;
    /** reaction records */
    private List<Map<String, String>> reactionRecords;

    /** gene table: reaction ID column */
    public static final String GENE_REACTION = "reaction";
    /** gene table: gene list column */
    public static final String GENE_LIST = "genes";
    /** gene table columns */
    public static final String[] GENE_COLUMNS = new String[] { GENE_REACTION, GENE_LIST, "low_bound", "up_bound", "direction" };
    /** compartment table: ID column */
    public static final String COMPARTMENT_ID = "identifier";
    /** compartment table: name column */
    public static final String COMPARTMENT_NAME = "name";
    /** compartment table columns */
    public static final String[] COMPARTMENT_COLUMNS = new String[] { COMPARTMENT_ID, COMPARTMENT_NAME, "source" };
    /** metabolite table: ID column */
    public static final String METABOLITE_ID = "identifier";
    /** metabolite table: name column */
    public static final String METABOLITE_NAME = "name";
    /** metabolite table: source column */
    public static final String METABOLITE_SOURCE = "source";
    /** metabolite table: formula column */
    public static final String METABOLITE_FORMULA = "formula";
    /** metabolite table: mass column */
    public static final String METABOLITE_MASS = "mass";
    /** metabolite table: charge column */
    public static final String METABOLITE_CHARGE = "charge";
    /** metabolite table: reference column */
    public static final String METABOLITE_REFERENCE = "reference";
    /** metabolite table columns */
    public static final String[] METABOLITE_COLUMNS = new String[] { METABOLITE_ID, METABOLITE_NAME, METABOLITE_SOURCE,
            METABOLITE_FORMULA, METABOLITE_MASS, METABOLITE_CHARGE, METABOLITE_REFERENCE };
    /** reaction table: ID column */
    public static final String REACTION_ID = "identifier";
    /** reaction table: equation column */
    public static final String REACTION_EQUATION = "equation";
    /** reaction table: source-network ID column */
    public static final String REACTION_MODEL_ID = "model_identifier";
    /** reaction table: export-system ID column */
    public static final String REACTION_METANETX = "metanetx";
    /** reaction table: enzyme commission column */
    public static final String REACTION_EC = "enzyme_commission";
    /** reaction table: process column */
    public static final String REACTION_PROCESS = "process";
    /** reaction table: reference column */
    public static final String REACTION_REFERENCE = "reference";
    /** reaction table columns */
    public static final String[] REACTION_COLUMNS = new String[] { REACTION_ID, REACTION_EQUATION, REACTION_MODEL_ID,
            REACTION_METANETX, REACTION_EC, REACTION_PROCESS, REACTION_REFERENCE };
    /** key for process names in the process column */
    public static final String PROCESS_KEY = "model:";

    /**
     * Construct an extractor from the records of the four export tables.
     *
     * @param geneRecords			gene link records
     * @param compartmentRecords	compartment records
     * @param metaboliteRecords		metabolite records
     * @param reactionRecords		reaction records
     */
    public FlatExportExtractor(List<Map<String, String>> geneRecords, List<Map<String, String>> compartmentRecords,
            List<Map<String, String>> metaboliteRecords, List<Map<String, String>> reactionRecords) {
        this.compartmentRecords = compartmentRecords;
        this.metaboliteRecords = metaboliteRecords;
        this.reactionRecords = reactionRecords;
        // Index the gene records by reaction ID.
        this.geneIndex = new HashMap<String, Map<String, String>>(geneRecords.size() * 4 / 3 + 1);
        for (Map<String, String> geneRecord : geneRecords) {
            String reactionId = geneRecord.get(GENE_REACTION);
            if (this.geneIndex.containsKey(reactionId))
                log.warn("Duplicate gene record for reaction {} ignored.", reactionId);
            else
                this.geneIndex.put(reactionId, geneRecord);
        }
    }

    /**
     * Load an extractor from the four export files.
     *
     * @param geneFile			gene link table
     * @param compartmentFile	compartment table
     * @param metaboliteFile	metabolite table
     * @param reactionFile		reaction table
     *
     * @return an extractor for the export
     *
     * @throws IOException
     */
    public static FlatExportExtractor load(File geneFile, File compartmentFile, File metaboliteFile, File reactionFile)
            throws IOException {
        return new FlatExportExtractor(TabularReader.readAll(geneFile, GENE_COLUMNS),
                TabularReader.readAll(compartmentFile, COMPARTMENT_COLUMNS),
                TabularReader.readAll(metaboliteFile, METABOLITE_COLUMNS),
                TabularReader.readAll(reactionFile, REACTION_COLUMNS));
    }

    /**
     * Build the structured model.
     *
     * @param report	report to receive record-level problems
     *
     * @return the model extracted
     */
    public CuratedModel extract(CurationReport report) {
        CuratedModel retVal = new CuratedModel();
        for (Map<String, String> record : this.compartmentRecords)
            retVal.addCompartment(new Compartment(record.get(COMPARTMENT_ID), record.get(COMPARTMENT_NAME)));
        log.info("{} compartments extracted.", retVal.getCompartmentCount());
        for (Map<String, String> record : this.metaboliteRecords)
            retVal.addMetabolite(extractMetabolite(record));
        log.info("{} metabolites extracted.", retVal.getMetaboliteCount());
        int bad = 0;
        for (Map<String, String> record : this.reactionRecords) {
            try {
                retVal.addReaction(this.extractReaction(record, report));
            } catch (MalformedEquationException e) {
                report.addProblem(e);
                bad++;
            }
        }
        log.info("{} reactions extracted, {} had malformed equations.", retVal.getReactionCount(), bad);
        this.pruneDangling(retVal, report);
        return retVal;
    }

    /**
     * @return a metabolite built from a metabolite record
     *
     * @param record	metabolite record
     */
    public static Metabolite extractMetabolite(Map<String, String> record) {
        String id = record.get(METABOLITE_ID);
        Metabolite retVal = new Metabolite(id, record.get(METABOLITE_NAME), record.get(METABOLITE_FORMULA));
        String mass = record.get(METABOLITE_MASS);
        if (! StringUtils.isBlank(mass)) {
            try {
                retVal.setMass(Double.parseDouble(mass));
            } catch (NumberFormatException e) {
                log.warn("Invalid mass \"{}\" for metabolite {}.", mass, id);
            }
        }
        String charge = record.get(METABOLITE_CHARGE);
        if (! StringUtils.isBlank(charge)) {
            try {
                retVal.setCharge(Integer.valueOf(charge.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid charge \"{}\" for metabolite {}.", charge, id);
            }
        }
        for (MetaboliteCategory category : MetaboliteCategory.values())
            retVal.getReferences().put(category.toString(), category.extract(record));
        return retVal;
    }

    /**
     * Build a reaction from a reaction record.
     *
     * @param record	reaction record
     * @param report	report to receive a missing gene record
     *
     * @return the reaction built
     *
     * @throws MalformedEquationException	if the equation cannot be parsed
     */
    protected Reaction extractReaction(Map<String, String> record, CurationReport report)
            throws MalformedEquationException {
        String id = record.get(REACTION_ID);
        String equation = record.get(REACTION_EQUATION);
        EquationParser.ParsedEquation parsed = EquationParser.parse(id, equation);
        Reaction retVal = new Reaction(id, equation, parsed.isReversible());
        retVal.setParticipants(parsed.getParticipants());
        retVal.setProcesses(ReferenceParser.extract(record.get(REACTION_PROCESS), PROCESS_KEY));
        for (ReactionCategory category : ReactionCategory.values())
            retVal.getReferences().put(category.toString(), category.extract(record));
        Map<String, String> geneRecord = this.geneIndex.get(id);
        if (geneRecord == null)
            report.addProblem(new MissingReferenceRecordException(id, "gene"));
        else
            retVal.setGenes(ReferenceParser.split(geneRecord.get(GENE_LIST)));
        return retVal;
    }

    /**
     * Remove the reactions whose participants refer to metabolites or compartments not in the model.
     *
     * @param model		model to prune
     * @param report	report to receive the violations
     */
    private void pruneDangling(CuratedModel model, CurationReport report) {
        Map<String, List<DanglingReferenceException.Violation>> byReaction =
                new HashMap<String, List<DanglingReferenceException.Violation>>();
        for (DanglingReferenceException.Violation violation : ModelIntegrityCheck.findViolations(model))
            byReaction.computeIfAbsent(violation.getOwnerId(), x -> new ArrayList<DanglingReferenceException.Violation>())
                    .add(violation);
        for (Map.Entry<String, List<DanglingReferenceException.Violation>> entry : byReaction.entrySet()) {
            model.removeReaction(entry.getKey());
            report.addProblem(new DanglingReferenceException(entry.getValue()));
        }
        if (! byReaction.isEmpty())
            log.info("{} reactions with dangling references removed.", byReaction.size());
    }

}
