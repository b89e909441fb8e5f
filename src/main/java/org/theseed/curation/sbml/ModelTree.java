/**
 *
 */
package org.theseed.curation.sbml;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import javax.xml.stream.XMLStreamException;

import org.sbml.jsbml.Compartment;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.Reaction;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLReader;
import org.sbml.jsbml.SBMLWriter;
import org.sbml.jsbml.Species;
import org.sbml.jsbml.SpeciesReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationReport;

/**
 * This object provides indexed access to an SBML model.  The document is copied when the object is
 * constructed, so nothing done through this object can affect the caller's document or another
 * tree built from it.  Compartments, species, and reactions are indexed by ID when the tree is
 * built, and the indexes are refreshed after every rename.
 *
 * The reader maps each section to its typed list in the model regardless of where the section appears
 * in the file, so the only structural requirement is that all three sections are present.
 *
 * @author Bruce Parrello
 *
 */
public class ModelTree {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelTree.class);
    /** SBML document (private copy) */
    private SBMLDocument document;
    /** SBML model */
    private Model model;
    /** compartment index */
    private Map<String, Compartment> compartmentIndex;
    /** species index */
    private Map<String, Species> speciesIndex;
    /** reaction index */
    private Map<String, Reaction> reactionIndex;
    /** pattern for a legal SBML identifier */
    private static final Pattern SID_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Construct a model tree from an SBML document.  The document is copied.
     *
     * @param document	SBML document to access
     *
     * @throws MalformedModelException	if the document lacks a required section
     */
    public ModelTree(SBMLDocument document) throws MalformedModelException {
        this.document = document.clone();
        this.model = this.document.getModel();
        if (this.model == null)
            throw new MalformedModelException("SBML document contains no model.");
        if (! this.model.isSetListOfCompartments())
            throw new MalformedModelException("SBML model has no compartment section.");
        if (! this.model.isSetListOfSpecies())
            throw new MalformedModelException("SBML model has no species section.");
        if (! this.model.isSetListOfReactions())
            throw new MalformedModelException("SBML model has no reaction section.");
        this.reindex();
    }

    /**
     * Load a model tree from an SBML file.
     *
     * @param inFile	file to load
     *
     * @return the model tree for the file
     *
     * @throws IOException
     * @throws MalformedModelException
     */
    public static ModelTree load(File inFile) throws IOException, MalformedModelException {
        SBMLDocument doc;
        try {
            doc = SBMLReader.read(inFile);
        } catch (XMLStreamException e) {
            throw new MalformedModelException("XML error in " + inFile + ": " + e.getMessage(), e);
        }
        ModelTree retVal = new ModelTree(doc);
        log.info("{} loaded from {}.", retVal, inFile);
        return retVal;
    }

    /**
     * @return a copy of this tree that can be edited independently
     */
    public ModelTree copy() {
        ModelTree retVal;
        try {
            retVal = new ModelTree(this.document);
        } catch (MalformedModelException e) {
            // This tree was validated when it was built.
            throw new IllegalStateException("Copied model lost a section: " + e.getMessage(), e);
        }
        return retVal;
    }

    /**
     * Write this tree to an SBML file.
     *
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void save(File outFile) throws IOException {
        SBMLWriter writer = new SBMLWriter();
        try (OutputStream outStream = new FileOutputStream(outFile)) {
            writer.write(this.document, outStream);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Error writing SBML to " + outFile + ": " + e.getMessage(), e);
        }
        log.info("{} written to {}.", this, outFile);
    }

    /**
     * Rebuild the ID indexes from the model.
     */
    public void reindex() {
        this.compartmentIndex = new LinkedHashMap<String, Compartment>();
        for (Compartment comp : this.model.getListOfCompartments())
            this.compartmentIndex.put(comp.getId(), comp);
        this.speciesIndex = new LinkedHashMap<String, Species>();
        for (Species species : this.model.getListOfSpecies())
            this.speciesIndex.put(species.getId(), species);
        this.reactionIndex = new LinkedHashMap<String, Reaction>();
        for (Reaction reaction : this.model.getListOfReactions())
            this.reactionIndex.put(reaction.getId(), reaction);
    }

    /**
     * @return the underlying SBML model
     */
    public Model getModel() {
        return this.model;
    }

    /**
     * @return the compartment with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired compartment
     */
    public Compartment getCompartment(String id) {
        return this.compartmentIndex.get(id);
    }

    /**
     * @return the species with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired species
     */
    public Species getSpecies(String id) {
        return this.speciesIndex.get(id);
    }

    /**
     * @return the reaction with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired reaction
     */
    public Reaction getReaction(String id) {
        return this.reactionIndex.get(id);
    }

    /**
     * @return the compartments, in model order
     */
    public Collection<Compartment> getCompartments() {
        return Collections.unmodifiableCollection(this.compartmentIndex.values());
    }

    /**
     * @return the species, in model order
     */
    public Collection<Species> getSpecies() {
        return Collections.unmodifiableCollection(this.speciesIndex.values());
    }

    /**
     * @return the reactions, in model order
     */
    public Collection<Reaction> getReactions() {
        return Collections.unmodifiableCollection(this.reactionIndex.values());
    }

    /**
     * Add a compartment to the model.
     *
     * @param id	ID of the new compartment
     * @param name	name of the new compartment
     *
     * @return the new compartment
     */
    public Compartment addCompartment(String id, String name) {
        Compartment retVal = this.model.createCompartment(id);
        retVal.setName(name);
        this.compartmentIndex.put(id, retVal);
        return retVal;
    }

    /**
     * @return a list of all the species references in the reactions (reactants and products)
     */
    public List<SpeciesReference> getSpeciesReferences() {
        List<SpeciesReference> retVal = new ArrayList<SpeciesReference>();
        for (Reaction reaction : this.reactionIndex.values()) {
            retVal.addAll(reaction.getListOfReactants());
            retVal.addAll(reaction.getListOfProducts());
        }
        return retVal;
    }

    /**
     * @return a map of reaction IDs to reaction names, in model order
     */
    public Map<String, String> getReactionNames() {
        Map<String, String> retVal = new LinkedHashMap<String, String>(this.reactionIndex.size() * 4 / 3 + 1);
        for (Reaction reaction : this.reactionIndex.values())
            retVal.put(reaction.getId(), (reaction.isSetName() ? reaction.getName() : ""));
        return retVal;
    }

    /**
     * @return TRUE if the specified string is a legal SBML identifier
     *
     * @param id	string to check
     */
    public static boolean isValidId(String id) {
        return id != null && SID_PATTERN.matcher(id).matches();
    }

    /**
     * Rename species and update the species references in the reactions to match.  All the renames
     * are computed against the model as it stood before the call.  If a new ID already belongs to
     * another species, the renamed species is merged into it:  the renamed species is deleted and its
     * references are pointed at the survivor.  A rename to an illegal SBML identifier is skipped and
     * reported.
     *
     * @param renames	map of old species IDs to new species IDs
     * @param report	report to receive problems and merge notes
     *
     * @return a map of new IDs to the renamed species that were not merged
     */
    public Map<String, Species> renameSpecies(Map<String, String> renames, CurationReport report) {
        Map<String, Species> retVal = new LinkedHashMap<String, Species>();
        // Sort out the renames we can actually do.
        Map<String, String> legal = new LinkedHashMap<String, String>(renames.size() * 4 / 3 + 1);
        for (Map.Entry<String, String> entry : renames.entrySet()) {
            String oldId = entry.getKey();
            String newId = entry.getValue();
            if (this.speciesIndex.containsKey(oldId) && ! oldId.equals(newId)) {
                if (isValidId(newId))
                    legal.put(oldId, newId);
                else
                    report.addProblem(new InvalidIdentifierException(oldId, newId));
            }
        }
        if (! legal.isEmpty()) {
            // Move the renamed species out of the way so that a rename can land on an ID that is itself moving.
            Set<String> occupied = new HashSet<String>(this.speciesIndex.keySet());
            occupied.removeAll(legal.keySet());
            List<Species> moving = new ArrayList<Species>(legal.size());
            int tempNum = 0;
            for (String oldId : legal.keySet()) {
                Species species = this.speciesIndex.get(oldId);
                String tempId;
                do {
                    tempNum++;
                    tempId = "_rename" + tempNum;
                } while (this.speciesIndex.containsKey(tempId));
                species.setId(tempId);
                moving.add(species);
            }
            // Now place each species at its new ID or merge it into the occupant.
            List<String> oldList = new ArrayList<String>(legal.keySet());
            for (int i = 0; i < moving.size(); i++) {
                Species species = moving.get(i);
                String oldId = oldList.get(i);
                String newId = legal.get(oldId);
                if (occupied.contains(newId)) {
                    this.model.getListOfSpecies().remove(species);
                    report.addNote("Species " + oldId + " merged into " + newId + ".");
                } else {
                    species.setId(newId);
                    occupied.add(newId);
                    retVal.put(newId, species);
                }
            }
            // Update the references.
            for (SpeciesReference ref : this.getSpeciesReferences()) {
                String newId = legal.get(ref.getSpecies());
                if (newId != null)
                    ref.setSpecies(newId);
            }
            this.reindex();
            log.debug("{} species renamed and {} merged.", retVal.size(), legal.size() - retVal.size());
        }
        return retVal;
    }

    @Override
    public String toString() {
        String name = (this.model.isSetId() ? this.model.getId() : "SBML model");
        return name + " (" + this.compartmentIndex.size() + " compartments, " + this.speciesIndex.size()
                + " species, " + this.reactionIndex.size() + " reactions)";
    }

}
