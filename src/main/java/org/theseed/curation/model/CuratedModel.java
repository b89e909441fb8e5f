/**
 *
 */
package org.theseed.curation.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object is the structured form of a metabolic model:  a set of compartments, a set of
 * metabolites, and a set of reactions, each keyed by ID.  Insertion order is preserved so that
 * reports and snapshots list the entities in the order of the source tables.
 *
 * Curation stages never modify a model in place.  Instead, they call {@link #copy()} and edit the
 * copy.
 *
 * @author Bruce Parrello
 *
 */
public class CuratedModel {

    // FIELDS
    /** map of compartment IDs to compartments */
    private Map<String, Compartment> compartmentMap;
    /** map of metabolite IDs to metabolites */
    private Map<String, Metabolite> metaboliteMap;
    /** map of reaction IDs to reactions */
    private Map<String, Reaction> reactionMap;

    /**
     * Construct an empty model.
     */
    public CuratedModel() {
        this.compartmentMap = new LinkedHashMap<String, Compartment>();
        this.metaboliteMap = new LinkedHashMap<String, Metabolite>();
        this.reactionMap = new LinkedHashMap<String, Reaction>();
    }

    /**
     * Construct a model from a JSON object.
     *
     * @param json		JSON object containing arrays of compartments, metabolites, and reactions
     */
    public CuratedModel(JsonObject json) {
        this();
        JsonArray compartments = (JsonArray) json.get("compartments");
        if (compartments != null) {
            for (Object item : compartments)
                this.addCompartment(new Compartment((JsonObject) item));
        }
        JsonArray metabolites = (JsonArray) json.get("metabolites");
        if (metabolites != null) {
            for (Object item : metabolites)
                this.addMetabolite(new Metabolite((JsonObject) item));
        }
        JsonArray reactions = (JsonArray) json.get("reactions");
        if (reactions != null) {
            for (Object item : reactions)
                this.addReaction(new Reaction((JsonObject) item));
        }
    }

    /**
     * @return a deep copy of this model
     */
    public CuratedModel copy() {
        CuratedModel retVal = new CuratedModel();
        this.compartmentMap.values().forEach(x -> retVal.addCompartment(x.copy()));
        this.metaboliteMap.values().forEach(x -> retVal.addMetabolite(x.copy()));
        this.reactionMap.values().forEach(x -> retVal.addReaction(x.copy()));
        return retVal;
    }

    /**
     * @return a JSON object describing this model
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        JsonArray compartments = new JsonArray();
        this.compartmentMap.values().forEach(x -> compartments.add(x.toJson()));
        JsonArray metabolites = new JsonArray();
        this.metaboliteMap.values().forEach(x -> metabolites.add(x.toJson()));
        JsonArray reactions = new JsonArray();
        this.reactionMap.values().forEach(x -> reactions.add(x.toJson()));
        retVal.put("compartments", compartments);
        retVal.put("metabolites", metabolites);
        retVal.put("reactions", reactions);
        return retVal;
    }

    /**
     * Add a compartment to this model.  A compartment with the same ID is replaced.
     *
     * @param compartment	compartment to add
     */
    public void addCompartment(Compartment compartment) {
        this.compartmentMap.put(compartment.getId(), compartment);
    }

    /**
     * Add a metabolite to this model.  A metabolite with the same ID is replaced.
     *
     * @param metabolite	metabolite to add
     */
    public void addMetabolite(Metabolite metabolite) {
        this.metaboliteMap.put(metabolite.getId(), metabolite);
    }

    /**
     * Add a reaction to this model.  A reaction with the same ID is replaced.
     *
     * @param reaction		reaction to add
     */
    public void addReaction(Reaction reaction) {
        this.reactionMap.put(reaction.getId(), reaction);
    }

    /**
     * @return the compartment with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired compartment
     */
    public Compartment getCompartment(String id) {
        return this.compartmentMap.get(id);
    }

    /**
     * @return the metabolite with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired metabolite
     */
    public Metabolite getMetabolite(String id) {
        return this.metaboliteMap.get(id);
    }

    /**
     * @return the reaction with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired reaction
     */
    public Reaction getReaction(String id) {
        return this.reactionMap.get(id);
    }

    /**
     * @return TRUE if the specified compartment exists
     *
     * @param id	ID of the compartment to check
     */
    public boolean hasCompartment(String id) {
        return this.compartmentMap.containsKey(id);
    }

    /**
     * @return TRUE if the specified metabolite exists
     *
     * @param id	ID of the metabolite to check
     */
    public boolean hasMetabolite(String id) {
        return this.metaboliteMap.containsKey(id);
    }

    /**
     * Remove a metabolite from this model.
     *
     * @param id	ID of the metabolite to remove
     *
     * @return the metabolite removed, or NULL if it was not present
     */
    public Metabolite removeMetabolite(String id) {
        return this.metaboliteMap.remove(id);
    }

    /**
     * Remove a reaction from this model.
     *
     * @param id	ID of the reaction to remove
     *
     * @return the reaction removed, or NULL if it was not present
     */
    public Reaction removeReaction(String id) {
        return this.reactionMap.remove(id);
    }

    /**
     * @return all the compartments
     */
    public Collection<Compartment> getCompartments() {
        return Collections.unmodifiableCollection(this.compartmentMap.values());
    }

    /**
     * @return all the metabolites
     */
    public Collection<Metabolite> getMetabolites() {
        return Collections.unmodifiableCollection(this.metaboliteMap.values());
    }

    /**
     * @return all the reactions
     */
    public Collection<Reaction> getReactions() {
        return Collections.unmodifiableCollection(this.reactionMap.values());
    }

    /**
     * @return the number of compartments
     */
    public int getCompartmentCount() {
        return this.compartmentMap.size();
    }

    /**
     * @return the number of metabolites
     */
    public int getMetaboliteCount() {
        return this.metaboliteMap.size();
    }

    /**
     * @return the number of reactions
     */
    public int getReactionCount() {
        return this.reactionMap.size();
    }

    @Override
    public String toString() {
        return "Model with " + this.compartmentMap.size() + " compartments, " + this.metaboliteMap.size()
                + " metabolites, and " + this.reactionMap.size() + " reactions";
    }

}
