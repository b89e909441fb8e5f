/**
 *
 */
package org.theseed.curation.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents a reaction in a curated metabolic model.  The reaction contains the raw
 * equation text, the reversibility flag, the ordered participant list (reactants first, then
 * products), the metabolic processes and genes associated with it, and its cross-references.
 *
 * Participants refer to metabolites and compartments by ID only.  The model owns the
 * metabolites and compartments.
 *
 * @author Bruce Parrello
 *
 */
public class Reaction {

    // FIELDS
    /** reaction ID */
    private String id;
    /** reaction name */
    private String name;
    /** raw equation text */
    private String equation;
    /** reversibility flag */
    private boolean reversible;
    /** participant list */
    private List<Participant> participants;
    /** metabolic processes */
    private List<String> processes;
    /** gene identifiers */
    private List<String> genes;
    /** cross-references */
    private References references;

    private static enum ReactionKeys implements JsonKey {
        ID(""), NAME(""), EQUATION(""), REVERSIBILITY(false), PARTICIPANTS(null),
        PROCESSES(null), GENES(null), REFERENCES(null);

        private final Object m_value;

        private ReactionKeys(final Object value) {
            this.m_value = value;
        }

        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    private static enum ParticipantKeys implements JsonKey {
        METABOLITE(""), COMPARTMENT(""), COEFFICIENT(1.0), ROLE("reactant");

        private final Object m_value;

        private ParticipantKeys(final Object value) {
            this.m_value = value;
        }

        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * This enumeration describes the role of a participant in a reaction.
     */
    public static enum Role {
        REACTANT, PRODUCT;

        /**
         * @return the role with the specified name (case-insensitive)
         *
         * @param name		name of the role
         */
        public static Role parse(String name) {
            return Role.valueOf(name.toUpperCase());
        }

        @Override
        public String toString() {
            return this.name().toLowerCase();
        }
    }

    /**
     * This is an immutable object describing one participant in a reaction.  It holds the IDs of
     * the metabolite and its compartment, the stoichiometric coefficient, and the role.
     */
    public static class Participant {

        /** metabolite ID */
        private final String metaboliteId;
        /** compartment ID */
        private final String compartmentId;
        /** stoichiometric coefficient */
        private final double coefficient;
        /** participant role */
        private final Role role;

        /**
         * Construct a participant.
         *
         * @param metaboliteId		ID of the metabolite
         * @param compartmentId		ID of the compartment
         * @param coefficient		stoichiometric coefficient
         * @param role				role in the reaction
         */
        public Participant(String metaboliteId, String compartmentId, double coefficient, Role role) {
            this.metaboliteId = metaboliteId;
            this.compartmentId = compartmentId;
            this.coefficient = coefficient;
            this.role = role;
        }

        /**
         * Construct a participant from a JSON object.
         *
         * @param json		JSON object describing the participant
         */
        public Participant(JsonObject json) {
            this.metaboliteId = json.getStringOrDefault(ParticipantKeys.METABOLITE);
            this.compartmentId = json.getStringOrDefault(ParticipantKeys.COMPARTMENT);
            this.coefficient = json.getDoubleOrDefault(ParticipantKeys.COEFFICIENT);
            this.role = Role.parse(json.getStringOrDefault(ParticipantKeys.ROLE));
        }

        /**
         * @return a copy of this participant referring to a different metabolite
         *
         * @param newMetaboliteId	ID of the new metabolite
         */
        public Participant withMetabolite(String newMetaboliteId) {
            return new Participant(newMetaboliteId, this.compartmentId, this.coefficient, this.role);
        }

        /**
         * @return a JSON object describing this participant
         */
        public JsonObject toJson() {
            JsonObject retVal = new JsonObject();
            retVal.put(ParticipantKeys.METABOLITE.getKey(), this.metaboliteId);
            retVal.put(ParticipantKeys.COMPARTMENT.getKey(), this.compartmentId);
            retVal.put(ParticipantKeys.COEFFICIENT.getKey(), BigDecimal.valueOf(this.coefficient));
            retVal.put(ParticipantKeys.ROLE.getKey(), this.role.toString());
            return retVal;
        }

        /**
         * @return the metabolite ID
         */
        public String getMetaboliteId() {
            return this.metaboliteId;
        }

        /**
         * @return the compartment ID
         */
        public String getCompartmentId() {
            return this.compartmentId;
        }

        /**
         * @return the stoichiometric coefficient as written in the equation
         */
        public double getCoefficient() {
            return this.coefficient;
        }

        /**
         * @return the coefficient signed by role (negative for reactants)
         */
        public double getSignedCoefficient() {
            return (this.role == Role.REACTANT ? -this.coefficient : this.coefficient);
        }

        /**
         * @return the role of this participant
         */
        public Role getRole() {
            return this.role;
        }

        /**
         * @return TRUE for a product, FALSE for a reactant
         */
        public boolean isProduct() {
            return (this.role == Role.PRODUCT);
        }

        @Override
        public String toString() {
            return this.coefficient + " " + this.metaboliteId + "@" + this.compartmentId
                    + " (" + this.role + ")";
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.metaboliteId, this.compartmentId, this.coefficient, this.role);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null)
                return false;
            if (getClass() != obj.getClass())
                return false;
            Participant other = (Participant) obj;
            return this.metaboliteId.equals(other.metaboliteId)
                    && this.compartmentId.equals(other.compartmentId)
                    && Double.compare(this.coefficient, other.coefficient) == 0
                    && this.role == other.role;
        }

    }

    /**
     * Construct an empty reaction.
     *
     * @param id			reaction ID
     * @param equation		raw equation text
     * @param reversible	TRUE if the reaction is reversible
     */
    public Reaction(String id, String equation, boolean reversible) {
        this.id = id;
        this.name = "";
        this.equation = equation;
        this.reversible = reversible;
        this.participants = new ArrayList<Participant>();
        this.processes = new ArrayList<String>();
        this.genes = new ArrayList<String>();
        this.references = new References();
    }

    /**
     * Construct a reaction from a JSON object.
     *
     * @param json		JSON object describing the reaction
     */
    public Reaction(JsonObject json) {
        this(json.getStringOrDefault(ReactionKeys.ID), json.getStringOrDefault(ReactionKeys.EQUATION),
                json.getBooleanOrDefault(ReactionKeys.REVERSIBILITY));
        this.name = json.getStringOrDefault(ReactionKeys.NAME);
        JsonArray parts = (JsonArray) json.get(ReactionKeys.PARTICIPANTS.getKey());
        if (parts != null) {
            for (Object part : parts)
                this.participants.add(new Participant((JsonObject) part));
        }
        this.processes = stringList((JsonArray) json.get(ReactionKeys.PROCESSES.getKey()));
        this.genes = stringList((JsonArray) json.get(ReactionKeys.GENES.getKey()));
        JsonObject refs = (JsonObject) json.get(ReactionKeys.REFERENCES.getKey());
        if (refs != null)
            this.references = new References(refs);
    }

    /**
     * @return a list of the strings in a JSON array (empty if the array is NULL)
     *
     * @param array		JSON array to convert
     */
    private static List<String> stringList(JsonArray array) {
        List<String> retVal = new ArrayList<String>();
        if (array != null) {
            for (Object item : array)
                retVal.add((String) item);
        }
        return retVal;
    }

    /**
     * @return a deep copy of this reaction
     */
    public Reaction copy() {
        Reaction retVal = new Reaction(this.id, this.equation, this.reversible);
        retVal.name = this.name;
        retVal.participants.addAll(this.participants);
        retVal.processes.addAll(this.processes);
        retVal.genes.addAll(this.genes);
        retVal.references = this.references.copy();
        return retVal;
    }

    /**
     * @return a JSON object describing this reaction
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(ReactionKeys.ID.getKey(), this.id);
        retVal.put(ReactionKeys.NAME.getKey(), this.name);
        retVal.put(ReactionKeys.EQUATION.getKey(), this.equation);
        retVal.put(ReactionKeys.REVERSIBILITY.getKey(), this.reversible);
        JsonArray parts = new JsonArray();
        for (Participant part : this.participants)
            parts.add(part.toJson());
        retVal.put(ReactionKeys.PARTICIPANTS.getKey(), parts);
        retVal.put(ReactionKeys.PROCESSES.getKey(), new JsonArray(this.processes));
        retVal.put(ReactionKeys.GENES.getKey(), new JsonArray(this.genes));
        retVal.put(ReactionKeys.REFERENCES.getKey(), this.references.toJson());
        return retVal;
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the reaction name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @param name 	the name to set
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return the raw equation text
     */
    public String getEquation() {
        return this.equation;
    }

    /**
     * @return TRUE if this reaction is reversible
     */
    public boolean isReversible() {
        return this.reversible;
    }

    /**
     * @return the participants (reactants first, then products)
     */
    public List<Participant> getParticipants() {
        return Collections.unmodifiableList(this.participants);
    }

    /**
     * Replace the participant list.
     *
     * @param participants	new participant list
     */
    public void setParticipants(List<Participant> participants) {
        this.participants = new ArrayList<Participant>(participants);
    }

    /**
     * @return the reactant participants
     */
    public List<Participant> getReactants() {
        return this.participants.stream().filter(x -> ! x.isProduct()).collect(Collectors.toList());
    }

    /**
     * @return the product participants
     */
    public List<Participant> getProducts() {
        return this.participants.stream().filter(x -> x.isProduct()).collect(Collectors.toList());
    }

    /**
     * @return TRUE if any participant refers to the specified metabolite
     *
     * @param metaboliteId	ID of the metabolite of interest
     */
    public boolean uses(String metaboliteId) {
        return this.participants.stream().anyMatch(x -> x.getMetaboliteId().equals(metaboliteId));
    }

    /**
     * @return the metabolic processes
     */
    public List<String> getProcesses() {
        return this.processes;
    }

    /**
     * @param processes 	the processes to set
     */
    public void setProcesses(List<String> processes) {
        this.processes = new ArrayList<String>(processes);
    }

    /**
     * @return the gene identifiers
     */
    public List<String> getGenes() {
        return this.genes;
    }

    /**
     * @param genes 	the genes to set
     */
    public void setGenes(List<String> genes) {
        this.genes = new ArrayList<String>(genes);
    }

    /**
     * @return the cross-references
     */
    public References getReferences() {
        return this.references;
    }

    @Override
    public String toString() {
        return "Reaction " + this.id + " (" + this.equation + ")";
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Reaction other = (Reaction) obj;
        return this.id.equals(other.id);
    }

}
