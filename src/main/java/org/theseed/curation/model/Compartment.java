/**
 *
 */
package org.theseed.curation.model;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents a compartment of a metabolic model:  a physical or logical location
 * (cytosol, extracellular region, model boundary) that hosts metabolites.
 *
 * @author Bruce Parrello
 *
 */
public class Compartment {

    // FIELDS
    /** compartment ID */
    private String id;
    /** descriptive name */
    private String name;

    private static enum CompartmentKeys implements JsonKey {
        ID(""), NAME("");

        private final Object m_value;

        private CompartmentKeys(final Object value) {
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
     * Construct a compartment.
     *
     * @param id		compartment ID
     * @param name		compartment name
     */
    public Compartment(String id, String name) {
        this.id = id;
        this.name = name;
    }

    /**
     * Construct a compartment from a JSON object.
     *
     * @param json		JSON object describing the compartment
     */
    public Compartment(JsonObject json) {
        this.id = json.getStringOrDefault(CompartmentKeys.ID);
        this.name = json.getStringOrDefault(CompartmentKeys.NAME);
    }

    /**
     * @return a copy of this compartment
     */
    public Compartment copy() {
        return new Compartment(this.id, this.name);
    }

    /**
     * @return a JSON object describing this compartment
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(CompartmentKeys.ID.getKey(), this.id);
        retVal.put(CompartmentKeys.NAME.getKey(), this.name);
        return retVal;
    }

    /**
     * @return the compartment ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the compartment name
     */
    public String getName() {
        return this.name;
    }

    /**
     * Specify a new compartment name.
     *
     * @param name 	the name to set
     */
    public void setName(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return "Compartment " + this.id + " (" + this.name + ")";
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
        Compartment other = (Compartment) obj;
        return this.id.equals(other.id);
    }

}
