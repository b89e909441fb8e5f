/**
 *
 */
package org.theseed.curation.model;

import java.math.BigDecimal;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents a chemical species in a metabolic model.  The ID is unique within the
 * model.  The mass and charge are optional:  an unknown mass is NaN and an unknown charge is NULL.
 *
 * @author Bruce Parrello
 *
 */
public class Metabolite {

    // FIELDS
    /** metabolite ID */
    private String id;
    /** metabolite name */
    private String name;
    /** chemical formula */
    private String formula;
    /** molecular mass (NaN if unknown) */
    private double mass;
    /** net charge (NULL if unknown) */
    private Integer charge;
    /** cross-references */
    private References references;

    private static enum MetaboliteKeys implements JsonKey {
        ID(""), NAME(""), FORMULA(""), MASS(null), CHARGE(null), REFERENCES(null);

        private final Object m_value;

        private MetaboliteKeys(final Object value) {
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
     * Construct a metabolite with no mass, charge, or references.
     *
     * @param id		metabolite ID
     * @param name		metabolite name
     * @param formula	chemical formula
     */
    public Metabolite(String id, String name, String formula) {
        this.id = id;
        this.name = name;
        this.formula = formula;
        this.mass = Double.NaN;
        this.charge = null;
        this.references = new References();
    }

    /**
     * Construct a metabolite from a JSON object.
     *
     * @param json		JSON object describing the metabolite
     */
    public Metabolite(JsonObject json) {
        this.id = json.getStringOrDefault(MetaboliteKeys.ID);
        this.name = json.getStringOrDefault(MetaboliteKeys.NAME);
        this.formula = json.getStringOrDefault(MetaboliteKeys.FORMULA);
        Object massValue = json.get(MetaboliteKeys.MASS.getKey());
        this.mass = (massValue == null ? Double.NaN : ((Number) massValue).doubleValue());
        Object chargeValue = json.get(MetaboliteKeys.CHARGE.getKey());
        this.charge = (chargeValue == null ? null : ((Number) chargeValue).intValue());
        JsonObject refs = (JsonObject) json.get(MetaboliteKeys.REFERENCES.getKey());
        this.references = (refs == null ? new References() : new References(refs));
    }

    /**
     * @return a deep copy of this metabolite
     */
    public Metabolite copy() {
        return this.copy(this.id);
    }

    /**
     * @return a deep copy of this metabolite with a different ID
     *
     * @param newId		ID to give the copy
     */
    public Metabolite copy(String newId) {
        Metabolite retVal = new Metabolite(newId, this.name, this.formula);
        retVal.mass = this.mass;
        retVal.charge = this.charge;
        retVal.references = this.references.copy();
        return retVal;
    }

    /**
     * @return a JSON object describing this metabolite
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(MetaboliteKeys.ID.getKey(), this.id);
        retVal.put(MetaboliteKeys.NAME.getKey(), this.name);
        retVal.put(MetaboliteKeys.FORMULA.getKey(), this.formula);
        if (this.hasMass())
            retVal.put(MetaboliteKeys.MASS.getKey(), BigDecimal.valueOf(this.mass));
        if (this.charge != null)
            retVal.put(MetaboliteKeys.CHARGE.getKey(), this.charge);
        retVal.put(MetaboliteKeys.REFERENCES.getKey(), this.references.toJson());
        return retVal;
    }

    /**
     * @return the metabolite ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the metabolite name
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
     * @return the chemical formula
     */
    public String getFormula() {
        return this.formula;
    }

    /**
     * @param formula 	the formula to set
     */
    public void setFormula(String formula) {
        this.formula = formula;
    }

    /**
     * @return the molecular mass, or NaN if it is unknown
     */
    public double getMass() {
        return this.mass;
    }

    /**
     * @return TRUE if the mass is known
     */
    public boolean hasMass() {
        return Double.isFinite(this.mass);
    }

    /**
     * @param mass 	the mass to set (NaN if unknown)
     */
    public void setMass(double mass) {
        this.mass = mass;
    }

    /**
     * @return the net charge, or NULL if it is unknown
     */
    public Integer getCharge() {
        return this.charge;
    }

    /**
     * @param charge 	the charge to set (NULL if unknown)
     */
    public void setCharge(Integer charge) {
        this.charge = charge;
    }

    /**
     * @return the cross-references
     */
    public References getReferences() {
        return this.references;
    }

    @Override
    public String toString() {
        return "Metabolite " + this.id + " (" + this.name + ")";
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
        Metabolite other = (Metabolite) obj;
        return this.id.equals(other.id);
    }

}
