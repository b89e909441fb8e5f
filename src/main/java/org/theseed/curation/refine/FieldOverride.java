/**
 *
 */
package org.theseed.curation.refine;

import org.apache.commons.lang3.StringUtils;
import org.theseed.curation.model.Metabolite;
import org.theseed.curation.model.Reaction;

/**
 * This object is a row of a field override table.  It replaces the value of a single field in a
 * metabolite or reaction.
 *
 * @author Bruce Parrello
 *
 */
public class FieldOverride {

    /**
     * This enumeration describes the fields that can be overridden.
     */
    public static enum Field {
        NAME {
            @Override
            public void apply(Metabolite metabolite, String value) {
                metabolite.setName(value);
            }

            @Override
            public void apply(Reaction reaction, String value) {
                reaction.setName(value);
            }
        }, FORMULA {
            @Override
            public void apply(Metabolite metabolite, String value) {
                metabolite.setFormula(value);
            }
        }, MASS {
            @Override
            public void apply(Metabolite metabolite, String value) throws MalformedEditTableException {
                if (StringUtils.isBlank(value))
                    metabolite.setMass(Double.NaN);
                else try {
                    metabolite.setMass(Double.parseDouble(value));
                } catch (NumberFormatException e) {
                    throw new MalformedEditTableException("Invalid mass \"" + value + "\" for " + metabolite.getId() + ".");
                }
            }
        }, CHARGE {
            @Override
            public void apply(Metabolite metabolite, String value) throws MalformedEditTableException {
                if (StringUtils.isBlank(value))
                    metabolite.setCharge(null);
                else try {
                    metabolite.setCharge(Integer.valueOf(value.trim()));
                } catch (NumberFormatException e) {
                    throw new MalformedEditTableException("Invalid charge \"" + value + "\" for " + metabolite.getId() + ".");
                }
            }
        };

        /**
         * Store a value in this field of a metabolite.
         *
         * @param metabolite	metabolite to update
         * @param value			new field value
         *
         * @throws MalformedEditTableException
         */
        public abstract void apply(Metabolite metabolite, String value) throws MalformedEditTableException;

        /**
         * Store a value in this field of a reaction.  Only the name can be changed in a reaction.
         *
         * @param reaction		reaction to update
         * @param value			new field value
         *
         * @throws MalformedEditTableException
         */
        public void apply(Reaction reaction, String value) throws MalformedEditTableException {
            throw new MalformedEditTableException("Field \"" + this.toString() + "\" cannot be changed in reaction "
                    + reaction.getId() + ".");
        }

        @Override
        public String toString() {
            return this.name().toLowerCase();
        }

        /**
         * @return the field with the specified name
         *
         * @param name	field name from an override table
         *
         * @throws MalformedEditTableException
         */
        public static Field parse(String name) throws MalformedEditTableException {
            Field retVal = null;
            for (Field field : Field.values()) {
                if (field.toString().equalsIgnoreCase(StringUtils.trim(name)))
                    retVal = field;
            }
            if (retVal == null)
                throw new MalformedEditTableException("Unknown override field \"" + name + "\".");
            return retVal;
        }

    }

    // FIELDS
    /** ID of the entity to change */
    private final String identifier;
    /** field to change */
    private final Field field;
    /** new value */
    private final String value;

    /**
     * Construct a field override.
     *
     * @param identifier	ID of the metabolite or reaction to change
     * @param fieldName		name of the field to change
     * @param value			new value for the field
     *
     * @throws MalformedEditTableException	if the field name is not recognized
     */
    public FieldOverride(String identifier, String fieldName, String value) throws MalformedEditTableException {
        this.identifier = identifier;
        this.field = Field.parse(fieldName);
        this.value = value;
    }

    /**
     * @return the ID of the entity to change
     */
    public String getIdentifier() {
        return this.identifier;
    }

    /**
     * @return the field to change
     */
    public Field getField() {
        return this.field;
    }

    /**
     * @return the new value
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return this.identifier + "." + this.field + " = " + this.value;
    }

}
