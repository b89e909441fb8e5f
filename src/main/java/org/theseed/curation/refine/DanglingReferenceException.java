/**
 *
 */
package org.theseed.curation.refine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.theseed.curation.CurationException;

/**
 * This exception is thrown when an edited model has a reference to an entity that does not exist.
 * It is fatal to the batch that produced the model, and lists every violation found.
 *
 * @author Bruce Parrello
 *
 */
public class DanglingReferenceException extends CurationException {

    /** serialization version ID */
    private static final long serialVersionUID = -7731530240412861962L;
    /** maximum number of violations to list in the message */
    private static final int MAX_LISTED = 10;
    /** list of violations */
    private final List<Violation> violations;

    /**
     * This object describes a single dangling reference.
     */
    public static class Violation {

        /** ID of the entity containing the bad reference */
        private final String ownerId;
        /** type of entity referenced */
        private final String type;
        /** ID referenced */
        private final String referenceId;

        /**
         * Construct a violation.
         *
         * @param ownerId		ID of the reaction or metabolite holding the reference
         * @param type			type of entity referenced ("metabolite" or "compartment")
         * @param referenceId	ID that could not be found
         */
        public Violation(String ownerId, String type, String referenceId) {
            this.ownerId = ownerId;
            this.type = type;
            this.referenceId = referenceId;
        }

        /**
         * @return the ID of the entity holding the bad reference
         */
        public String getOwnerId() {
            return this.ownerId;
        }

        /**
         * @return the type of entity referenced
         */
        public String getType() {
            return this.type;
        }

        /**
         * @return the missing ID
         */
        public String getReferenceId() {
            return this.referenceId;
        }

        @Override
        public String toString() {
            return this.ownerId + " refers to missing " + this.type + " " + this.referenceId;
        }

    }

    /**
     * Construct a dangling-reference exception.
     *
     * @param violations	list of violations found
     */
    public DanglingReferenceException(List<Violation> violations) {
        super(buildMessage(violations));
        this.violations = new ArrayList<Violation>(violations);
    }

    /**
     * @return the exception message for a list of violations
     *
     * @param violations	list of violations found
     */
    private static String buildMessage(List<Violation> violations) {
        String retVal = violations.size() + " dangling references found: "
                + violations.stream().limit(MAX_LISTED).map(x -> x.toString()).collect(Collectors.joining("; "));
        if (violations.size() > MAX_LISTED)
            retVal += "; ...";
        return retVal;
    }

    /**
     * @return the violations found
     */
    public List<Violation> getViolations() {
        return Collections.unmodifiableList(this.violations);
    }

}
