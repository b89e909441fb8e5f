/**
 *
 */
package org.theseed.curation.parse;

import org.theseed.curation.CurationException;

/**
 * This exception is thrown when a reaction equation cannot be parsed.  It applies to a single
 * reaction, and extraction continues with the other reactions.
 *
 * @author Bruce Parrello
 *
 */
public class MalformedEquationException extends CurationException {

    /** serialization version ID */
    private static final long serialVersionUID = 4104558032613722468L;
    /** ID of the reaction with the bad equation */
    private final String reactionId;
    /** text of the bad equation */
    private final String equation;

    /**
     * Construct a malformed-equation exception.
     *
     * @param reactionId	ID of the offending reaction
     * @param equation		text of the offending equation
     * @param problem		description of the problem
     */
    public MalformedEquationException(String reactionId, String equation, String problem) {
        super("Reaction " + reactionId + " has a malformed equation \"" + equation + "\": " + problem);
        this.reactionId = reactionId;
        this.equation = equation;
    }

    /**
     * @return the ID of the offending reaction
     */
    public String getReactionId() {
        return this.reactionId;
    }

    /**
     * @return the text of the offending equation
     */
    public String getEquation() {
        return this.equation;
    }

}
