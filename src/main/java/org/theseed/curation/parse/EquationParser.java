/**
 *
 */
package org.theseed.curation.parse;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.curation.model.Reaction;
import org.theseed.curation.model.Reaction.Participant;
import org.theseed.curation.model.Reaction.Role;

/**
 * This class parses the text equation of a reaction into a participant list.  An equation looks
 * like
 *
 * 		2 MNXM1@MNXD1 + MNXM2@MNXD1 <==> 1 MNXM3@MNXD1
 *
 * Each side is a list of terms separated by " + ".  A term is an optional coefficient followed by
 * a metabolite ID, an at-sign, and a compartment ID.  A missing coefficient means 1.  The arrow
 * determines both reversibility and which side holds the reactants.
 *
 * @author Bruce Parrello
 *
 */
public class EquationParser {

    /** separator between the terms on one side of an equation */
    public static final String TERM_SEPARATOR = " + ";
    /** separator between a metabolite ID and its compartment */
    public static final String COMPARTMENT_SEPARATOR = "@";

    /**
     * This enumeration describes the arrow tokens.  The enumeration order is the search order.
     */
    public static enum Direction {
        /** reversible reaction, reactants on the left */
        BIDIRECTIONAL("<==>") {
            @Override
            protected boolean isReversed() {
                return false;
            }
        },
        /** forward reaction, reactants on the left */
        FORWARD("-->") {
            @Override
            protected boolean isReversed() {
                return false;
            }
        },
        /** reverse reaction, reactants on the right */
        REVERSE("<--") {
            @Override
            protected boolean isReversed() {
                return true;
            }
        };

        /** arrow token */
        private final String token;

        private Direction(String token) {
            this.token = token;
        }

        /**
         * @return the arrow token
         */
        public String getToken() {
            return this.token;
        }

        /**
         * @return TRUE if the reactants are on the right side of the arrow
         */
        protected abstract boolean isReversed();

        /**
         * @return TRUE if a reaction with this arrow is reversible
         */
        public boolean isReversible() {
            return (this == BIDIRECTIONAL);
        }

        /**
         * @return the direction indicated by an equation, or NULL if there is no arrow
         *
         * @param equation	equation to examine
         */
        public static Direction find(String equation) {
            Direction retVal = null;
            for (int i = 0; retVal == null && i < Direction.values().length; i++) {
                Direction dir = Direction.values()[i];
                if (equation.contains(dir.token))
                    retVal = dir;
            }
            return retVal;
        }

        /**
         * @return the number of arrow tokens of any kind in an equation
         *
         * @param equation	equation to examine
         */
        public static int count(String equation) {
            int retVal = 0;
            for (Direction dir : Direction.values())
                retVal += StringUtils.countMatches(equation, dir.token);
            return retVal;
        }
    }

    /**
     * This object is the result of parsing an equation.
     */
    public static class ParsedEquation {

        /** participant list (reactants first) */
        private final List<Participant> participants;
        /** direction of the equation */
        private final Direction direction;

        protected ParsedEquation(List<Participant> participants, Direction direction) {
            this.participants = participants;
            this.direction = direction;
        }

        /**
         * @return the participants, reactants first, each side in its original order
         */
        public List<Participant> getParticipants() {
            return this.participants;
        }

        /**
         * @return TRUE if the equation was bidirectional
         */
        public boolean isReversible() {
            return this.direction.isReversible();
        }

        /**
         * @return the direction of the equation
         */
        public Direction getDirection() {
            return this.direction;
        }

    }

    /**
     * Parse a reaction equation.
     *
     * @param reactionId	ID of the reaction (for error messages)
     * @param equation		equation to parse
     *
     * @return the parsed equation
     *
     * @throws MalformedEquationException
     */
    public static ParsedEquation parse(String reactionId, String equation) throws MalformedEquationException {
        if (StringUtils.isBlank(equation))
            throw new MalformedEquationException(reactionId, "", "equation is empty");
        Direction dir = Direction.find(equation);
        if (dir == null)
            throw new MalformedEquationException(reactionId, equation, "no direction token found");
        // Split at the arrow.  There must be only one, counting all arrow types.
        if (Direction.count(equation) > 1)
            throw new MalformedEquationException(reactionId, equation, "multiple direction tokens found");
        final String token = dir.getToken();
        int pos = equation.indexOf(token);
        String left = equation.substring(0, pos);
        String right = equation.substring(pos + token.length());
        String reactantSide = (dir.isReversed() ? right : left);
        String productSide = (dir.isReversed() ? left : right);
        // Parse the two sides.
        List<Participant> participants = new ArrayList<Participant>();
        parseSide(reactionId, equation, reactantSide, Reaction.Role.REACTANT, participants);
        parseSide(reactionId, equation, productSide, Reaction.Role.PRODUCT, participants);
        return new ParsedEquation(participants, dir);
    }

    /**
     * Parse one side of an equation, adding the participants to an output list.  An empty side
     * produces no participants.
     *
     * @param reactionId	ID of the reaction (for error messages)
     * @param equation		full equation (for error messages)
     * @param side			text of the side to parse
     * @param role			role of the participants on this side
     * @param output		list to which the participants should be added
     *
     * @throws MalformedEquationException
     */
    private static void parseSide(String reactionId, String equation, String side, Role role,
            List<Participant> output) throws MalformedEquationException {
        String trimmed = side.trim();
        if (! trimmed.isEmpty()) {
            String[] terms = StringUtils.splitByWholeSeparatorPreserveAllTokens(trimmed, TERM_SEPARATOR);
            for (String term : terms)
                output.add(parseTerm(reactionId, equation, term.trim(), role));
        }
    }

    /**
     * Parse a single term of an equation.
     *
     * @param reactionId	ID of the reaction (for error messages)
     * @param equation		full equation (for error messages)
     * @param term			term to parse
     * @param role			role of the participant
     *
     * @return the participant described by the term
     *
     * @throws MalformedEquationException
     */
    private static Participant parseTerm(String reactionId, String equation, String term, Role role)
            throws MalformedEquationException {
        if (term.isEmpty())
            throw new MalformedEquationException(reactionId, equation, "empty term");
        // Separate the coefficient from the species.
        String[] parts = StringUtils.split(term);
        double coefficient;
        String species;
        if (parts.length == 1) {
            coefficient = 1.0;
            species = parts[0];
        } else if (parts.length == 2) {
            try {
                coefficient = Double.parseDouble(parts[0]);
            } catch (NumberFormatException e) {
                throw new MalformedEquationException(reactionId, equation, "invalid coefficient \"" + parts[0]
                        + "\"");
            }
            if (! Double.isFinite(coefficient))
                throw new MalformedEquationException(reactionId, equation, "invalid coefficient \"" + parts[0]
                        + "\"");
            species = parts[1];
        } else
            throw new MalformedEquationException(reactionId, equation, "term \"" + term + "\" has too many parts");
        // Separate the metabolite from the compartment.
        int sep = species.lastIndexOf(COMPARTMENT_SEPARATOR);
        if (sep < 0)
            throw new MalformedEquationException(reactionId, equation, "term \"" + term + "\" has no compartment");
        String metabolite = species.substring(0, sep);
        String compartment = species.substring(sep + COMPARTMENT_SEPARATOR.length());
        if (metabolite.isEmpty() || compartment.isEmpty())
            throw new MalformedEquationException(reactionId, equation, "term \"" + term
                    + "\" has an empty metabolite or compartment");
        return new Participant(metabolite, compartment, coefficient, role);
    }

}
