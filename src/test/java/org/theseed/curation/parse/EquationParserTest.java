/**
 *
 */
package org.theseed.curation.parse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.theseed.curation.model.Reaction.Participant;
import org.theseed.curation.model.Reaction.Role;

/**
 * @author Bruce Parrello
 *
 */
class EquationParserTest {

    @Test
    void testForward() throws MalformedEquationException {
        EquationParser.ParsedEquation parsed = EquationParser.parse("R1", "2 A@c + B@c --> C@c");
        assertThat("Forward equation is reversible.", ! parsed.isReversible());
        assertThat(parsed.getDirection(), equalTo(EquationParser.Direction.FORWARD));
        assertThat(parsed.getParticipants(), contains(new Participant("A", "c", 2.0, Role.REACTANT),
                new Participant("B", "c", 1.0, Role.REACTANT), new Participant("C", "c", 1.0, Role.PRODUCT)));
        Participant part = parsed.getParticipants().get(0);
        assertThat(part.getSignedCoefficient(), equalTo(-2.0));
        assertThat("Reactant is a product.", ! part.isProduct());
    }

    @Test
    void testReversible() throws MalformedEquationException {
        EquationParser.ParsedEquation parsed = EquationParser.parse("R2", "1 MNXM1@MNXD1 + 1.5 MNXM2@MNXD1 <==> 1 MNXM3@MNXD2");
        assertThat("Bidirectional equation is not reversible.", parsed.isReversible());
        List<Participant> parts = parsed.getParticipants();
        assertThat(parts.size(), equalTo(3));
        assertThat(parts.get(1).getCoefficient(), equalTo(1.5));
        assertThat(parts.get(2).getMetaboliteId(), equalTo("MNXM3"));
        assertThat(parts.get(2).getCompartmentId(), equalTo("MNXD2"));
        assertThat(parts.get(2).getRole(), equalTo(Role.PRODUCT));
    }

    @Test
    void testReverse() throws MalformedEquationException {
        EquationParser.ParsedEquation parsed = EquationParser.parse("R3", "A@c <-- B@c");
        assertThat("Reverse equation is reversible.", ! parsed.isReversible());
        assertThat(parsed.getParticipants(), contains(new Participant("B", "c", 1.0, Role.REACTANT),
                new Participant("A", "c", 1.0, Role.PRODUCT)));
    }

    @Test
    void testEmptySide() throws MalformedEquationException {
        EquationParser.ParsedEquation parsed = EquationParser.parse("EX", "1 glc@e --> ");
        assertThat(parsed.getParticipants(), contains(new Participant("glc", "e", 1.0, Role.REACTANT)));
    }

    @Test
    void testMalformed() {
        MalformedEquationException e = assertThrows(MalformedEquationException.class,
                () -> EquationParser.parse("BAD1", "A@c + B@c"));
        assertThat(e.getReactionId(), equalTo("BAD1"));
        assertThat(e.getEquation(), equalTo("A@c + B@c"));
        assertThrows(MalformedEquationException.class, () -> EquationParser.parse("BAD2", "x A@c --> B@c"));
        assertThrows(MalformedEquationException.class, () -> EquationParser.parse("BAD3", "2 A --> B@c"));
        assertThrows(MalformedEquationException.class, () -> EquationParser.parse("BAD4", "A@c --> B@c --> C@c"));
        assertThrows(MalformedEquationException.class, () -> EquationParser.parse("BAD5", ""));
    }

    @Test
    void testMixedArrows() {
        assertThat(EquationParser.Direction.count("A@c <==> B@c --> C@c"), equalTo(2));
        assertThat(EquationParser.Direction.count("A@c <-- B@c"), equalTo(1));
        MalformedEquationException e = assertThrows(MalformedEquationException.class,
                () -> EquationParser.parse("MIX1", "A@c <==> B@c --> C@c"));
        assertThat(e.getMessage(), containsString("multiple direction tokens"));
        e = assertThrows(MalformedEquationException.class, () -> EquationParser.parse("MIX2", "A@c --> B@c <-- C@c"));
        assertThat(e.getMessage(), containsString("multiple direction tokens"));
    }

}
