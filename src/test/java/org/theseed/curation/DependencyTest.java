/**
 *
 */
package org.theseed.curation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

/**
 * These tests verify that the libraries pulled in by the SBML reader do not displace the test tooling.
 *
 * @author Bruce Parrello
 *
 */
class DependencyTest {

    @Test
    void testMismatchDescription() {
        AssertionError e = assertThrows(AssertionError.class,
                () -> assertThat(Arrays.asList("glc__D", "atp"), contains("glc__D", "adp")));
        assertThat(e.getMessage(), containsString("adp"));
    }

    @Test
    void testNoJUnit4() {
        assertThrows(ClassNotFoundException.class, () -> Class.forName("org.junit.Assert"));
    }

}
