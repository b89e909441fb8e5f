/**
 *
 */
package org.theseed.curation.pipeline;

/**
 * This enumeration lists the states a model can reach during curation.  Each pipeline stage
 * requires some of these states and provides one of them.
 *
 * @author Bruce Parrello
 *
 */
public enum StageState {
    /** SBML model as loaded */
    LOADED,
    /** compartments have descriptive names */
    COMPARTMENTS_NAMED,
    /** boundary metabolites are in the boundary compartment */
    BOUNDARY_REWRITTEN,
    /** species ID prefixes are removed */
    PREFIX_STRIPPED,
    /** curator identifier translations are applied */
    IDENTIFIERS_TRANSLATED,
    /** structured model built from the flat export */
    EXTRACTED,
    /** curator metabolite removals are applied */
    METABOLITES_REMOVED,
    /** curator reaction removals are applied */
    REACTIONS_REMOVED,
    /** curator field overrides are applied */
    FIELDS_OVERRIDDEN;
}
