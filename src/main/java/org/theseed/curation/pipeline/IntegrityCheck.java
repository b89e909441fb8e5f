/**
 *
 */
package org.theseed.curation.pipeline;

import org.theseed.curation.CurationException;

/**
 * This interface describes a referential-integrity check that is run on the output of every
 * pipeline stage.
 *
 * @param <T>	type of model checked
 *
 * @author Bruce Parrello
 *
 */
@FunctionalInterface
public interface IntegrityCheck<T> {

    /**
     * Verify that a model is internally consistent.
     *
     * @param model		model to verify
     *
     * @throws CurationException	if the model has a dangling reference
     */
    public void verify(T model) throws CurationException;

}
