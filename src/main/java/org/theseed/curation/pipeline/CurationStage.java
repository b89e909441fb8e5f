/**
 *
 */
package org.theseed.curation.pipeline;

import java.util.Set;

import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;

/**
 * This interface describes a single named stage of a curation pipeline.  A stage takes an input
 * model and returns an edited copy; it must never modify its input.  Each stage declares the
 * states it needs the input to be in and the state its output reaches.
 *
 * @param <T>	type of model processed
 *
 * @author Bruce Parrello
 *
 */
public interface CurationStage<T> {

    /**
     * @return the name of this stage, for logging
     */
    public String getName();

    /**
     * @return the states the input must have reached before this stage runs
     */
    public Set<StageState> getRequired();

    /**
     * @return the state the output reaches after this stage runs
     */
    public StageState getProvided();

    /**
     * Apply this stage to a model.
     *
     * @param input		model to process (not modified)
     * @param report	report to receive record-level problems and notes
     *
     * @return a new, edited model
     *
     * @throws CurationException
     */
    public T apply(T input, CurationReport report) throws CurationException;

}
