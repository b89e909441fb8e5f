/**
 *
 */
package org.theseed.curation.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.CurationException;
import org.theseed.curation.CurationReport;

/**
 * This object is an ordered list of curation stages.  When a stage is added, we verify that every
 * state it requires has been provided by the initial state or by an earlier stage, so a pipeline
 * assembled in the wrong order fails when it is built rather than producing a bad model.
 *
 * When the pipeline runs, each stage receives the output of the previous one, and the integrity
 * check is applied to every stage's output.
 *
 * @param <T>	type of model processed
 *
 * @author Bruce Parrello
 *
 */
public class CurationPipeline<T> {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CurationPipeline.class);
    /** list of stages, in execution order */
    private List<CurationStage<T>> stages;
    /** states reached so far by the stages added */
    private Set<StageState> reached;
    /** integrity check to run after each stage */
    private IntegrityCheck<T> checker;

    /**
     * Construct an empty pipeline.
     *
     * @param initial	state of the input model
     * @param checker	integrity check to run after each stage
     */
    public CurationPipeline(StageState initial, IntegrityCheck<T> checker) {
        this.stages = new ArrayList<CurationStage<T>>();
        this.reached = EnumSet.of(initial);
        this.checker = checker;
    }

    /**
     * Add a stage to the end of this pipeline.
     *
     * @param stage		stage to add
     *
     * @return this object, for chaining
     *
     * @throws IllegalStateException	if the stage requires a state not yet reached
     */
    public CurationPipeline<T> add(CurationStage<T> stage) {
        for (StageState required : stage.getRequired()) {
            if (! this.reached.contains(required))
                throw new IllegalStateException("Stage \"" + stage.getName() + "\" requires state "
                        + required + ", which no earlier stage provides.");
        }
        this.stages.add(stage);
        this.reached.add(stage.getProvided());
        return this;
    }

    /**
     * Run the pipeline.
     *
     * @param input		input model (not modified)
     * @param report	report to receive record-level problems and notes
     *
     * @return the output of the last stage
     *
     * @throws CurationException
     */
    public T run(T input, CurationReport report) throws CurationException {
        T retVal = input;
        for (CurationStage<T> stage : this.stages) {
            log.info("Running stage \"{}\".", stage.getName());
            retVal = stage.apply(retVal, report);
            this.checker.verify(retVal);
        }
        return retVal;
    }

    /**
     * @return the stages of this pipeline, in order
     */
    public List<CurationStage<T>> getStages() {
        return Collections.unmodifiableList(this.stages);
    }

    /**
     * @return TRUE if this pipeline reaches the specified state
     *
     * @param state		state of interest
     */
    public boolean reaches(StageState state) {
        return this.reached.contains(state);
    }

}
