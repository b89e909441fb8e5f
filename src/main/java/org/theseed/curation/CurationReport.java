/**
 *
 */
package org.theseed.curation;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object collects the record-level problems and the notable events of a curation run.
 * Problems are exceptions that apply to a single record and do not stop the run.  Notes are
 * informational messages (such as merges) that the curator should be able to review.
 *
 * @author Bruce Parrello
 *
 */
public class CurationReport {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CurationReport.class);
    /** list of problems found */
    private List<CurationException> problems;
    /** list of informational notes */
    private List<String> notes;

    /**
     * Construct an empty report.
     */
    public CurationReport() {
        this.problems = new ArrayList<CurationException>();
        this.notes = new ArrayList<String>();
    }

    /**
     * Record a problem.
     *
     * @param problem	exception describing the problem
     */
    public void addProblem(CurationException problem) {
        log.warn(problem.getMessage());
        this.problems.add(problem);
    }

    /**
     * Record a note.
     *
     * @param note	text of the note
     */
    public void addNote(String note) {
        log.debug(note);
        this.notes.add(note);
    }

    /**
     * @return the problems recorded
     */
    public List<CurationException> getProblems() {
        return Collections.unmodifiableList(this.problems);
    }

    /**
     * @return the problems of a particular type
     *
     * @param type	class of the desired problems
     */
    public <T extends CurationException> List<T> getProblems(Class<T> type) {
        return this.problems.stream().filter(x -> type.isInstance(x)).map(x -> type.cast(x))
                .collect(Collectors.toList());
    }

    /**
     * @return the notes recorded
     */
    public List<String> getNotes() {
        return Collections.unmodifiableList(this.notes);
    }

    /**
     * @return TRUE if no problems were recorded
     */
    public boolean isClean() {
        return this.problems.isEmpty();
    }

    /**
     * Write this report.  Each line contains a type (the problem class or "note") and a message.
     *
     * @param writer	output print writer
     */
    public void write(PrintWriter writer) {
        writer.println("type\tmessage");
        for (CurationException problem : this.problems)
            writer.println(problem.getClass().getSimpleName() + "\t" + problem.getMessage());
        for (String note : this.notes)
            writer.println("note\t" + note);
        writer.flush();
    }

    @Override
    public String toString() {
        return "Curation report with " + this.problems.size() + " problems and " + this.notes.size() + " notes";
    }

}
