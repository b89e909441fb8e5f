/**
 *
 */
package org.theseed.curation.io;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.curation.model.CuratedModel;

import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This class persists and restores structured model snapshots.  A snapshot is the JSON form of a
 * {@link CuratedModel}, used to stage the pipeline between extraction and refinement.
 *
 * @author Bruce Parrello
 *
 */
public class ModelSnapshot {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelSnapshot.class);

    /**
     * Save a model to a snapshot file.
     *
     * @param model		model to save
     * @param outFile	output file
     *
     * @throws IOException
     */
    public static void save(CuratedModel model, File outFile) throws IOException {
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8)) {
            save(model, writer);
        }
        log.info("{} saved to {}.", model, outFile);
    }

    /**
     * Save a model to a writer.
     *
     * @param model		model to save
     * @param writer	output writer
     *
     * @throws IOException
     */
    public static void save(CuratedModel model, Writer writer) throws IOException {
        String json = Jsoner.serialize(model.toJson());
        writer.write(Jsoner.prettyPrint(json));
    }

    /**
     * Load a model from a snapshot file.
     *
     * @param inFile	input file
     *
     * @return the model stored in the file
     *
     * @throws IOException
     */
    public static CuratedModel load(File inFile) throws IOException {
        CuratedModel retVal;
        try (Reader reader = new InputStreamReader(new FileInputStream(inFile), StandardCharsets.UTF_8)) {
            retVal = load(reader);
        } catch (IOException e) {
            throw new IOException("Error loading snapshot " + inFile + ": " + e.getMessage(), e);
        }
        log.info("{} loaded from {}.", retVal, inFile);
        return retVal;
    }

    /**
     * Load a model from a reader.
     *
     * @param reader	input reader
     *
     * @return the model read
     *
     * @throws IOException
     */
    public static CuratedModel load(Reader reader) throws IOException {
        try {
            JsonObject json = (JsonObject) Jsoner.deserialize(reader);
            return new CuratedModel(json);
        } catch (JsonException e) {
            throw new IOException("JSON error: " + e.toString());
        } catch (ClassCastException e) {
            throw new IOException("Snapshot is not a JSON object.");
        }
    }

}
