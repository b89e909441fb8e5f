/**
 *
 */
package org.theseed.curation;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object contains the tuning parameters for a curation run.  It is passed explicitly to each
 * pipeline stage that needs it.  The defaults match the conventions of the Recon/MetaNetX models;
 * any of them can be overridden from a properties file or by the client.
 *
 * The property keys are
 *
 * boundary.id				ID of the model-boundary compartment
 * boundary.name			descriptive name for the model-boundary compartment
 * boundary.letters			compartment letters that can appear in a boundary metabolite ID
 * extracellular.id			ID of the extracellular compartment
 * extracellular.name		descriptive name for the extracellular compartment
 * species.prefix			literal prefix to strip from species IDs
 * annotation.marker		marker that precedes a species ID in an annotation URI
 *
 * @author Bruce Parrello
 *
 */
public class CurationConfig {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CurationConfig.class);
    /** ID of the boundary compartment */
    private String boundaryId;
    /** name to give the boundary compartment */
    private String boundaryName;
    /** compartment letters recognized in boundary metabolite IDs */
    private String boundaryLetters;
    /** ID of the extracellular compartment */
    private String extracellularId;
    /** name to give the extracellular compartment */
    private String extracellularName;
    /** prefix to strip from species IDs */
    private String speciesPrefix;
    /** annotation URI marker */
    private String annotationMarker;

    /**
     * Construct a configuration with the default values.
     */
    public CurationConfig() {
        this.boundaryId = "b";
        this.boundaryName = "model boundary";
        this.boundaryLetters = "eciglmnrx";
        this.extracellularId = "e";
        this.extracellularName = "extracellular region";
        this.speciesPrefix = "M_";
        this.annotationMarker = "#";
    }

    /**
     * Construct a configuration from a properties file.  Keys not present in the file keep
     * their default values.
     *
     * @param propFile	properties file to read
     *
     * @throws IOException
     */
    public CurationConfig(File propFile) throws IOException {
        this();
        Properties props = new Properties();
        try (Reader reader = new FileReader(propFile, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        this.boundaryId = props.getProperty("boundary.id", this.boundaryId);
        this.boundaryName = props.getProperty("boundary.name", this.boundaryName);
        this.boundaryLetters = props.getProperty("boundary.letters", this.boundaryLetters);
        this.extracellularId = props.getProperty("extracellular.id", this.extracellularId);
        this.extracellularName = props.getProperty("extracellular.name", this.extracellularName);
        this.speciesPrefix = props.getProperty("species.prefix", this.speciesPrefix);
        this.annotationMarker = props.getProperty("annotation.marker", this.annotationMarker);
        if (StringUtils.isBlank(this.boundaryId) || StringUtils.isBlank(this.boundaryLetters))
            throw new IOException("Boundary compartment settings in " + propFile + " cannot be blank.");
        log.info("Curation configuration loaded from {}.", propFile);
    }

    /**
     * @return the ID of the boundary compartment
     */
    public String getBoundaryId() {
        return this.boundaryId;
    }

    /**
     * Specify a new boundary compartment ID.
     *
     * @param boundaryId 	the boundary compartment ID to set
     */
    public CurationConfig setBoundaryId(String boundaryId) {
        this.boundaryId = boundaryId;
        return this;
    }

    /**
     * @return the descriptive name for the boundary compartment
     */
    public String getBoundaryName() {
        return this.boundaryName;
    }

    /**
     * @return the compartment letters allowed in a boundary metabolite ID
     */
    public String getBoundaryLetters() {
        return this.boundaryLetters;
    }

    /**
     * @return the ID of the extracellular compartment
     */
    public String getExtracellularId() {
        return this.extracellularId;
    }

    /**
     * @return the descriptive name for the extracellular compartment
     */
    public String getExtracellularName() {
        return this.extracellularName;
    }

    /**
     * @return the prefix to strip from species IDs
     */
    public String getSpeciesPrefix() {
        return this.speciesPrefix;
    }

    /**
     * Specify a new species ID prefix.
     *
     * @param speciesPrefix 	the prefix to set
     */
    public CurationConfig setSpeciesPrefix(String speciesPrefix) {
        this.speciesPrefix = speciesPrefix;
        return this;
    }

    /**
     * @return the marker that precedes a species ID in an annotation URI
     */
    public String getAnnotationMarker() {
        return this.annotationMarker;
    }

}
