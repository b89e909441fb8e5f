/**
 *
 */
package org.theseed.curation.refine;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.theseed.curation.io.TabularReader;

/**
 * This class loads curator edit tables.  Each table is tab-delimited with a header line, and must
 * contain the columns for its type.  Extra columns are ignored.
 *
 * @author Bruce Parrello
 *
 */
public class EditTables {

    /** columns of an identifier translation table */
    public static final String[] TRANSLATION_COLUMNS = new String[] { "identifier_original", "identifier_novel" };
    /** columns of a metabolite removal table */
    public static final String[] METABOLITE_REMOVAL_COLUMNS = new String[] { "removal_identifier", "replacement_identifier" };
    /** columns of a reaction removal table */
    public static final String[] REACTION_REMOVAL_COLUMNS = new String[] { "identifier" };
    /** columns of a field override table */
    public static final String[] FIELD_OVERRIDE_COLUMNS = new String[] { "identifier", "field", "value" };

    /**
     * Read a table and verify that it has the required columns.
     *
     * @param file		file containing the table
     * @param columns	names of the required columns
     *
     * @return the records in the table
     *
     * @throws IOException
     * @throws MalformedEditTableException
     */
    private static List<Map<String, String>> readTable(File file, String... columns)
            throws IOException, MalformedEditTableException {
        TabularReader reader = new TabularReader().parse(file);
        for (String column : columns) {
            if (! reader.getHeader().contains(column))
                throw new MalformedEditTableException("Edit table " + file + " is missing column \"" + column + "\".");
        }
        return reader.getResults();
    }

    /**
     * @return the rows of an identifier translation table, in file order
     *
     * @param file	file containing the table
     *
     * @throws IOException
     * @throws MalformedEditTableException
     */
    public static List<TranslationEdit> readTranslations(File file) throws IOException, MalformedEditTableException {
        List<TranslationEdit> retVal = new ArrayList<TranslationEdit>();
        for (Map<String, String> record : readTable(file, TRANSLATION_COLUMNS)) {
            String original = record.get(TRANSLATION_COLUMNS[0]);
            String novel = record.get(TRANSLATION_COLUMNS[1]);
            if (StringUtils.isBlank(original))
                throw new MalformedEditTableException("Blank original identifier in " + file + ".");
            if (StringUtils.isBlank(novel))
                throw new MalformedEditTableException("Blank novel identifier for " + original + " in " + file + ".");
            retVal.add(new TranslationEdit(original, novel));
        }
        return retVal;
    }

    /**
     * @return the rows of a metabolite removal table, in file order
     *
     * @param file	file containing the table
     *
     * @throws IOException
     * @throws MalformedEditTableException
     */
    public static List<MetaboliteRemoval> readMetaboliteRemovals(File file) throws IOException, MalformedEditTableException {
        List<MetaboliteRemoval> retVal = new ArrayList<MetaboliteRemoval>();
        for (Map<String, String> record : readTable(file, METABOLITE_REMOVAL_COLUMNS)) {
            String removal = record.get(METABOLITE_REMOVAL_COLUMNS[0]);
            String replacement = record.get(METABOLITE_REMOVAL_COLUMNS[1]);
            if (StringUtils.isBlank(removal) || StringUtils.isBlank(replacement))
                throw new MalformedEditTableException("Blank identifier in metabolite removal table " + file + ".");
            retVal.add(new MetaboliteRemoval(removal, replacement));
        }
        return retVal;
    }

    /**
     * @return the IDs in a reaction removal table, in file order
     *
     * @param file	file containing the table
     *
     * @throws IOException
     * @throws MalformedEditTableException
     */
    public static List<String> readReactionRemovals(File file) throws IOException, MalformedEditTableException {
        List<String> retVal = new ArrayList<String>();
        for (Map<String, String> record : readTable(file, REACTION_REMOVAL_COLUMNS))
            retVal.add(record.get(REACTION_REMOVAL_COLUMNS[0]));
        return retVal;
    }

    /**
     * @return the rows of a field override table, in file order
     *
     * @param file	file containing the table
     *
     * @throws IOException
     * @throws MalformedEditTableException
     */
    public static List<FieldOverride> readFieldOverrides(File file) throws IOException, MalformedEditTableException {
        List<FieldOverride> retVal = new ArrayList<FieldOverride>();
        for (Map<String, String> record : readTable(file, FIELD_OVERRIDE_COLUMNS))
            retVal.add(new FieldOverride(record.get(FIELD_OVERRIDE_COLUMNS[0]), record.get(FIELD_OVERRIDE_COLUMNS[1]),
                    record.get(FIELD_OVERRIDE_COLUMNS[2])));
        return retVal;
    }

}
