/**
 *
 */
package org.theseed.curation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object holds the cross-references of a model entity, organized by category.  Each category
 * maps to an ordered list of external identifiers.  The category order is the order in which
 * categories were added.
 *
 * @author Bruce Parrello
 *
 */
public class References {

    // FIELDS
    /** map of category names to identifier lists */
    private Map<String, List<String>> refMap;
    /** empty list returned for an unknown category */
    private static final List<String> NO_REFS = Collections.emptyList();

    /**
     * Construct an empty reference set.
     */
    public References() {
        this.refMap = new LinkedHashMap<String, List<String>>();
    }

    /**
     * Construct a reference set from a JSON object.
     *
     * @param json		JSON object mapping category names to identifier arrays
     */
    public References(JsonObject json) {
        this();
        for (Map.Entry<String, Object> entry : json.entrySet()) {
            JsonArray ids = (JsonArray) entry.getValue();
            List<String> list = new ArrayList<String>(ids.size());
            for (Object id : ids)
                list.add((String) id);
            this.refMap.put(entry.getKey(), list);
        }
    }

    /**
     * @return a deep copy of this reference set
     */
    public References copy() {
        References retVal = new References();
        for (Map.Entry<String, List<String>> entry : this.refMap.entrySet())
            retVal.refMap.put(entry.getKey(), new ArrayList<String>(entry.getValue()));
        return retVal;
    }

    /**
     * Store the identifiers for a category, replacing any already present.
     *
     * @param category	category name
     * @param ids		list of identifiers
     */
    public void put(String category, List<String> ids) {
        this.refMap.put(category, new ArrayList<String>(ids));
    }

    /**
     * @return the identifiers for a category (never NULL)
     *
     * @param category	category name
     */
    public List<String> get(String category) {
        return this.refMap.getOrDefault(category, NO_REFS);
    }

    /**
     * Fold another reference set into this one.  Identifiers already present in a category
     * are not repeated.
     *
     * @param other		reference set to merge in
     */
    public void merge(References other) {
        for (Map.Entry<String, List<String>> entry : other.refMap.entrySet()) {
            List<String> list = this.refMap.computeIfAbsent(entry.getKey(), x -> new ArrayList<String>());
            for (String id : entry.getValue()) {
                if (! list.contains(id))
                    list.add(id);
            }
        }
    }

    /**
     * @return the map of categories to identifier lists
     */
    public Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(this.refMap);
    }

    /**
     * @return a JSON object for this reference set
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        for (Map.Entry<String, List<String>> entry : this.refMap.entrySet())
            retVal.put(entry.getKey(), new JsonArray(entry.getValue()));
        return retVal;
    }

    @Override
    public String toString() {
        return this.refMap.toString();
    }

}
