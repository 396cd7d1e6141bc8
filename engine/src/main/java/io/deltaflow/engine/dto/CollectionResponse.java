package io.deltaflow.engine.dto;

import java.util.List;

/**
 * JSON response for GET /collections/{sink}: the contents as of the last
 * delivered epoch.
 */
public class CollectionResponse {
    public String sink;
    public long epoch;
    public List<Entry> rows;

    public static class Entry {
        public String key;
        public Object value;
        public long count;
    }
}
