package eu.virtualparadox.hybridrag.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_POSITION = "position";
    public static final String FIELD_UNIT_ID = "unitId";

    public static final String VECTORS_DIR = "vectors";
    public static final String UNITS_FILE = "units.json";
    public static final String CURRENT_FILE = "CURRENT";
    public static final String GENERATION_PREFIX = "gen-";

    private LuceneConstants() {
        // prevent instantiation
    }
}
