package tech.idvault.platform.shared;

import com.github.f4b6a3.tsid.Tsid;
import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Centralized TSID generation for all entities.
 * TSIDs are time-sortable and rendered as 13-character Crockford base32 strings,
 * which is the identifier format exposed through the API.
 */
public class TsidGenerator {

    /**
     * Generate a new TSID in its canonical string form.
     */
    public static String generate() {
        return TsidCreator.getTsid().toString();
    }

    /**
     * Check whether a caller-supplied identifier is a well-formed TSID string.
     */
    public static boolean isValid(String id) {
        return id != null && Tsid.isValid(id);
    }

    private TsidGenerator() {
        // Utility class
    }
}
