package tasktree.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param newRootId id of the top copy
 * @param idMap     source id to copy id, parents before children
 */
public record DuplicationResult(String newRootId, Map<String, String> idMap) {

    public DuplicationResult {
        idMap = Collections.unmodifiableMap(new LinkedHashMap<>(idMap));
    }
}
