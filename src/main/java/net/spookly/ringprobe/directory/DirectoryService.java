package net.spookly.ringprobe.directory;

import java.util.List;

/**
 * Source of the candidate vantage point list.
 */
public interface DirectoryService {
    /**
     * @throws DirectorySyncException on any transient failure; callers keep their current view
     */
    List<DirectoryEntry> listVantagePoints() throws DirectorySyncException;
}
