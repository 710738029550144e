package com.tasksmith.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tasksmith.store")
public class StoreProperties {

    /** "jdbc" for the SQLite store, "memory" for the ephemeral in-memory store. */
    private String type = "jdbc";

    /** Directory holding the SQLite database file; created on startup. */
    private String directory = ".tasksmith";

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }
}
