package com.tasksmith.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "tasksmith.git")
public class GitProperties {

    private String executable = "git";
    private List<String> defaultBranches = new ArrayList<>(List.of("main", "master"));
    private String branchPrefix = "tasksmith/";
    /** Parent directory for per-queue scratch roots; blank means the system temp directory. */
    private String scratchDir = "";
    private Duration commandTimeout = Duration.ofMinutes(2);
    private String commitHeaderPattern = "^[a-z]+(?:\\([^)]+\\))?!?: .+";
    private String disallowedTrailerPattern = "(?i)co-authored-by:\\s*.*claude";
    private Author author = new Author();

    public String getExecutable() { return executable; }
    public void setExecutable(String executable) { this.executable = executable; }
    public List<String> getDefaultBranches() { return defaultBranches; }
    public void setDefaultBranches(List<String> defaultBranches) { this.defaultBranches = defaultBranches; }
    public String getBranchPrefix() { return branchPrefix; }
    public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
    public String getScratchDir() { return scratchDir; }
    public void setScratchDir(String scratchDir) { this.scratchDir = scratchDir; }
    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    public String getCommitHeaderPattern() { return commitHeaderPattern; }
    public void setCommitHeaderPattern(String commitHeaderPattern) { this.commitHeaderPattern = commitHeaderPattern; }
    public String getDisallowedTrailerPattern() { return disallowedTrailerPattern; }
    public void setDisallowedTrailerPattern(String disallowedTrailerPattern) { this.disallowedTrailerPattern = disallowedTrailerPattern; }
    public Author getAuthor() { return author; }
    public void setAuthor(Author author) { this.author = author; }

    /**
     * Identity used for commits the queue itself creates (snapshot and merge commits).
     */
    public static class Author {
        private String name = "Tasksmith";
        private String email = "tasksmith@localhost";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
    }
}
