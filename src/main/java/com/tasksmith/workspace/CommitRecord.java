package com.tasksmith.workspace;

/**
 * One commit as read from {@code git log}.
 *
 * @param hash    full commit hash
 * @param subject first line of the message
 * @param body    full raw message, subject included
 */
public record CommitRecord(String hash, String subject, String body) {

    public String shortHash() {
        return hash.length() > 8 ? hash.substring(0, 8) : hash;
    }
}
