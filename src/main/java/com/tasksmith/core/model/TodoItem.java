package com.tasksmith.core.model;

/**
 * One entry of the execution service's todo list.
 *
 * @param content    what needs doing
 * @param status     pending, in_progress or completed
 * @param activeForm present-tense label shown while in progress
 */
public record TodoItem(String content, String status, String activeForm) {}
