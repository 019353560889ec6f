package com.schedq;

/**
 * A job and the RUNNING execution a worker now owns.
 */
public record ClaimedExecution(Job job, JobExecution execution) {
}
