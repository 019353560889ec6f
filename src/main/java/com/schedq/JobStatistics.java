package com.schedq;

import java.util.Map;

/**
 * Job counts keyed by status value; every status is present.
 */
public record JobStatistics(Map<String, Long> byStatus, long total) {
}
