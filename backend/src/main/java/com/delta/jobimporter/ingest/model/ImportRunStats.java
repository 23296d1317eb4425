package com.delta.jobimporter.ingest.model;

import java.math.BigDecimal;

public record ImportRunStats(long totalRuns, long recentRuns, BigDecimal successRate, ImportRun lastRun) {}
