package com.delta.jobimporter.ingest.model;

public record JobStats(long totalJobs, long recentJobs, long companiesCount, long categoriesCount) {}
