package com.delta.jobimporter.ingest.model;

import java.util.List;

public record BatchProcessSummary(int total, int created, int updated, int failed, List<String> errors) {}
