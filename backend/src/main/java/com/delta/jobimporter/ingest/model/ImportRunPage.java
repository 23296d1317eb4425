package com.delta.jobimporter.ingest.model;

import java.util.List;

public record ImportRunPage(List<ImportRun> runs, int page, int pageSize, long total, int totalPages) {}
