package com.delta.jobimporter.ingest.api;

import java.util.List;

public record ImportStartRequest(List<String> urls) {
}
