package com.delta.jobimporter.ingest.normalize;

import com.delta.jobimporter.ingest.model.JobType;

import java.util.Locale;
import java.util.Map;

public final class JobTypeNormalizer {
    private static final Map<String, JobType> TYPES = Map.ofEntries(
        Map.entry("full-time", JobType.FULL_TIME),
        Map.entry("fulltime", JobType.FULL_TIME),
        Map.entry("full time", JobType.FULL_TIME),
        Map.entry("full_time", JobType.FULL_TIME),
        Map.entry("part-time", JobType.PART_TIME),
        Map.entry("parttime", JobType.PART_TIME),
        Map.entry("part time", JobType.PART_TIME),
        Map.entry("part_time", JobType.PART_TIME),
        Map.entry("contract", JobType.CONTRACT),
        Map.entry("contractor", JobType.CONTRACT),
        Map.entry("temporary", JobType.CONTRACT),
        Map.entry("freelance", JobType.FREELANCE),
        Map.entry("remote", JobType.REMOTE)
    );

    private JobTypeNormalizer() {
    }

    public static JobType normalize(String raw) {
        if (raw == null) {
            return JobType.OTHER;
        }
        String key = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return TYPES.getOrDefault(key, JobType.OTHER);
    }
}
