package com.example.tablecompare.domain;

/**
 * Serialized corrected table ready for download.
 */
public record CorrectedFile(String fileName, String content, int appliedDifferences) {}
