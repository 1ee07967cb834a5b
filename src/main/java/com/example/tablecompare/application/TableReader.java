package com.example.tablecompare.application;

import com.example.tablecompare.domain.Table;

public interface TableReader {
    /** Never fails: blank or malformed text yields an empty or short table. */
    Table read(String text);
}
