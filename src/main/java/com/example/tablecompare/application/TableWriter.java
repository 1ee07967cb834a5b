package com.example.tablecompare.application;

import com.example.tablecompare.domain.Table;

public interface TableWriter {
    String write(Table table);
}
