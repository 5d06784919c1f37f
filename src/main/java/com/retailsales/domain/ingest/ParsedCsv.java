package com.retailsales.domain.ingest;

import lombok.Value;
import org.apache.commons.csv.CSVRecord;

import java.util.List;

@Value
public class ParsedCsv {
    ColumnResolution columns;
    List<CSVRecord> records;
}
