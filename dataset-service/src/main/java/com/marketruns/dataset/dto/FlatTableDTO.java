package com.marketruns.dataset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketruns.common.flatten.FlatTable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public record FlatTableDTO(
    @JsonProperty("level")    String                    level,
    @JsonProperty("columns")  List<String>              columns,
    @JsonProperty("rowCount") int                       rowCount,
    @JsonProperty("rows")     List<Map<String, Object>> rows
) {

    public static FlatTableDTO from(FlatTable table) {
        return new FlatTableDTO(table.level().name().toLowerCase(Locale.ROOT), table.columns(), table.rowCount(), table.rows());
    }
}
