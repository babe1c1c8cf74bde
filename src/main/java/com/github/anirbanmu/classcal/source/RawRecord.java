package com.github.anirbanmu.classcal.source;

import java.util.List;

// one schedule row as the portal returned it, cells in page order
public record RawRecord(List<String> cells) {

    public RawRecord {
        cells = List.copyOf(cells);
    }

    public static RawRecord of(String... cells) {
        return new RawRecord(List.of(cells));
    }

    // stripped cell text, null when the row is too short or the cell is blank
    public String cell(int index) {
        if (index < 0 || index >= cells.size()) {
            return null;
        }
        String value = cells.get(index).strip();
        return value.isEmpty() ? null : value;
    }

    public int size() {
        return cells.size();
    }
}
