package io.github.vipsgen.introspect.catalog;

import static java.util.Collections.unmodifiableList;

import java.util.ArrayList;
import java.util.List;

/** Per-category counts of generatable and excluded operations. */
public final class CoverageReport {

    private final List<Row> rows;

    public CoverageReport(List<Row> rows) {
        this.rows = unmodifiableList(new ArrayList<>(rows));
    }

    public List<Row> getRows() {
        return rows;
    }

    public int totalGenerated() {
        return rows.stream().mapToInt(Row::getGenerated).sum();
    }

    public int totalExcluded() {
        return rows.stream().mapToInt(Row::getExcluded).sum();
    }

    public int total() {
        return totalGenerated() + totalExcluded();
    }

    public static final class Row {

        private final String category;
        private final int generated;
        private final int excluded;

        public Row(String category, int generated, int excluded) {
            this.category = category;
            this.generated = generated;
            this.excluded = excluded;
        }

        public String getCategory() {
            return category;
        }

        public int getGenerated() {
            return generated;
        }

        public int getExcluded() {
            return excluded;
        }

        public int getTotal() {
            return generated + excluded;
        }
    }
}
