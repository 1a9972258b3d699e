package org.tuscan.features;

import java.util.ArrayList;
import java.util.List;

import org.tuscan.features.FeatureTables.PositionalBase;
import org.tuscan.features.FeatureTables.PositionalDinucleotide;

/**
 * Column layout of one model's feature vector.
 * <p>
 * Columns, in order: GC percentage, counts of A/C/G/T, one presence indicator per entry of
 * {@code dinucleotides}, one indicator per entry of {@code positionalBases}, one per entry of
 * {@code positionalDinucleotides}, {@code reservedColumns} columns that are always zero and,
 * when {@code pamTail} is non-null, a final indicator for bases 25-28 matching it.
 *
 * @param dinucleotides           dinucleotides tested for presence anywhere in the window.
 * @param positionalBases         base-at-position indicators.
 * @param positionalDinucleotides dinucleotide-at-position indicators.
 * @param reservedColumns         number of always-zero columns before the PAM-tail column.
 * @param pamTail                 the PAM-tail motif, or {@code null} if the layout has none.
 */
public record FeatureLayout(
    List<String> dinucleotides,
    List<PositionalBase> positionalBases,
    List<PositionalDinucleotide> positionalDinucleotides,
    int reservedColumns,
    String pamTail
) {

    /** GC percentage plus the four base counts. */
    public static final int COMPOSITION_COLUMNS = 5;

    /** @return the index of the first dinucleotide presence column. */
    public int dinucleotideOffset() {
        return COMPOSITION_COLUMNS;
    }

    /** @return the index of the first base-at-position column. */
    public int positionalBaseOffset() {
        return dinucleotideOffset() + dinucleotides.size();
    }

    /** @return the index of the first dinucleotide-at-position column. */
    public int positionalDinucleotideOffset() {
        return positionalBaseOffset() + positionalBases.size();
    }

    /** @return the index of the first reserved column. */
    public int reservedOffset() {
        return positionalDinucleotideOffset() + positionalDinucleotides.size();
    }

    /** @return the index of the PAM-tail column, or {@code -1} if there is none. */
    public int pamTailIndex() {
        return pamTail == null ? -1 : reservedOffset() + reservedColumns;
    }

    /** @return the total number of columns. */
    public int width() {
        return reservedOffset() + reservedColumns + (pamTail == null ? 0 : 1);
    }

    /**
     * Returns a label for every column, in column order.
     *
     * @return the column labels, e.g. {@code GC%, A, C, G, T, CA, ..., T3, ..., AG1, ..., TGGT}.
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(width());
        names.add("GC%");
        names.add("A");
        names.add("C");
        names.add("G");
        names.add("T");
        names.addAll(dinucleotides);
        positionalBases.forEach(p -> names.add(p.label()));
        positionalDinucleotides.forEach(p -> names.add(p.label()));
        for (int i = 0; i < reservedColumns; i++) {
            names.add("reserved");
        }
        if (pamTail != null) {
            names.add(pamTail);
        }
        return names;
    }
}
