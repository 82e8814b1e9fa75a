package com.napkin.engine.formula;

import com.napkin.engine.models.CellCoordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the cells a formula mentions by scanning its text.
 * Range endpoints are reported, the cells between them are not.
 */
public final class DependencyExtractor {

    // a label not glued to a longer word or number ("1E5" is an exponent, not E5)
    private static final Pattern REFERENCE_PATTERN =
            Pattern.compile("(?<![A-Za-z0-9.])([A-Za-z]+[0-9]+)(?![A-Za-z0-9(])");

    private static final Pattern RANGE_PATTERN =
            Pattern.compile("(?<![A-Za-z0-9.])([A-Za-z]+[0-9]+)\\s*:\\s*([A-Za-z]+[0-9]+)(?![A-Za-z0-9(])");

    private DependencyExtractor() {
    }

    public static Set<CellCoordinate> dependencies(String formula) {
        if (formula == null || formula.isEmpty()) {
            return Collections.emptySet();
        }
        Set<CellCoordinate> found = new LinkedHashSet<>();
        Matcher matcher = REFERENCE_PATTERN.matcher(formula);
        while (matcher.find()) {
            // "A0" and friends are skipped; evaluation reports them
            CellCoordinate coordinate = CellReferences.tryDecode(matcher.group(1));
            if (coordinate != null) {
                found.add(coordinate);
            }
        }
        return found;
    }

    /**
     * Ranges written in the formula as {start, end} corner pairs, in order of appearance.
     * Ranges with an undecodable corner are skipped.
     */
    public static List<CellCoordinate[]> ranges(String formula) {
        if (formula == null || formula.isEmpty()) {
            return Collections.emptyList();
        }
        List<CellCoordinate[]> found = new ArrayList<>();
        Matcher matcher = RANGE_PATTERN.matcher(formula);
        while (matcher.find()) {
            CellCoordinate start = CellReferences.tryDecode(matcher.group(1));
            CellCoordinate end = CellReferences.tryDecode(matcher.group(2));
            if (start != null && end != null) {
                found.add(new CellCoordinate[]{start, end});
            }
        }
        return found;
    }
}
