package org.etlstudio.engine.execution;

import org.etlstudio.engine.plan.JoinNode;
import org.etlstudio.engine.plan.JoinNode.JoinType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hash join of two tables with dataframe-merge output conventions.
 *
 * Output columns are the left columns followed by the right columns. A key
 * pair that uses the same name on both sides yields one coalesced column;
 * any other name present on both sides is suffixed {@code _x} (left) and
 * {@code _y} (right). Rows follow the left input (the right input for a
 * right join); an outer join appends unmatched right rows and then orders
 * the result by the key columns. Null keys never match.
 */
final class TableJoiner {

    static final String LEFT_SUFFIX = "_x";
    static final String RIGHT_SUFFIX = "_y";

    private final JoinNode join;
    private final Table left;
    private final Table right;

    private final int[] leftKeyIdx;
    private final int[] rightKeyIdx;
    /** Right column index to the left column index it is coalesced into, or absent. */
    private final Map<Integer, Integer> coalesced = new LinkedHashMap<>();
    private final List<Integer> rightOutputIdx = new ArrayList<>();

    TableJoiner(JoinNode join, Table left, Table right) {
        this.join = join;
        this.left = left;
        this.right = right;
        int pairs = join.keyCount();
        this.leftKeyIdx = new int[pairs];
        this.rightKeyIdx = new int[pairs];
        for (int i = 0; i < pairs; i++) {
            String leftKey = join.leftKeys().get(i);
            String rightKey = join.rightKeyAt(i);
            leftKeyIdx[i] = left.requireColumn(leftKey);
            rightKeyIdx[i] = right.requireColumn(rightKey);
            if (leftKey.equals(rightKey)) {
                coalesced.putIfAbsent(rightKeyIdx[i], leftKeyIdx[i]);
            }
        }
        for (int c = 0; c < right.columnCount(); c++) {
            if (!coalesced.containsKey(c)) {
                rightOutputIdx.add(c);
            }
        }
    }

    Table execute() {
        List<String> names = outputNames();
        Map<List<Object>, List<Integer>> rightIndex = index(right, rightKeyIdx);
        List<Row> rows = new ArrayList<>();
        JoinType type = join.joinType();

        if (type == JoinType.RIGHT) {
            Map<List<Object>, List<Integer>> leftIndex = index(left, leftKeyIdx);
            for (Row r : right.rows()) {
                List<Integer> matches = lookup(leftIndex, r, rightKeyIdx);
                if (matches.isEmpty()) {
                    rows.add(combine(null, r));
                }
                for (int li : matches) {
                    rows.add(combine(left.rows().get(li), r));
                }
            }
            return Table.withInferredTypes(names, rows);
        }

        Set<Integer> matchedRight = new HashSet<>();
        for (Row l : left.rows()) {
            List<Integer> matches = lookup(rightIndex, l, leftKeyIdx);
            if (matches.isEmpty() && (type == JoinType.LEFT || type == JoinType.OUTER)) {
                rows.add(combine(l, null));
            }
            for (int ri : matches) {
                matchedRight.add(ri);
                rows.add(combine(l, right.rows().get(ri)));
            }
        }
        if (type == JoinType.OUTER) {
            for (int ri = 0; ri < right.rowCount(); ri++) {
                if (!matchedRight.contains(ri)) {
                    rows.add(combine(null, right.rows().get(ri)));
                }
            }
            int[] outputKeyIdx = new int[leftKeyIdx.length];
            for (int i = 0; i < leftKeyIdx.length; i++) {
                Integer target = coalesced.get(rightKeyIdx[i]);
                outputKeyIdx[i] = target != null ? target : leftKeyIdx[i];
            }
            rows.sort((a, b) -> Values.compareTuples(tuple(a, outputKeyIdx), tuple(b, outputKeyIdx)));
        }
        return Table.withInferredTypes(names, rows);
    }

    // ==================== Helpers ====================

    private List<String> outputNames() {
        Set<String> leftNames = new HashSet<>();
        for (int c = 0; c < left.columnCount(); c++) {
            leftNames.add(left.columns().get(c).name());
        }
        Set<String> rightNames = new HashSet<>();
        for (int c : rightOutputIdx) {
            rightNames.add(right.columns().get(c).name());
        }
        Set<Integer> coalescedLeft = new HashSet<>(coalesced.values());
        List<String> names = new ArrayList<>();
        for (int c = 0; c < left.columnCount(); c++) {
            String name = left.columns().get(c).name();
            boolean clash = !coalescedLeft.contains(c) && rightNames.contains(name);
            names.add(clash ? name + LEFT_SUFFIX : name);
        }
        for (int c : rightOutputIdx) {
            String name = right.columns().get(c).name();
            names.add(leftNames.contains(name) ? name + RIGHT_SUFFIX : name);
        }
        return names;
    }

    private Row combine(Row l, Row r) {
        List<Object> values = new ArrayList<>(left.columnCount() + rightOutputIdx.size());
        for (int c = 0; c < left.columnCount(); c++) {
            values.add(l == null ? null : l.get(c));
        }
        if (l == null && r != null) {
            for (Map.Entry<Integer, Integer> entry : coalesced.entrySet()) {
                values.set(entry.getValue(), r.get(entry.getKey()));
            }
        }
        for (int c : rightOutputIdx) {
            values.add(r == null ? null : r.get(c));
        }
        return new Row(values);
    }

    private static Map<List<Object>, List<Integer>> index(Table table, int[] keyIdx) {
        Map<List<Object>, List<Integer>> index = new LinkedHashMap<>();
        for (int i = 0; i < table.rowCount(); i++) {
            List<Object> key = Values.keyTuple(table.rows().get(i), keyIdx);
            if (!key.contains(null)) {
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }
        return index;
    }

    private static List<Integer> lookup(Map<List<Object>, List<Integer>> index, Row row, int[] keyIdx) {
        List<Object> key = Values.keyTuple(row, keyIdx);
        if (key.contains(null)) {
            return List.of();
        }
        return index.getOrDefault(key, List.of());
    }

    private static List<Object> tuple(Row row, int[] indices) {
        List<Object> values = new ArrayList<>(indices.length);
        for (int index : indices) {
            values.add(row.get(index));
        }
        return values;
    }
}
