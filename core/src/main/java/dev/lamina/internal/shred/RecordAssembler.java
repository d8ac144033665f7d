/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.shred;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import dev.lamina.StructuralCorruptionException;
import dev.lamina.row.PqStruct;
import dev.lamina.schema.SchemaNode;

/**
 * Rebuilds records from shredded columns.
 *
 * <p>All columns beneath the given root are read in lockstep, one cursor per column.
 * The definition level of a field's first leaf decides whether the field is present; the
 * repetition level of the next entry of that leaf decides whether a repeated field has
 * another element. Every consumed entry must carry exactly the repetition level the
 * structure built so far implies:</p>
 * <pre>
 * record start                            -> 0 for every leaf
 * element i &gt; 0 of a field with max rep r -> r for every leaf beneath the field
 * </pre>
 *
 * <p>Absent optional fields are omitted from the assembled struct; repeated fields always
 * yield a list, which is empty if no element is present.</p>
 */
public class RecordAssembler {

    private static final int CONSUMED = -1;

    private final SchemaNode.GroupNode root;
    private final ShreddedColumn[] columns;
    private final int[] positions;
    private final int[] expectedRepetitionLevels;
    private final int[] leafIndexes;
    private final Map<SchemaNode, int[]> leavesByNode = new IdentityHashMap<>();

    /**
     * @param root root of the (possibly projected) schema tree
     * @param columns the shredded columns, indexed by their column index in the full schema;
     *                entries for columns outside of {@code root} may be null
     */
    public RecordAssembler(SchemaNode.GroupNode root, ShreddedColumn[] columns) {
        this.root = root;
        this.columns = columns;
        this.positions = new int[columns.length];
        this.expectedRepetitionLevels = new int[columns.length];
        this.leafIndexes = leaves(root);
        for (int index : leafIndexes) {
            if (columns[index] == null) {
                throw new IllegalArgumentException("Missing shredded data for column " + index);
            }
        }
    }

    /**
     * Returns true if another record is available.
     *
     * @throws StructuralCorruptionException if some columns are exhausted and others are not
     */
    public boolean hasNext() throws StructuralCorruptionException {
        int exhausted = 0;
        for (int index : leafIndexes) {
            if (positions[index] >= columns[index].size()) {
                exhausted++;
            }
        }
        if (exhausted != 0 && exhausted != leafIndexes.length) {
            throw new StructuralCorruptionException("Columns disagree on the number of records: "
                    + exhausted + " of " + leafIndexes.length + " columns are exhausted");
        }
        return leafIndexes.length > 0 && exhausted == 0;
    }

    public PqStruct next() throws StructuralCorruptionException {
        if (!hasNext()) {
            throw new NoSuchElementException("No more records");
        }
        for (int index : leafIndexes) {
            int rep = columns[index].getRepetitionLevel(positions[index]);
            if (rep != 0) {
                throw corruption(index, "Record does not start at repetition level 0 but at " + rep);
            }
            expectedRepetitionLevels[index] = 0;
        }
        return readGroup(root);
    }

    /**
     * Assembles all remaining records.
     */
    public List<PqStruct> readAll() throws StructuralCorruptionException {
        List<PqStruct> records = new ArrayList<>();
        while (hasNext()) {
            records.add(next());
        }
        return records;
    }

    private PqStruct readGroup(SchemaNode.GroupNode group) throws StructuralCorruptionException {
        PqStruct.Builder builder = PqStruct.builder();
        for (SchemaNode child : group.children()) {
            builder.set(child.name(), readField(child));
        }
        return builder.build();
    }

    /**
     * Reads a field of a present parent.
     *
     * @return the value, a list for repeated fields, or null if an optional field is absent
     */
    private Object readField(SchemaNode node) throws StructuralCorruptionException {
        int first = leaves(node)[0];
        return switch (node.repetitionType()) {
            case REQUIRED -> readPresent(node);
            case OPTIONAL -> {
                if (peekDefinitionLevel(first) >= node.maxDefinitionLevel()) {
                    yield readPresent(node);
                }
                consumeAbsent(node);
                yield null;
            }
            case REPEATED -> {
                List<Object> elements = new ArrayList<>();
                if (peekDefinitionLevel(first) < node.maxDefinitionLevel()) {
                    consumeAbsent(node);
                    yield elements;
                }
                elements.add(readPresent(node));
                while (positions[first] < columns[first].size()
                        && columns[first].getRepetitionLevel(positions[first]) == node.maxRepetitionLevel()) {
                    if (peekDefinitionLevel(first) < node.maxDefinitionLevel()) {
                        throw corruption(first, "Repeated field continues without an element");
                    }
                    for (int index : leaves(node)) {
                        expectedRepetitionLevels[index] = node.maxRepetitionLevel();
                    }
                    elements.add(readPresent(node));
                }
                yield elements;
            }
        };
    }

    /**
     * Reads the content of a node known to be present.
     */
    private Object readPresent(SchemaNode node) throws StructuralCorruptionException {
        if (node instanceof SchemaNode.PrimitiveNode primitive) {
            int index = primitive.columnIndex();
            int def = consume(index);
            if (def != primitive.maxDefinitionLevel()) {
                throw corruption(index, "Expected a value at definition level " + primitive.maxDefinitionLevel()
                        + " but found level " + def);
            }
            Object value = columns[index].getValue(positions[index] - 1);
            if (value == null) {
                throw corruption(index, "Entry at maximum definition level carries no value");
            }
            return value;
        }
        return readGroup((SchemaNode.GroupNode) node);
    }

    /**
     * Consumes the single entry every leaf beneath an absent node carries.
     */
    private void consumeAbsent(SchemaNode node) throws StructuralCorruptionException {
        for (int index : leaves(node)) {
            int def = consume(index);
            if (def >= node.maxDefinitionLevel()) {
                throw corruption(index, "Column defines field " + node.name() + " at level " + def
                        + " although its first column leaves it undefined");
            }
        }
    }

    /**
     * Advances the cursor of a column after validating the entry's levels.
     *
     * @return the definition level of the consumed entry
     */
    private int consume(int index) throws StructuralCorruptionException {
        ShreddedColumn column = columns[index];
        int position = positions[index];
        if (position >= column.size()) {
            throw corruption(index, "Column ended in the middle of a record");
        }
        int rep = column.getRepetitionLevel(position);
        int expected = expectedRepetitionLevels[index];
        if (expected == CONSUMED) {
            throw corruption(index, "Unexpected entry at repetition level " + rep);
        }
        if (rep != expected) {
            throw corruption(index, "Expected repetition level " + expected + " but found " + rep);
        }
        int def = column.getDefinitionLevel(position);
        if (def < 0 || def > column.getColumn().maxDefinitionLevel()) {
            throw corruption(index, "Definition level " + def + " outside of [0, "
                    + column.getColumn().maxDefinitionLevel() + "]");
        }
        positions[index] = position + 1;
        expectedRepetitionLevels[index] = CONSUMED;
        return def;
    }

    private int peekDefinitionLevel(int index) throws StructuralCorruptionException {
        ShreddedColumn column = columns[index];
        if (positions[index] >= column.size()) {
            throw corruption(index, "Column ended in the middle of a record");
        }
        return column.getDefinitionLevel(positions[index]);
    }

    private StructuralCorruptionException corruption(int index, String message) {
        StructuralCorruptionException e = new StructuralCorruptionException(message
                + " (entry " + positions[index] + ")");
        e.locate(columns[index].getColumn().path(), StructuralCorruptionException.UNKNOWN_OFFSET);
        return e;
    }

    private int[] leaves(SchemaNode node) {
        int[] cached = leavesByNode.get(node);
        if (cached != null) {
            return cached;
        }
        List<Integer> collected = new ArrayList<>();
        collectLeaves(node, collected);
        int[] result = collected.stream().mapToInt(Integer::intValue).toArray();
        leavesByNode.put(node, result);
        return result;
    }

    private static void collectLeaves(SchemaNode node, List<Integer> collected) {
        if (node instanceof SchemaNode.PrimitiveNode primitive) {
            collected.add(primitive.columnIndex());
        }
        else {
            for (SchemaNode child : ((SchemaNode.GroupNode) node).children()) {
                collectLeaves(child, collected);
            }
        }
    }
}
