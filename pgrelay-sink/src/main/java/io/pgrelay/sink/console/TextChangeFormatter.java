/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.console;

import java.util.Map;

import io.pgrelay.data.Change;
import io.pgrelay.data.Column;

/**
 * Renders changes as human-readable text, one header line followed by indented details.
 */
public final class TextChangeFormatter {

    private static final String NULL = "NULL";

    private TextChangeFormatter() {
    }

    /**
     * @param change the change to render; may not be null
     * @return the lines of the rendering joined by {@code \n}, without a trailing line break
     */
    public static String format(Change change) {
        final StringBuilder sb = new StringBuilder();
        switch (change.operation()) {
            case BEGIN:
                Change.Begin begin = (Change.Begin) change;
                sb.append("BEGIN [LSN: ").append(begin.lsn().get())
                        .append(", XID: ").append(begin.xid())
                        .append(", Time: ").append(begin.timestamp()).append(']');
                break;
            case COMMIT:
                Change.Commit commit = (Change.Commit) change;
                sb.append("COMMIT [LSN: ").append(commit.lsn().get())
                        .append(", Time: ").append(commit.timestamp()).append(']');
                break;
            case RELATION:
                Change.Relation relation = (Change.Relation) change;
                sb.append("RELATION [").append(relation.qualifiedName()).append(" (ID: ").append(relation.relationId()).append(")]");
                sb.append("\n  Columns:");
                for (Column column : relation.columns()) {
                    sb.append("\n    - ").append(column.name())
                            .append(" (type_id: ").append(column.typeId())
                            .append(", flags: ").append(column.flags()).append(')');
                }
                break;
            case INSERT:
                Change.Insert insert = (Change.Insert) change;
                sb.append("INSERT into ").append(insert.qualifiedName()).append(" (ID: ").append(insert.relationId()).append(')');
                appendTuple(sb, "New values:", insert.newTuple());
                break;
            case UPDATE:
                Change.Update update = (Change.Update) change;
                sb.append("UPDATE ").append(update.qualifiedName()).append(" (ID: ").append(update.relationId()).append(')');
                update.oldTuple().ifPresent(old -> appendTuple(sb, "Old values:", old));
                appendTuple(sb, "New values:", update.newTuple());
                break;
            case DELETE:
                Change.Delete delete = (Change.Delete) change;
                sb.append("DELETE from ").append(delete.qualifiedName()).append(" (ID: ").append(delete.relationId()).append(')');
                appendTuple(sb, "Old values:", delete.oldTuple());
                break;
            default:
                throw new IllegalStateException("Unexpected operation " + change.operation());
        }
        return sb.toString();
    }

    private static void appendTuple(StringBuilder sb, String title, Map<String, String> tuple) {
        sb.append("\n  ").append(title);
        tuple.forEach((name, value) -> sb.append("\n    ").append(name).append(": ").append(value != null ? value : NULL));
    }
}
