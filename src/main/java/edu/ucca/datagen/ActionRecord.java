package edu.ucca.datagen;

import edu.ucca.core.EdgeTag;
import edu.ucca.parser.Action;
import edu.ucca.parser.ActionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An action flattened for training-data files: its type name, its tag abbreviation ("" if it has
 * none) and its swap distance (0 unless it is a SWAP).
 */
public class ActionRecord {
    private final String type;
    private final String tag;
    private final int distance;

    public ActionRecord(String type, String tag, int distance) {
        this.type = type;
        this.tag = tag == null ? "" : tag;
        this.distance = distance;
    }

    public static ActionRecord of(Action action) {
        return new ActionRecord(action.getType().getName(),
                action.getTag() == null ? "" : action.getTag().getAbbreviation(),
                action.getDistance());
    }

    public static List<ActionRecord> of(List<Action> actions) {
        List<ActionRecord> records = new ArrayList<>(actions.size());
        for (Action action : actions) records.add(of(action));
        return records;
    }

    /** Parses the tab-separated form written by {@link #toString()}. */
    public static ActionRecord parse(String line) {
        String[] fields = line.split("\t", -1);
        if (fields.length != 3) {
            throw new IllegalArgumentException("Expected 3 tab-separated fields: " + line);
        }
        return new ActionRecord(fields[0], fields[1], Integer.parseInt(fields[2]));
    }

    public Action toAction() {
        ActionType actionType = ActionType.fromName(type);
        return Action.of(actionType, tag.isEmpty() ? null : EdgeTag.fromAbbreviation(tag), distance);
    }

    public String getType() {
        return type;
    }

    public String getTag() {
        return tag;
    }

    public int getDistance() {
        return distance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionRecord)) return false;
        ActionRecord that = (ActionRecord) o;
        return distance == that.distance && type.equals(that.type) && tag.equals(that.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, tag, distance);
    }

    @Override
    public String toString() {
        return type + "\t" + tag + "\t" + distance;
    }
}
