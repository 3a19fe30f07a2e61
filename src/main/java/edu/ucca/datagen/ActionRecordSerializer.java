package edu.ucca.datagen;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

public class ActionRecordSerializer extends Serializer<ActionRecord> {

    @Override
    public void write(Kryo kryo, Output output, ActionRecord record) {
        output.writeString(record.getType());
        output.writeString(record.getTag());
        output.writeInt(record.getDistance(), true);
    }

    @Override
    public ActionRecord read(Kryo kryo, Input input, Class<? extends ActionRecord> type) {
        String actionType = input.readString();
        String tag = input.readString();
        int distance = input.readInt(true);
        return new ActionRecord(actionType, tag, distance);
    }
}
