package edu.ucca.datagen;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import edu.stanford.nlp.util.Pair;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Reads and writes the action sequences of a corpus, one (passage ID, records) pair per passage.
 *
 * The binary form is a gzip'ed Kryo stream: the number of passages, then for each passage its ID,
 * the number of records and the records themselves. The text form has one record per line
 * (type, tag, distance, tab-separated) under a "# passage-id" header, with a blank line after each
 * passage.
 */
public class ActionSequences {

    private ActionSequences() {
    }

    private static Kryo newKryo() {
        Kryo kryo = new Kryo();
        kryo.register(ActionRecord.class, new ActionRecordSerializer());
        return kryo;
    }

    public static void write(List<Pair<String, List<ActionRecord>>> sequences, File file) throws IOException {
        Kryo kryo = newKryo();
        try (Output output = new Output(new GZIPOutputStream(new FileOutputStream(file)))) {
            output.writeInt(sequences.size(), true);
            for (Pair<String, List<ActionRecord>> sequence : sequences) {
                output.writeString(sequence.first);
                output.writeInt(sequence.second.size(), true);
                for (ActionRecord record : sequence.second) {
                    kryo.writeObject(output, record);
                }
            }
        }
    }

    public static List<Pair<String, List<ActionRecord>>> read(File file) throws IOException {
        Kryo kryo = newKryo();
        List<Pair<String, List<ActionRecord>>> sequences = new ArrayList<>();
        try (Input input = new Input(new GZIPInputStream(new FileInputStream(file)))) {
            int len = input.readInt(true);
            for (int i = 0; i < len; i++) {
                String passageId = input.readString();
                int size = input.readInt(true);
                List<ActionRecord> records = new ArrayList<>(size);
                for (int j = 0; j < size; j++) {
                    records.add(kryo.readObject(input, ActionRecord.class));
                }
                sequences.add(new Pair<>(passageId, records));
            }
        }
        return sequences;
    }

    public static void dumpText(List<Pair<String, List<ActionRecord>>> sequences, String path) throws IOException {
        try (BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(path), StandardCharsets.UTF_8))) {
            for (Pair<String, List<ActionRecord>> sequence : sequences) {
                bw.append("# ").append(sequence.first).append("\n");
                for (ActionRecord record : sequence.second) {
                    bw.append(record.toString()).append("\n");
                }
                bw.append("\n");
            }
        }
    }

    public static List<Pair<String, List<ActionRecord>>> readText(String path) throws IOException {
        List<Pair<String, List<ActionRecord>>> sequences = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8))) {
            Pair<String, List<ActionRecord>> current = null;
            String line;
            while ((line = br.readLine()) != null) {
                if (line.startsWith("# ")) {
                    current = new Pair<>(line.substring(2), new ArrayList<>());
                    sequences.add(current);
                }
                else if (!line.isEmpty()) {
                    if (current == null) {
                        throw new IOException("Action record before any passage header: " + line);
                    }
                    current.second.add(ActionRecord.parse(line));
                }
            }
        }
        return sequences;
    }
}
