package com.useless.script.present;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.useless.script.parser.Value;

/**
 * Records every presenter call in order, optionally passing it on to another presenter.
 * Two runs with the same seed produce byte-identical {@link #toJson()} output.
 */
public class TranscriptPresenter implements Presenter {

    public enum Channel { OUT, ERROR }

    public static final class Entry {
        public final Channel channel;
        public final Value value;
        public final String text;

        Entry(Channel channel, Value value, String text) {
            this.channel = channel;
            this.value = value;
            this.text = text;
        }

        @Override
        public String toString() {
            return channel + ": " + text;
        }
    }

    private final Presenter delegate;
    private final List<Entry> entries = new ArrayList<>();

    public TranscriptPresenter() {
        this(null);
    }

    public TranscriptPresenter(Presenter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void present(Value value) {
        entries.add(new Entry(Channel.OUT, value, ValueJson.display(value)));
        if (delegate != null) delegate.present(value);
    }

    @Override
    public void presentError(String message) {
        entries.add(new Entry(Channel.ERROR, null, message));
        if (delegate != null) delegate.presentError(message);
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** Display text of every {@code present} call, in order. */
    public List<String> outputs() {
        List<String> out = new ArrayList<>();
        for (Entry e : entries) if (e.channel == Channel.OUT) out.add(e.text);
        return out;
    }

    public List<String> errors() {
        List<String> out = new ArrayList<>();
        for (Entry e : entries) if (e.channel == Channel.ERROR) out.add(e.text);
        return out;
    }

    public ArrayNode toJsonTree() {
        ArrayNode arr = ValueJson.om.createArrayNode();
        for (Entry e : entries) {
            ObjectNode o = arr.addObject();
            o.put("channel", e.channel.name().toLowerCase(Locale.ROOT));
            if (e.channel == Channel.OUT) o.set("value", ValueJson.toJson(e.value));
            else o.put("message", e.text);
        }
        return arr;
    }

    public String toJson() {
        try {
            return ValueJson.om.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonTree());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render transcript", e);
        }
    }
}
