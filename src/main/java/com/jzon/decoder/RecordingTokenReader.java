package com.jzon.decoder;

import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;

/**
 * Remembers every token it reads from its delegate so that they can be read again after {@link #rewind()}.
 * <p>
 * Once rewound, the recorded tokens are replayed and then reading continues from the delegate
 * without recording. Instances are meant to live for a single decode call.
 */
public class RecordingTokenReader implements TokenReader {
    private record Recorded(JsonToken token, String text) {}

    private final TokenReader delegate;
    private final MutableList<Recorded> recording = Lists.mutable.empty();
    private boolean recordingEnabled = true;
    private int replayPosition;
    private Recorded current;
    private boolean retracted;

    public RecordingTokenReader(TokenReader delegate) {
        this.delegate = delegate;
    }

    @Override
    public JsonToken next() throws IOException {
        if (retracted) {
            retracted = false;
            return current.token();
        }
        if (!recordingEnabled && replayPosition < recording.size()) {
            current = recording.get(replayPosition++);
            return current.token();
        }
        JsonToken token = delegate.next();
        current = new Recorded(token, token == null ? null : delegate.text());
        if (recordingEnabled) {
            recording.add(current);
        }
        return token;
    }

    @Override
    public JsonToken current() {
        return current == null ? null : current.token();
    }

    @Override
    public String text() {
        return current == null ? null : current.text();
    }

    @Override
    public void retract() {
        retracted = true;
    }

    /**
     * Goes back to the first recorded token and stops recording.
     */
    public void rewind() {
        recordingEnabled = false;
        replayPosition = 0;
        retracted = false;
        current = null;
    }

    public int recordedTokens() {
        return recording.size();
    }

    /**
     * Does not close the delegate, which belongs to the caller.
     */
    @Override
    public void close() {
        recording.clear();
    }
}
