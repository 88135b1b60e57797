package com.jzon.decoder;

import com.jzon.exceptions.JsonDecodeException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Where a decoder currently is in the input, innermost step first.
 */
public record DecodeTrace(ImmutableList<TraceStep> steps) {
    public static final DecodeTrace ROOT = new DecodeTrace(Lists.immutable.empty());

    public DecodeTrace push(TraceStep step) {
        return new DecodeTrace(Lists.immutable.with(step).newWithAll(steps));
    }

    public DecodeTrace field(String name) {
        return push(new TraceStep.ObjectAccess(name));
    }

    public DecodeTrace element(int index) {
        return push(new TraceStep.ArrayAccess(index));
    }

    public DecodeTrace variant(String tag) {
        return push(new TraceStep.SumType(tag));
    }

    /**
     * @return an exception whose trace is this one plus {@code message}
     */
    public JsonDecodeException fail(String message) {
        return new JsonDecodeException(push(new TraceStep.Message(message)));
    }

    /**
     * Root first, e.g. {@code .user.tags[2](expected string)}.
     */
    public String render() {
        return steps.toReversed().makeString("");
    }

    @Override
    public String toString() {
        return render();
    }
}
