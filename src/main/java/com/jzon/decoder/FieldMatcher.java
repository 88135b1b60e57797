package com.jzon.decoder;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.primitive.ObjectIntHashMap;

/**
 * Recognizes which of a fixed set of names a string is.
 */
public final class FieldMatcher {
    private final ImmutableList<String> names;
    private final MutableObjectIntMap<String> indexes = new ObjectIntHashMap<>();

    public FieldMatcher(String... names) {
        this(Lists.immutable.with(names));
    }

    public FieldMatcher(ImmutableList<String> names) {
        this.names = names;
        names.forEachWithIndex((name, i) -> {
            if (!indexes.containsKey(name)) {
                indexes.put(name, i);
            }
        });
    }

    /**
     * @return the position of {@code name} among the candidates, or -1
     */
    public int indexOf(String name) {
        return indexes.getIfAbsent(name, -1);
    }

    public String name(int index) {
        return names.get(index);
    }

    public int size() {
        return names.size();
    }
}
