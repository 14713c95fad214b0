package com.example.docimport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered name/value pairs produced from one input record. Repeated names are kept as separate
 * entries and never merged.
 */
public final class Document {

    private final List<Entry> entries;

    private Document(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Value of the first entry named {@code name}, or null. */
    public Object get(String name) {
        for (Entry e : entries) {
            if (e.name().equals(name)) {
                return e.value();
            }
        }
        return null;
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            names.add(e.name());
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document)) return false;
        return entries.equals(((Document) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Entry {
        private final String name;
        private final Object value;

        public Entry(String name, Object value) {
            this.name = Objects.requireNonNull(name, "name");
            this.value = value;
        }

        public String name() {
            return name;
        }

        public Object value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry other = (Entry) o;
            return name.equals(other.name) && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "(" + name + "," + value + ")";
        }
    }

    public static final class Builder {
        private final List<Entry> entries = new ArrayList<>();

        private Builder() {}

        public Builder append(String name, Object value) {
            entries.add(new Entry(name, value));
            return this;
        }

        public Document build() {
            return new Document(new ArrayList<>(entries));
        }
    }
}
