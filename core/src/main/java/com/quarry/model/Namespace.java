package com.quarry.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered mapping from exposed names to field definitions.
 *
 * <p>Every operation returns a new namespace that shares the {@link FieldDef}
 * objects of the receiver; nothing is copied but the references. Insertion order
 * is the declaration order and becomes the order of wildcard expansion.
 *
 * <p>A name can also be recorded as <em>invalid</em>: its declaration failed and
 * reported a diagnostic. Looking it up is distinguishable from looking up an
 * unknown name, so that dependents are suppressed instead of reporting a second
 * error.
 */
public final class Namespace {

    public static final Namespace EMPTY = new Namespace(new LinkedHashMap<>(), new LinkedHashSet<>());

    private final Map<String, FieldDef> fields;
    private final Set<String> invalid;

    private Namespace(Map<String, FieldDef> fields, Set<String> invalid) {
        this.fields = Collections.unmodifiableMap(fields);
        this.invalid = Collections.unmodifiableSet(invalid);
    }

    /**
     * Looks up a field by exposed name.
     *
     * @param name the exposed name
     * @return the field, or null if absent or invalid
     */
    public FieldDef lookup(String name) {
        return fields.get(name);
    }

    public boolean contains(String name) {
        return fields.containsKey(name) || invalid.contains(name);
    }

    public boolean isInvalid(String name) {
        return invalid.contains(name);
    }

    /**
     * Returns the exposed names in declaration order.
     *
     * @return the valid names
     */
    public List<String> names() {
        return new ArrayList<>(fields.keySet());
    }

    /**
     * Returns the valid entries in declaration order.
     *
     * @return an unmodifiable name to field map
     */
    public Map<String, FieldDef> entries() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns a namespace with one more field. An existing entry with the same name
     * is replaced in place.
     *
     * @param name the exposed name
     * @param field the field
     * @return the extended namespace
     */
    public Namespace with(String name, FieldDef field) {
        Map<String, FieldDef> next = new LinkedHashMap<>(fields);
        next.put(name, field);
        Set<String> nextInvalid = new LinkedHashSet<>(invalid);
        nextInvalid.remove(name);
        return new Namespace(next, nextInvalid);
    }

    /**
     * Returns a namespace where the name is recorded as invalid.
     *
     * @param name the name whose declaration failed
     * @return the updated namespace
     */
    public Namespace withInvalid(String name) {
        Map<String, FieldDef> next = new LinkedHashMap<>(fields);
        next.remove(name);
        Set<String> nextInvalid = new LinkedHashSet<>(invalid);
        nextInvalid.add(name);
        return new Namespace(next, nextInvalid);
    }

    /**
     * Returns a namespace without the given names ({@code except:}).
     *
     * @param names the names to drop
     * @return the filtered namespace
     */
    public Namespace without(Collection<String> names) {
        Map<String, FieldDef> next = new LinkedHashMap<>(fields);
        Set<String> nextInvalid = new LinkedHashSet<>(invalid);
        for (String name : names) {
            next.remove(name);
            nextInvalid.remove(name);
        }
        return new Namespace(next, nextInvalid);
    }

    /**
     * Returns a namespace that keeps only the given names ({@code accept:}).
     *
     * @param names the names to keep
     * @return the filtered namespace
     */
    public Namespace keeping(Collection<String> names) {
        Map<String, FieldDef> next = new LinkedHashMap<>();
        for (Map.Entry<String, FieldDef> entry : fields.entrySet()) {
            if (names.contains(entry.getKey())) {
                next.put(entry.getKey(), entry.getValue());
            }
        }
        Set<String> nextInvalid = new LinkedHashSet<>(invalid);
        nextInvalid.retainAll(names);
        return new Namespace(next, nextInvalid);
    }

    /**
     * Returns a namespace where {@code oldName} is exposed as {@code newName}, at the
     * same position and with the same field definition.
     *
     * @param newName the new exposed name
     * @param oldName the current exposed name
     * @return the renamed namespace
     */
    public Namespace renamed(String newName, String oldName) {
        Map<String, FieldDef> next = new LinkedHashMap<>();
        for (Map.Entry<String, FieldDef> entry : fields.entrySet()) {
            String key = entry.getKey().equals(oldName) ? newName : entry.getKey();
            next.put(key, entry.getValue());
        }
        Set<String> nextInvalid = new LinkedHashSet<>();
        for (String name : invalid) {
            nextInvalid.add(name.equals(oldName) ? newName : name);
        }
        return new Namespace(next, nextInvalid);
    }

    @Override
    public String toString() {
        return "Namespace" + fields.keySet();
    }
}
