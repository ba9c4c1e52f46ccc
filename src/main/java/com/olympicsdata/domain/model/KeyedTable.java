package com.olympicsdata.domain.model;

import com.olympicsdata.domain.error.DuplicateIdentifierCollisionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Table whose rows are unique by primary key. Insertion order is kept so the
 * output follows the source order with appended rows last.
 */
public class KeyedTable<R> {

    private final String name;
    private final List<String> columns;
    private final Function<R, String> keyExtractor;
    private final Map<String, R> rows = new LinkedHashMap<>();

    public KeyedTable(String name, List<String> columns, Function<R, String> keyExtractor) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.keyExtractor = keyExtractor;
    }

    /**
     * Inserts a row whose key must not exist yet.
     *
     * @throws DuplicateIdentifierCollisionException when the key is already taken
     */
    public void insert(R row) {
        String key = keyExtractor.apply(row);
        if (rows.containsKey(key)) {
            throw new DuplicateIdentifierCollisionException(name, key);
        }
        rows.put(key, row);
    }

    /**
     * Inserts a row unless its key is taken.
     *
     * @return false when the key already existed and the row was ignored
     */
    public boolean insertIfAbsent(R row) {
        return rows.putIfAbsent(keyExtractor.apply(row), row) == null;
    }

    public Optional<R> find(String key) {
        return Optional.ofNullable(rows.get(key));
    }

    public boolean contains(String key) {
        return key != null && rows.containsKey(key);
    }

    public Collection<R> rows() {
        return Collections.unmodifiableCollection(rows.values());
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(rows.keySet());
    }

    public int size() {
        return rows.size();
    }

    public String getName() {
        return name;
    }

    public List<String> getColumns() {
        return columns;
    }

    /** Deep copy using the given row copier. */
    public KeyedTable<R> copy(UnaryOperator<R> rowCopier) {
        KeyedTable<R> copy = new KeyedTable<>(name, columns, keyExtractor);
        rows.values().forEach(row -> copy.insert(rowCopier.apply(row)));
        return copy;
    }

    @Override
    public String toString() {
        return name + new ArrayList<>(rows.keySet());
    }
}
