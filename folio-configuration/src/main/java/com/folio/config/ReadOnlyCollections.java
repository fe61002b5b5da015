package com.folio.config;

import java.util.AbstractList;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Deep read-only views over nested map/list trees. Unlike {@link java.util.Collections#unmodifiableMap(Map)}
 * the views are applied recursively and every mutation attempt fails with a message naming the view,
 * so extension code that tries to change shared configuration finds out immediately where.
 */
public final class ReadOnlyCollections {

    private ReadOnlyCollections() {
    }

    /**
     * Wraps the given map (and every nested map or list) in a read-only view.
     *
     * @param source   backing map; not copied
     * @param viewName name used in error messages (e.g. "Settings")
     * @param usage    where the view is handed out (e.g. "plugin init()")
     */
    public static Map<String, Object> readOnlyMap(Map<String, ?> source, String viewName, String usage) {
        return new ReadOnlyMap(Objects.requireNonNull(source, "source"), message(viewName, usage));
    }

    /** Wraps the given list (and every nested map or list) in a read-only view. */
    public static List<Object> readOnlyList(List<?> source, String viewName, String usage) {
        return new ReadOnlyList(Objects.requireNonNull(source, "source"), message(viewName, usage));
    }

    /**
     * Deep copy of a map tree: nested maps become {@link LinkedHashMap}s, nested lists become
     * {@link ArrayList}s; leaves are shared.
     */
    public static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (source == null) return out;
        source.forEach((k, v) -> out.put(k, deepCopyValue(v)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object o : (List<?>) value) copy.add(deepCopyValue(o));
            return copy;
        }
        return value;
    }

    private static String message(String viewName, String usage) {
        String name = viewName != null && !viewName.isBlank() ? viewName : "Object";
        String where = usage != null && !usage.isBlank() ? " in " + usage : "";
        return name + " is read-only" + where + "; return a changed copy instead of mutating it";
    }

    @SuppressWarnings("unchecked")
    private static Object wrap(Object value, String message) {
        if (value instanceof ReadOnlyMap || value instanceof ReadOnlyList) return value;
        if (value instanceof Map) return new ReadOnlyMap((Map<String, ?>) value, message);
        if (value instanceof List) return new ReadOnlyList((List<?>) value, message);
        return value;
    }

    private static final class ReadOnlyMap extends AbstractMap<String, Object> {
        private final Map<String, ?> delegate;
        private final String message;

        ReadOnlyMap(Map<String, ?> delegate, String message) {
            this.delegate = delegate;
            this.message = message;
        }

        @Override
        public Object get(Object key) {
            return wrap(delegate.get(key), message);
        }

        @Override
        public boolean containsKey(Object key) {
            return delegate.containsKey(key);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public Set<Entry<String, Object>> entrySet() {
            return new AbstractSet<>() {
                @Override
                public Iterator<Entry<String, Object>> iterator() {
                    Iterator<? extends Entry<String, ?>> it = delegate.entrySet().iterator();
                    return new Iterator<>() {
                        @Override
                        public boolean hasNext() {
                            return it.hasNext();
                        }

                        @Override
                        public Entry<String, Object> next() {
                            Entry<String, ?> e = it.next();
                            return new SimpleImmutableEntry<>(e.getKey(), wrap(e.getValue(), message));
                        }

                        @Override
                        public void remove() {
                            throw new UnsupportedOperationException(message);
                        }
                    };
                }

                @Override
                public int size() {
                    return delegate.size();
                }
            };
        }

        @Override
        public Object put(String key, Object value) {
            throw new UnsupportedOperationException(message);
        }

        @Override
        public Object remove(Object key) {
            throw new UnsupportedOperationException(message);
        }

        @Override
        public void putAll(Map<? extends String, ?> m) {
            throw new UnsupportedOperationException(message);
        }

        @Override
        public void clear() {
            throw new UnsupportedOperationException(message);
        }
    }

    private static final class ReadOnlyList extends AbstractList<Object> {
        private final List<?> delegate;
        private final String message;

        ReadOnlyList(List<?> delegate, String message) {
            this.delegate = delegate;
            this.message = message;
        }

        @Override
        public Object get(int index) {
            return wrap(delegate.get(index), message);
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public Object set(int index, Object element) {
            throw new UnsupportedOperationException(message);
        }

        @Override
        public void add(int index, Object element) {
            throw new UnsupportedOperationException(message);
        }

        @Override
        public Object remove(int index) {
            throw new UnsupportedOperationException(message);
        }

        @Override
        public boolean addAll(Collection<? extends Object> c) {
            throw new UnsupportedOperationException(message);
        }

        @Override
        public void clear() {
            throw new UnsupportedOperationException(message);
        }
    }
}
