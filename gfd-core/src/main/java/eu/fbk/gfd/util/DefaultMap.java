/*
 * GFD - Typed graph indexes and assertion equivalence for graph functional dependency discovery.
 *
 * Written in 2026 by the GFD project authors.
 *
 * To the extent possible under law, the authors have dedicated all copyright and related and
 * neighboring rights to this software to the public domain worldwide. This software is
 * distributed without any warranty.
 *
 * You should have received a copy of the CC0 Public Domain Dedication along with this software.
 * If not, see <http://creativecommons.org/publicdomain/zero/1.0/>.
 */
package eu.fbk.gfd.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingMap;

/**
 * A {@code Map} returning a fixed default value for keys it does not contain.
 * <p>
 * Differently from auto-vivifying maps, {@link #get(Object)} never stores the default value, so
 * that read-heavy access does not make the map grow: {@link #containsKey(Object)},
 * {@link #size()} and the map views only reflect the entries explicitly stored via
 * {@link #put(Object, Object)} and similar methods. When the default value is a container, it
 * should be immutable, as it is shared among all the missing keys.
 * </p>
 *
 * @param <K>
 *            the type of keys
 * @param <V>
 *            the type of values
 */
public final class DefaultMap<K, V> extends ForwardingMap<K, V> {

    private final Map<K, V> delegate;

    @Nullable
    private final V defaultValue;

    private DefaultMap(final Map<K, V> delegate, @Nullable final V defaultValue) {
        this.delegate = delegate;
        this.defaultValue = defaultValue;
    }

    public static <K, V> DefaultMap<K, V> create(@Nullable final V defaultValue) {
        return new DefaultMap<K, V>(new HashMap<K, V>(), defaultValue);
    }

    public static <K, V> DefaultMap<K, V> create(@Nullable final V defaultValue,
            final Map<? extends K, ? extends V> entries) {
        return new DefaultMap<K, V>(new HashMap<K, V>(entries), defaultValue);
    }

    /**
     * Returns an unmodifiable view of the supplied map, sharing its default value.
     *
     * @param map
     *            the map to wrap
     * @param <K>
     *            the type of keys
     * @param <V>
     *            the type of values
     * @return an unmodifiable view of the map, backed by it
     */
    public static <K, V> DefaultMap<K, V> unmodifiable(final DefaultMap<K, V> map) {
        return new DefaultMap<K, V>(Collections.unmodifiableMap(map.delegate), map.defaultValue);
    }

    @Override
    protected Map<K, V> delegate() {
        return this.delegate;
    }

    @Nullable
    public V getDefault() {
        return this.defaultValue;
    }

    /**
     * {@inheritDoc} Returns the default value of this map if the key is not contained in the
     * map. The default value is not stored.
     */
    @Override
    @Nullable
    public V get(@Nullable final Object key) {
        final V value = this.delegate.get(key);
        return value != null || this.delegate.containsKey(key) ? value : this.defaultValue;
    }

    @Override
    @Nullable
    public V getOrDefault(@Nullable final Object key, @Nullable final V defaultValue) {
        final V value = this.delegate.get(key);
        return value != null || this.delegate.containsKey(key) ? value : defaultValue;
    }

}
