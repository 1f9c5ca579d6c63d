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
package eu.fbk.gfd;

import java.util.Objects;

/**
 * The type information consulted when comparing assertions: the entity-type and the
 * literal-datatype indexes of a graph snapshot. Immutable, can be shared among threads.
 */
public final class TypeCache {

    private final TypeIndex typeIndex;

    private final DatatypeIndex datatypeIndex;

    public TypeCache(final TypeIndex typeIndex, final DatatypeIndex datatypeIndex) {
        this.typeIndex = Objects.requireNonNull(typeIndex);
        this.datatypeIndex = Objects.requireNonNull(datatypeIndex);
    }

    public TypeIndex getTypeIndex() {
        return this.typeIndex;
    }

    public DatatypeIndex getDatatypeIndex() {
        return this.datatypeIndex;
    }

}
