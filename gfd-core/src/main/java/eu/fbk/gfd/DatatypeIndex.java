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

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSet;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.vocabulary.XMLSchema;

import eu.fbk.gfd.util.Datatypes;
import eu.fbk.gfd.util.DefaultMap;
import eu.fbk.gfd.util.ValueNormalizer;

/**
 * Bidirectional index between literals and their datatype.
 * <p>
 * Each literal is assigned exactly one datatype by {@link #datatypeOf(Literal)}, hence it
 * belongs to exactly one bucket of {@link #getTypeToObject()}. Unknown literals map to
 * {@code null}, unknown datatypes to an empty set. Literals rewritten by
 * {@link ValueNormalizer#canonicalize(org.eclipse.rdf4j.model.Value)} resolve to the datatype
 * of the indexed literal they were derived from, without being added to any bucket.
 * </p>
 */
public final class DatatypeIndex {

    private final DefaultMap<Literal, IRI> objectToType;

    private final DefaultMap<IRI, Set<Literal>> typeToObject;

    private final DefaultMap<Literal, IRI> canonicalToType;

    DatatypeIndex(final Map<Literal, IRI> datatypes) {
        final Map<IRI, ImmutableSet.Builder<Literal>> builders = new HashMap<>();
        for (final Map.Entry<Literal, IRI> entry : datatypes.entrySet()) {
            builders.computeIfAbsent(entry.getValue(), dt -> ImmutableSet.builder())
                    .add(entry.getKey());
        }
        final DefaultMap<IRI, Set<Literal>> typeToObject = DefaultMap.create(ImmutableSet.of());
        for (final Map.Entry<IRI, ImmutableSet.Builder<Literal>> entry : builders.entrySet()) {
            typeToObject.put(entry.getKey(), entry.getValue().build());
        }
        final DefaultMap<Literal, IRI> canonicalToType = DefaultMap.create(null);
        for (final Map.Entry<Literal, IRI> entry : datatypes.entrySet()) {
            final Literal canonical = (Literal) ValueNormalizer.canonicalize(entry.getKey());
            if (!datatypes.containsKey(canonical)) {
                canonicalToType.putIfAbsent(canonical, entry.getValue());
            }
        }
        this.objectToType = DefaultMap.unmodifiable(DefaultMap.create(null, datatypes));
        this.typeToObject = DefaultMap.unmodifiable(typeToObject);
        this.canonicalToType = DefaultMap.unmodifiable(canonicalToType);
    }

    /**
     * Returns the datatype a literal is indexed under: {@code xsd:string} for language-tagged
     * literals, the literal datatype if defined, {@code xsd:anyType} otherwise.
     *
     * @param literal
     *            the literal
     * @return the datatype of the literal, not null
     */
    public static IRI datatypeOf(final Literal literal) {
        if (literal.getLanguage().isPresent()) {
            return XMLSchema.STRING;
        }
        final IRI datatype = literal.getDatatype();
        return datatype != null ? datatype : Datatypes.ANY_TYPE;
    }

    public DefaultMap<Literal, IRI> getObjectToType() {
        return this.objectToType;
    }

    public DefaultMap<IRI, Set<Literal>> getTypeToObject() {
        return this.typeToObject;
    }

    public boolean contains(final Literal literal) {
        return this.objectToType.containsKey(literal);
    }

    /**
     * Returns the datatype of an indexed literal, or of the indexed literal whose canonical form
     * is the supplied literal.
     *
     * @param literal
     *            the literal, either as indexed or in canonical form
     * @return the datatype, null if the literal is unknown
     */
    @Nullable
    public IRI getDatatype(final Literal literal) {
        final IRI datatype = this.objectToType.get(literal);
        return datatype != null ? datatype : this.canonicalToType.get(literal);
    }

    public Set<Literal> getLiterals(final IRI datatype) {
        return this.typeToObject.get(datatype);
    }

    public Set<IRI> getDatatypes() {
        return this.typeToObject.keySet();
    }

    public int size() {
        return this.objectToType.size();
    }

}
