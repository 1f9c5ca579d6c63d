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

import org.eclipse.rdf4j.model.IRI;

import eu.fbk.gfd.util.Datatypes;

/**
 * A placeholder standing for any resource of a given type.
 * <p>
 * A type variable is a tagged value: its {@link Kind} tells whether it matches entities that are
 * instances of a class ({@link Kind#OBJECT}), or literals of a datatype ({@link Kind#DATA} and
 * {@link Kind#MULTIMODAL}, the latter used for datatypes whose values can be compared after
 * normalization). Instances are immutable and compared by kind and type.
 * </p>
 */
public final class TypeVariable {

    private final Kind kind;

    private final IRI type;

    private TypeVariable(final Kind kind, final IRI type) {
        this.kind = Objects.requireNonNull(kind);
        this.type = Objects.requireNonNull(type);
    }

    public static TypeVariable object(final IRI type) {
        return new TypeVariable(Kind.OBJECT, type);
    }

    public static TypeVariable data(final IRI type) {
        return new TypeVariable(Kind.DATA, type);
    }

    public static TypeVariable multiModal(final IRI type) {
        return new TypeVariable(Kind.MULTIMODAL, type);
    }

    /**
     * Returns a variable matching literals of the datatype specified, choosing
     * {@link Kind#MULTIMODAL} for the datatypes whose values can be normalized and
     * {@link Kind#DATA} otherwise.
     *
     * @param datatype
     *            the datatype
     * @return the created variable
     */
    public static TypeVariable forDatatype(final IRI datatype) {
        return Datatypes.isMultiModal(datatype) ? multiModal(datatype) : data(datatype);
    }

    public Kind getKind() {
        return this.kind;
    }

    public IRI getType() {
        return this.type;
    }

    public boolean isObject() {
        return this.kind == Kind.OBJECT;
    }

    /**
     * Returns whether this variable ranges over literals, i.e., it is either of kind
     * {@link Kind#DATA} or {@link Kind#MULTIMODAL}.
     *
     * @return true if the variable ranges over literals
     */
    public boolean isData() {
        return this.kind == Kind.DATA || this.kind == Kind.MULTIMODAL;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof TypeVariable)) {
            return false;
        }
        final TypeVariable other = (TypeVariable) object;
        return this.kind == other.kind && this.type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.type);
    }

    @Override
    public String toString() {
        return "?" + this.kind.getSymbol() + ":" + this.type.getLocalName();
    }

    public enum Kind {

        OBJECT('o'),

        DATA('d'),

        MULTIMODAL('m');

        private final char symbol;

        Kind(final char symbol) {
            this.symbol = symbol;
        }

        char getSymbol() {
            return this.symbol;
        }

    }

}
