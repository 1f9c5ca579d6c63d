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
import java.util.function.Function;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Value;

/**
 * A triple pattern {@code (lhs, predicate, rhs)} whose endpoints are either concrete RDF
 * {@link Value}s or {@link TypeVariable}s. Assertions are immutable and compared by value.
 */
public final class Assertion {

    private final Object lhs;

    private final IRI predicate;

    private final Object rhs;

    public Assertion(final Object lhs, final IRI predicate, final Object rhs) {
        this.lhs = Assertion.check(lhs);
        this.predicate = Objects.requireNonNull(predicate);
        this.rhs = Assertion.check(rhs);
    }

    /**
     * Returns the left-hand side, either a {@code Value} or a {@code TypeVariable}.
     *
     * @return the left-hand side
     */
    public Object getLhs() {
        return this.lhs;
    }

    public IRI getPredicate() {
        return this.predicate;
    }

    /**
     * Returns the right-hand side, either a {@code Value} or a {@code TypeVariable}.
     *
     * @return the right-hand side
     */
    public Object getRhs() {
        return this.rhs;
    }

    /**
     * Applies the supplied function to the concrete endpoints of this assertion, leaving type
     * variables and the predicate untouched.
     *
     * @param normalizer
     *            the function to apply, e.g., {@code ValueNormalizer::canonicalize}
     * @return the resulting assertion, possibly this assertion if nothing changed
     */
    public Assertion normalize(final Function<? super Value, ? extends Value> normalizer) {
        final Object nlhs = this.lhs instanceof Value ? normalizer.apply((Value) this.lhs)
                : this.lhs;
        final Object nrhs = this.rhs instanceof Value ? normalizer.apply((Value) this.rhs)
                : this.rhs;
        return nlhs == this.lhs && nrhs == this.rhs ? this
                : new Assertion(nlhs, this.predicate, nrhs);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Assertion)) {
            return false;
        }
        final Assertion other = (Assertion) object;
        return this.lhs.equals(other.lhs) && this.predicate.equals(other.predicate)
                && this.rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.lhs, this.predicate, this.rhs);
    }

    @Override
    public String toString() {
        return "(" + this.lhs + ", " + this.predicate + ", " + this.rhs + ")";
    }

    private static Object check(final Object component) {
        if (!(component instanceof Value) && !(component instanceof TypeVariable)) {
            throw new IllegalArgumentException("Illegal assertion component " + component);
        }
        return component;
    }

}
