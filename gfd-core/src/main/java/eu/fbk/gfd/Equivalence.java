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

import java.util.Set;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Resource;

/**
 * Type-aware equivalence of assertions.
 * <p>
 * Two assertions are equivalent if they share the same typed subject variable and the same
 * predicate, and their right-hand sides are the same resource, type variables with the same
 * type, or a type variable and a concrete resource that is an instance of the variable type.
 * All methods are stateless and only read the supplied {@link TypeCache}, hence they can be
 * invoked concurrently.
 * </p>
 */
public final class Equivalence {

    private Equivalence() {
    }

    public static boolean isEquivalent(final Assertion assertionA, final Assertion assertionB,
            final TypeCache cache) {

        // only assertions on the same subject type and predicate are compared
        final Object lhsA = assertionA.getLhs();
        final Object lhsB = assertionB.getLhs();
        if (!(lhsA instanceof TypeVariable) || !((TypeVariable) lhsA).isObject()
                || !(lhsB instanceof TypeVariable) || !((TypeVariable) lhsB).isObject()
                || !((TypeVariable) lhsA).getType().equals(((TypeVariable) lhsB).getType())
                || !assertionA.getPredicate().equals(assertionB.getPredicate())) {
            return false;
        }

        final Object rhsA = assertionA.getRhs();
        final Object rhsB = assertionB.getRhs();
        if (rhsA.equals(rhsB)) {
            return true;
        }
        if (rhsA instanceof TypeVariable && rhsB instanceof TypeVariable
                && ((TypeVariable) rhsA).getType().equals(((TypeVariable) rhsB).getType())) {
            return true;
        }
        return isSameType(rhsA, rhsB, cache) || isSameType(rhsB, rhsA, cache);
    }

    /**
     * Tests whether {@code resourceB} is a concrete instance of the type of variable
     * {@code resourceA}. The test is not symmetric: it is false whenever {@code resourceA} is not
     * a type variable.
     *
     * @param resourceA
     *            the candidate type variable
     * @param resourceB
     *            the candidate concrete resource
     * @param cache
     *            the type information to consult
     * @return true if {@code resourceB} is an entity or literal indexed with the type of
     *         {@code resourceA}
     */
    public static boolean isSameType(final Object resourceA, final Object resourceB,
            final TypeCache cache) {
        if (!(resourceA instanceof TypeVariable)) {
            return false;
        }
        final TypeVariable variable = (TypeVariable) resourceA;
        if (variable.isObject()) {
            if (resourceB instanceof Resource) {
                final TypeIndex index = cache.getTypeIndex();
                final Set<Resource> types = index.getTypes((Resource) resourceB);
                return index.contains((Resource) resourceB)
                        && types.contains(variable.getType());
            }
        } else if (variable.isData()) {
            if (resourceB instanceof Literal) {
                final IRI datatype = cache.getDatatypeIndex().getDatatype((Literal) resourceB);
                return datatype != null && datatype.equals(variable.getType());
            }
        }
        return false;
    }

}
