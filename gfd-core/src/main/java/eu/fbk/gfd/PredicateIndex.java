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

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;

import eu.fbk.gfd.util.DefaultMap;

/**
 * Per-predicate adjacency index.
 * <p>
 * For each predicate {@code p} the index stores an {@link Adjacency} with the forward
 * (subject to objects) and backward (object to subjects) edges of {@code p}; for every triple
 * {@code (s, p, o)}, {@code o} belongs to {@code get(p).getObjects(s)} and {@code s} belongs to
 * {@code get(p).getSubjects(o)}. Predicates never observed map to an empty adjacency.
 * </p>
 */
public final class PredicateIndex {

    private static final Adjacency EMPTY = new Adjacency(HashMultimap.create());

    private final DefaultMap<IRI, Adjacency> adjacencies;

    PredicateIndex(final Map<IRI, ? extends SetMultimap<Resource, Value>> edges) {
        final DefaultMap<IRI, Adjacency> adjacencies = DefaultMap.create(EMPTY);
        for (final Map.Entry<IRI, ? extends SetMultimap<Resource, Value>> entry : edges
                .entrySet()) {
            adjacencies.put(entry.getKey(), new Adjacency(entry.getValue()));
        }
        this.adjacencies = DefaultMap.unmodifiable(adjacencies);
    }

    public DefaultMap<IRI, Adjacency> getAdjacencies() {
        return this.adjacencies;
    }

    public Adjacency get(final IRI predicate) {
        return this.adjacencies.get(predicate);
    }

    public Set<IRI> getPredicates() {
        return this.adjacencies.keySet();
    }

    /**
     * Counts the subjects of the domain supplied having at least an outgoing edge labelled with
     * the predicate of the assertion. Neither the domain nor the index are modified.
     *
     * @param assertion
     *            the assertion whose predicate is considered
     * @param domain
     *            the candidate subjects
     * @return the size of the intersection between the domain and the subjects of the predicate
     */
    public int support(final Assertion assertion, final Set<? extends Value> domain) {
        Objects.requireNonNull(domain);
        final Set<Resource> subjects = get(assertion.getPredicate()).getForwards().keySet();
        int count = 0;
        if (domain.size() <= subjects.size()) {
            for (final Value value : domain) {
                if (subjects.contains(value)) {
                    ++count;
                }
            }
        } else {
            for (final Resource subject : subjects) {
                if (domain.contains(subject)) {
                    ++count;
                }
            }
        }
        return count;
    }

    /**
     * The forward and backward edges of a predicate.
     */
    public static final class Adjacency {

        private final DefaultMap<Resource, Set<Value>> forwards;

        private final DefaultMap<Value, Set<Resource>> backwards;

        Adjacency(final SetMultimap<Resource, Value> edges) {
            final DefaultMap<Resource, Set<Value>> forwards = DefaultMap
                    .create(ImmutableSet.of());
            final DefaultMap<Value, Set<Resource>> backwards = DefaultMap
                    .create(ImmutableSet.of());
            final SetMultimap<Value, Resource> inverse = HashMultimap.create();
            for (final Resource subject : edges.keySet()) {
                final Set<Value> objects = edges.get(subject);
                forwards.put(subject, ImmutableSet.copyOf(objects));
                for (final Value object : objects) {
                    inverse.put(object, subject);
                }
            }
            for (final Value object : inverse.keySet()) {
                backwards.put(object, ImmutableSet.copyOf(inverse.get(object)));
            }
            this.forwards = DefaultMap.unmodifiable(forwards);
            this.backwards = DefaultMap.unmodifiable(backwards);
        }

        public DefaultMap<Resource, Set<Value>> getForwards() {
            return this.forwards;
        }

        public DefaultMap<Value, Set<Resource>> getBackwards() {
            return this.backwards;
        }

        public Set<Value> getObjects(final Resource subject) {
            return this.forwards.get(subject);
        }

        public Set<Resource> getSubjects(final Value object) {
            return this.backwards.get(object);
        }

        public boolean isEmpty() {
            return this.forwards.isEmpty();
        }

        /**
         * Returns the number of edges, i.e., of distinct triples with this predicate.
         *
         * @return the number of edges
         */
        public int size() {
            int size = 0;
            for (final Set<Value> objects : this.forwards.values()) {
                size += objects.size();
            }
            return size;
        }

    }

}
