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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.RDFS;
import org.eclipse.rdf4j.rio.helpers.AbstractRDFHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.gfd.util.Environment;

/**
 * The indexes of a graph snapshot: labels, literal datatypes, entity types and predicate
 * adjacency.
 * <p>
 * A {@code GraphIndex} is built once from an immutable collection of statements, either via
 * {@link #build(Iterable)} / {@link #build(List)} or by feeding a {@link Builder} obtained with
 * {@link #builder()}, which is an {@code RDFHandler}. Once built, the index is read-only and can
 * be queried concurrently (statement contexts are ignored).
 * </p>
 */
public final class GraphIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphIndex.class);

    private final LabelIndex labelIndex;

    private final DatatypeIndex datatypeIndex;

    private final TypeIndex typeIndex;

    private final PredicateIndex predicateIndex;

    private final TypeCache cache;

    private final long size;

    private GraphIndex(final LabelIndex labelIndex, final DatatypeIndex datatypeIndex,
            final TypeIndex typeIndex, final PredicateIndex predicateIndex, final long size) {
        this.labelIndex = labelIndex;
        this.datatypeIndex = datatypeIndex;
        this.typeIndex = typeIndex;
        this.predicateIndex = predicateIndex;
        this.cache = new TypeCache(typeIndex, datatypeIndex);
        this.size = size;
    }

    public static Builder builder() {
        return new Builder(null, null);
    }

    /**
     * Creates a builder using the label property and generic class specified. Null arguments
     * are replaced by the values of properties {@code gfd.index.label} and
     * {@code gfd.index.generic}, defaulting to {@code rdfs:label} and {@code rdfs:Class}.
     *
     * @param labelProperty
     *            the property whose values are entity labels, possibly null
     * @param genericClass
     *            the class assigned to entities without {@code rdf:type}, possibly null
     * @return the created builder
     */
    public static Builder builder(@Nullable final IRI labelProperty,
            @Nullable final Resource genericClass) {
        return new Builder(labelProperty, genericClass);
    }

    public static GraphIndex build(final Iterable<? extends Statement> statements) {
        final long ts = System.currentTimeMillis();
        final Builder builder = builder();
        for (final Statement statement : statements) {
            builder.add(statement);
        }
        final GraphIndex index = builder.build();
        GraphIndex.LOGGER.info("Indexed {} in {} ms", index, System.currentTimeMillis() - ts);
        return index;
    }

    /**
     * Builds the index of the statements specified, splitting them in shards indexed in
     * parallel if more than {@code gfd.index.shard} statements (default 100000) are supplied.
     *
     * @param statements
     *            the statements to index
     * @return the built index
     */
    public static GraphIndex build(final List<? extends Statement> statements) {

        final int shardSize = Math.max(1,
                Integer.parseInt(Environment.getProperty("gfd.index.shard", "100000").trim()));
        final int numShards = Math.min(Environment.getCores(),
                (statements.size() + shardSize - 1) / shardSize);
        if (numShards <= 1) {
            return build((Iterable<? extends Statement>) statements);
        }

        final long ts = System.currentTimeMillis();
        final List<Builder> builders = new ArrayList<>();
        final List<Runnable> runnables = new ArrayList<>();
        final int step = (statements.size() + numShards - 1) / numShards;
        for (int start = 0; start < statements.size(); start += step) {
            final List<? extends Statement> shard = statements.subList(start,
                    Math.min(statements.size(), start + step));
            final Builder builder = builder();
            builders.add(builder);
            runnables.add(() -> {
                for (final Statement statement : shard) {
                    builder.add(statement);
                }
            });
        }
        Environment.run(runnables);

        final Builder merged = builders.get(0);
        for (int i = 1; i < builders.size(); ++i) {
            merged.merge(builders.get(i));
        }
        final GraphIndex index = merged.build();
        GraphIndex.LOGGER.info("Indexed {} using {} shards in {} ms", index, builders.size(),
                System.currentTimeMillis() - ts);
        return index;
    }

    public LabelIndex getLabelIndex() {
        return this.labelIndex;
    }

    public DatatypeIndex getDatatypeIndex() {
        return this.datatypeIndex;
    }

    public TypeIndex getTypeIndex() {
        return this.typeIndex;
    }

    public PredicateIndex getPredicateIndex() {
        return this.predicateIndex;
    }

    public TypeCache getCache() {
        return this.cache;
    }

    /**
     * Returns the number of statements fed to the index, duplicates included.
     *
     * @return the number of indexed statements
     */
    public long size() {
        return this.size;
    }

    public int support(final Assertion assertion, final Set<? extends Value> domain) {
        return this.predicateIndex.support(assertion, domain);
    }

    public boolean isEquivalent(final Assertion assertionA, final Assertion assertionB) {
        return Equivalence.isEquivalent(assertionA, assertionB, this.cache);
    }

    @Override
    public String toString() {
        return this.size + " triples (" + this.predicateIndex.getPredicates().size()
                + " predicates, " + this.typeIndex.size() + " entities, "
                + this.typeIndex.getClasses().size() + " classes, " + this.datatypeIndex.size()
                + " literals, " + this.labelIndex.size() + " labels)";
    }

    /**
     * Accumulates statements and produces a {@link GraphIndex}.
     * <p>
     * A builder is not thread-safe; statements can be indexed in parallel by feeding separate
     * builders and combining them with {@link #merge(Builder)}. Method {@link #build()} can be
     * called only once.
     * </p>
     */
    public static final class Builder extends AbstractRDFHandler {

        private final IRI labelProperty;

        private final Resource genericClass;

        private final Map<Resource, Value> labels;

        private final Map<Literal, IRI> datatypes;

        private final Set<Resource> entities;

        private final SetMultimap<Resource, Resource> types;

        private final Map<IRI, SetMultimap<Resource, Value>> edges;

        private long size;

        private boolean built;

        Builder(@Nullable final IRI labelProperty, @Nullable final Resource genericClass) {
            this.labelProperty = labelProperty != null ? labelProperty
                    : propertyIRI("gfd.index.label", RDFS.LABEL);
            this.genericClass = genericClass != null ? genericClass
                    : propertyIRI("gfd.index.generic", RDFS.CLASS);
            this.labels = new HashMap<>();
            this.datatypes = new HashMap<>();
            this.entities = new HashSet<>();
            this.types = HashMultimap.create();
            this.edges = new HashMap<>();
            this.size = 0L;
            this.built = false;
        }

        public IRI getLabelProperty() {
            return this.labelProperty;
        }

        public Resource getGenericClass() {
            return this.genericClass;
        }

        @Override
        public void handleStatement(final Statement statement) {
            add(statement);
        }

        public Builder add(final Statement statement) {
            Preconditions.checkState(!this.built, "Index already built");

            final Resource s = statement.getSubject();
            final IRI p = statement.getPredicate();
            final Value o = statement.getObject();

            ++this.size;
            this.entities.add(s);
            if (p.equals(this.labelProperty)) {
                this.labels.put(s, o);
            }
            if (p.equals(RDF.TYPE)) {
                if (o instanceof Resource) {
                    this.types.put(s, (Resource) o);
                } else {
                    GraphIndex.LOGGER.debug("Ignoring non-resource type in {}", statement);
                }
            }
            if (o instanceof Literal) {
                final Literal l = (Literal) o;
                this.datatypes.put(l, DatatypeIndex.datatypeOf(l));
            }
            this.edges.computeIfAbsent(p, k -> HashMultimap.create()).put(s, o);
            return this;
        }

        /**
         * Adds to this builder the statements accumulated by another builder. Labels of the
         * other builder replace the ones of this builder for the same entities.
         *
         * @param other
         *            the builder to merge, not modified
         * @return this builder, for call chaining
         */
        public Builder merge(final Builder other) {
            Preconditions.checkState(!this.built, "Index already built");
            Preconditions.checkArgument(other != this, "Cannot merge a builder with itself");
            this.size += other.size;
            this.labels.putAll(other.labels);
            this.datatypes.putAll(other.datatypes);
            this.entities.addAll(other.entities);
            this.types.putAll(other.types);
            for (final Map.Entry<IRI, SetMultimap<Resource, Value>> entry : other.edges
                    .entrySet()) {
                this.edges.computeIfAbsent(entry.getKey(), k -> HashMultimap.create())
                        .putAll(entry.getValue());
            }
            return this;
        }

        public GraphIndex build() {
            Preconditions.checkState(!this.built, "Index already built");
            this.built = true;
            return new GraphIndex(new LabelIndex(this.labels),
                    new DatatypeIndex(this.datatypes),
                    new TypeIndex(this.entities, this.types, this.genericClass),
                    new PredicateIndex(this.edges), this.size);
        }

        private static IRI propertyIRI(final String property, final IRI defaultValue) {
            final String value = Environment.getProperty(property);
            return value == null || value.trim().isEmpty() ? defaultValue
                    : SimpleValueFactory.getInstance().createIRI(value.trim());
        }

        @Override
        public String toString() {
            return "GraphIndex.Builder (" + this.size + " triples)";
        }

    }

}
