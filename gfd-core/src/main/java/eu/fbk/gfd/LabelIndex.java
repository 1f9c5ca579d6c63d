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

import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

import eu.fbk.gfd.util.DefaultMap;

/**
 * Index from entities to their display label. Entities without a label are mapped to an empty
 * string literal.
 */
public final class LabelIndex {

    public static final Literal EMPTY_LABEL = SimpleValueFactory.getInstance().createLiteral("");

    private final DefaultMap<Resource, Value> labels;

    LabelIndex(final Map<Resource, Value> labels) {
        this.labels = DefaultMap.unmodifiable(DefaultMap.create(EMPTY_LABEL, labels));
    }

    public DefaultMap<Resource, Value> getLabels() {
        return this.labels;
    }

    public Value get(final Resource entity) {
        return this.labels.get(entity);
    }

    public String getLabel(final Resource entity) {
        return this.labels.get(entity).stringValue();
    }

    public int size() {
        return this.labels.size();
    }

}
