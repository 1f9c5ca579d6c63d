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

import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;

import org.eclipse.rdf4j.model.Resource;

import eu.fbk.gfd.util.DefaultMap;

/**
 * Bidirectional, many-to-many index between entities and the classes they are instances of.
 * <p>
 * Every indexed entity has at least one class: entities without an asserted {@code rdf:type} are
 * assigned a generic class. Unknown entities and classes map to an empty set.
 * </p>
 */
public final class TypeIndex {

    private final Resource genericClass;

    private final DefaultMap<Resource, Set<Resource>> objectToType;

    private final DefaultMap<Resource, Set<Resource>> typeToObject;

    TypeIndex(final Set<Resource> entities, final SetMultimap<Resource, Resource> types,
            final Resource genericClass) {
        final DefaultMap<Resource, Set<Resource>> objectToType = DefaultMap
                .create(ImmutableSet.of());
        final DefaultMap<Resource, Set<Resource>> typeToObject = DefaultMap
                .create(ImmutableSet.of());
        final SetMultimap<Resource, Resource> inverse = HashMultimap.create();
        for (final Resource entity : entities) {
            Set<Resource> classes = types.get(entity);
            if (classes.isEmpty()) {
                classes = ImmutableSet.of(genericClass);
            }
            objectToType.put(entity, ImmutableSet.copyOf(classes));
            for (final Resource clazz : classes) {
                inverse.put(clazz, entity);
            }
        }
        for (final Resource clazz : inverse.keySet()) {
            typeToObject.put(clazz, ImmutableSet.copyOf(inverse.get(clazz)));
        }
        this.genericClass = genericClass;
        this.objectToType = DefaultMap.unmodifiable(objectToType);
        this.typeToObject = DefaultMap.unmodifiable(typeToObject);
    }

    public Resource getGenericClass() {
        return this.genericClass;
    }

    public DefaultMap<Resource, Set<Resource>> getObjectToType() {
        return this.objectToType;
    }

    public DefaultMap<Resource, Set<Resource>> getTypeToObject() {
        return this.typeToObject;
    }

    public boolean contains(final Resource entity) {
        return this.objectToType.containsKey(entity);
    }

    public Set<Resource> getTypes(final Resource entity) {
        return this.objectToType.get(entity);
    }

    public Set<Resource> getInstances(final Resource clazz) {
        return this.typeToObject.get(clazz);
    }

    public Set<Resource> getClasses() {
        return this.typeToObject.keySet();
    }

    public int size() {
        return this.objectToType.size();
    }

}
