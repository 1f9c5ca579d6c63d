package eu.fbk.gfd;

import java.util.HashSet;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class PredicateIndexTest {

    private static final ValueFactory VF = SimpleValueFactory.getInstance();

    private IRI a;

    private IRI b;

    private IRI c;

    private IRI d;

    private IRI x;

    private IRI p;

    private GraphIndex index;

    @Before
    public void setUp() {
        this.a = VF.createIRI("urn:test:a");
        this.b = VF.createIRI("urn:test:b");
        this.c = VF.createIRI("urn:test:c");
        this.d = VF.createIRI("urn:test:d");
        this.x = VF.createIRI("urn:test:x");
        this.p = VF.createIRI("urn:test:p");
        this.index = GraphIndex.build(ImmutableList.of( //
                VF.createStatement(this.a, this.p, this.b),
                VF.createStatement(this.a, this.p, this.c),
                VF.createStatement(this.d, this.p, this.b)));
    }

    @Test
    public void testAdjacency() {
        final PredicateIndex.Adjacency adjacency = this.index.getPredicateIndex().get(this.p);
        Assert.assertEquals(ImmutableSet.of(this.b, this.c), adjacency.getObjects(this.a));
        Assert.assertEquals(ImmutableSet.of(this.a, this.d), adjacency.getSubjects(this.b));
        Assert.assertEquals(ImmutableSet.of(this.a), adjacency.getSubjects(this.c));
        Assert.assertEquals(ImmutableSet.of(this.a, this.d), adjacency.getForwards().keySet());
    }

    @Test
    public void testSupport() {
        final Assertion assertion = assertion(this.p);
        final Set<Value> domain = new HashSet<>(ImmutableSet.of(this.a, this.d, this.x));
        Assert.assertEquals(2, this.index.support(assertion, domain));
        Assert.assertEquals(ImmutableSet.of(this.a, this.d, this.x), domain);
        Assert.assertEquals(1, this.index.support(assertion, ImmutableSet.of(this.a)));
        Assert.assertEquals(0, this.index.support(assertion, ImmutableSet.of(this.b)));
        Assert.assertEquals(0, this.index.support(assertion, ImmutableSet.of()));
    }

    @Test
    public void testSupportLargeDomain() {
        final Set<Value> domain = new HashSet<>();
        for (int i = 0; i < 10; ++i) {
            domain.add(VF.createIRI("urn:test:n" + i));
        }
        domain.add(this.d);
        Assert.assertEquals(1, this.index.support(assertion(this.p), domain));
    }

    @Test
    public void testSupportUnknownPredicate() {
        final Assertion assertion = assertion(VF.createIRI("urn:test:q"));
        Assert.assertEquals(0,
                this.index.support(assertion, ImmutableSet.of(this.a, this.d, this.x)));
        Assert.assertFalse(this.index.getPredicateIndex().getAdjacencies()
                .containsKey(VF.createIRI("urn:test:q")));
    }

    private static Assertion assertion(final IRI predicate) {
        final TypeVariable variable = TypeVariable.object(VF.createIRI("urn:test:T"));
        return new Assertion(variable, predicate, variable);
    }

}
