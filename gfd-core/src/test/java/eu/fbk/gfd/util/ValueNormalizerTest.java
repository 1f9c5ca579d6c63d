package eu.fbk.gfd.util;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.datatypes.XMLDatatypeUtil;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.XMLSchema;
import org.junit.Assert;
import org.junit.Test;

public class ValueNormalizerTest {

    private static final ValueFactory VF = SimpleValueFactory.getInstance();

    @Test
    public void testNumeric() {
        Assert.assertEquals(42.0, ValueNormalizer.cast(VF.createLiteral("42", XMLSchema.INT)));
        Assert.assertEquals(1.5,
                ValueNormalizer.cast(VF.createLiteral(" 1.5 ", XMLSchema.DECIMAL)));
        Assert.assertEquals(7.0, ValueNormalizer.cast(7, XMLSchema.INTEGER));
    }

    @Test
    public void testNumericFailure() {
        final Literal literal = VF.createLiteral("abc", XMLSchema.INT);
        Assert.assertSame(literal, ValueNormalizer.cast(literal));
        Assert.assertSame(literal, ValueNormalizer.canonicalize(literal));
    }

    @Test
    public void testDateTime() {
        Assert.assertEquals(LocalDateTime.of(2020, 5, 20, 0, 0),
                ValueNormalizer.cast(VF.createLiteral("2020-05-20", XMLSchema.DATE)));
        Assert.assertEquals(LocalDateTime.of(2020, 5, 20, 10, 30), ValueNormalizer
                .cast(VF.createLiteral("2020-05-20T10:30:00", XMLSchema.DATETIME)));
        Assert.assertEquals(OffsetDateTime.of(2020, 5, 20, 10, 30, 0, 0, ZoneOffset.ofHours(2)),
                ValueNormalizer
                        .cast(VF.createLiteral("2020-05-20T10:30:00+02:00", XMLSchema.DATETIME)));
        Assert.assertEquals(LocalDateTime.of(2020, 5, 20, 0, 0),
                ValueNormalizer.cast("2020-05-20", XMLSchema.DATETIME));
    }

    @Test
    public void testDateTimeFailure() {
        final Literal literal = VF.createLiteral("yesterday", XMLSchema.DATETIME);
        Assert.assertSame(literal, ValueNormalizer.cast(literal));
    }

    @Test
    public void testDateFragment() {
        Assert.assertEquals(140,
                ValueNormalizer.cast(VF.createLiteral("--05-20", XMLSchema.GMONTHDAY)));
        final Literal literal = VF.createLiteral("May 20", XMLSchema.GMONTHDAY);
        Assert.assertSame(literal, ValueNormalizer.cast(literal));
    }

    @Test
    public void testString() {
        Assert.assertEquals("alice", ValueNormalizer.cast(VF.createLiteral("  ALICE ")));
        Assert.assertEquals("alice", ValueNormalizer.cast(VF.createLiteral("Alice", "en")));
        Assert.assertEquals("token", ValueNormalizer.cast("Token", XMLSchema.TOKEN));
    }

    @Test
    public void testOtherDatatypes() {
        final Literal literal = VF.createLiteral("TRUE", XMLSchema.BOOLEAN);
        Assert.assertSame(literal, ValueNormalizer.cast(literal));
        Assert.assertEquals("ABC", ValueNormalizer.cast("ABC", null));
        Assert.assertNull(ValueNormalizer.cast(null, XMLSchema.STRING));
    }

    @Test
    public void testIdempotence() {
        final List<Literal> literals = Arrays.asList(VF.createLiteral("42", XMLSchema.INT),
                VF.createLiteral("abc", XMLSchema.DOUBLE),
                VF.createLiteral("2020-05-20", XMLSchema.DATE),
                VF.createLiteral("2020-05-20T10:30:00Z", XMLSchema.DATETIME),
                VF.createLiteral("--05-20Z", XMLSchema.GMONTHDAY),
                VF.createLiteral("1999", XMLSchema.GYEAR), VF.createLiteral(" Mixed Case "),
                VF.createLiteral("Hallo", "de"), VF.createLiteral("x", XMLSchema.BOOLEAN));
        for (final Literal literal : literals) {
            final IRI datatype = literal.getDatatype();
            final Object once = ValueNormalizer.cast(literal, datatype);
            Assert.assertEquals(literal.toString(), once,
                    ValueNormalizer.cast(once, datatype));
            final Value canonical = ValueNormalizer.canonicalize(literal);
            Assert.assertEquals(literal.toString(), canonical,
                    ValueNormalizer.canonicalize(canonical));
        }
    }

    @Test
    public void testCanonicalLexicalForms() {
        final List<Literal> literals = Arrays.asList(VF.createLiteral("042", XMLSchema.INT),
                VF.createLiteral("+7", XMLSchema.INTEGER),
                VF.createLiteral("1.50", XMLSchema.DECIMAL),
                VF.createLiteral("15", XMLSchema.DOUBLE),
                VF.createLiteral("2020-05-20", XMLSchema.DATE),
                VF.createLiteral(" 2020-05-20T10:30:00Z ", XMLSchema.DATETIME),
                VF.createLiteral("-0044", XMLSchema.GYEAR),
                VF.createLiteral("2019-02Z", XMLSchema.GYEARMONTH));
        for (final Literal literal : literals) {
            final Literal canonical = (Literal) ValueNormalizer.canonicalize(literal);
            Assert.assertEquals(literal.getDatatype(), canonical.getDatatype());
            Assert.assertTrue(canonical.toString(), XMLDatatypeUtil
                    .isValidValue(canonical.getLabel(), canonical.getDatatype()));
        }
    }

    @Test
    public void testCanonicalize() {
        Assert.assertEquals(VF.createLiteral("alice"),
                ValueNormalizer.canonicalize(VF.createLiteral(" ALICE")));
        Assert.assertEquals(VF.createLiteral("alice", "en"),
                ValueNormalizer.canonicalize(VF.createLiteral("Alice", "en")));
        Assert.assertEquals(VF.createLiteral("42", XMLSchema.INT),
                ValueNormalizer.canonicalize(VF.createLiteral(" 042 ", XMLSchema.INT)));
        Assert.assertEquals(VF.createLiteral("1.5", XMLSchema.DECIMAL),
                ValueNormalizer.canonicalize(VF.createLiteral("1.50", XMLSchema.DECIMAL)));
        Assert.assertEquals(VF.createLiteral("-0044", XMLSchema.GYEAR),
                ValueNormalizer.canonicalize(VF.createLiteral("-0044Z", XMLSchema.GYEAR)));
        Assert.assertEquals(VF.createLiteral("--05-20", XMLSchema.GMONTHDAY),
                ValueNormalizer.canonicalize(VF.createLiteral("--05-20Z", XMLSchema.GMONTHDAY)));
        final Literal bool = VF.createLiteral("TRUE", XMLSchema.BOOLEAN);
        Assert.assertSame(bool, ValueNormalizer.canonicalize(bool));
        final IRI iri = VF.createIRI("urn:test:Alice");
        Assert.assertSame(iri, ValueNormalizer.canonicalize(iri));
    }

}
