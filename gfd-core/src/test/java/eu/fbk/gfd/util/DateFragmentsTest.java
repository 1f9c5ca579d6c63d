package eu.fbk.gfd.util;

import java.time.LocalDate;

import org.eclipse.rdf4j.model.vocabulary.XMLSchema;
import org.junit.Assert;
import org.junit.Test;

public class DateFragmentsTest {

    @Test
    public void testYearBased() {
        Assert.assertEquals(LocalDate.of(2000, 1, 1).toEpochDay(),
                DateFragments.toDays("2000", XMLSchema.GYEAR));
        Assert.assertEquals(LocalDate.of(2000, 1, 1).toEpochDay(),
                DateFragments.toDays(" 2000Z ", XMLSchema.GYEAR));
        Assert.assertEquals(LocalDate.of(1999, 5, 1).toEpochDay(),
                DateFragments.toDays("1999-05+02:00", XMLSchema.GYEARMONTH));
    }

    @Test
    public void testWithoutYear() {
        Assert.assertEquals(0, DateFragments.toDays("--01", XMLSchema.GMONTH));
        Assert.assertEquals(31, DateFragments.toDays("--02", XMLSchema.GMONTH));
        Assert.assertEquals(140, DateFragments.toDays("--05-20", XMLSchema.GMONTHDAY));
        Assert.assertEquals(59, DateFragments.toDays("--02-29", XMLSchema.GMONTHDAY));
        Assert.assertEquals(4, DateFragments.toDays("---05", XMLSchema.GDAY));
    }

    @Test
    public void testToFragment() {
        Assert.assertEquals("2000", DateFragments.toFragment(
                DateFragments.toDays("2000", XMLSchema.GYEAR), XMLSchema.GYEAR));
        Assert.assertEquals("1999-05", DateFragments.toFragment(
                DateFragments.toDays("1999-05Z", XMLSchema.GYEARMONTH), XMLSchema.GYEARMONTH));
        Assert.assertEquals("--02", DateFragments.toFragment(31, XMLSchema.GMONTH));
        Assert.assertEquals("--05-20", DateFragments.toFragment(140, XMLSchema.GMONTHDAY));
        Assert.assertEquals("---05", DateFragments.toFragment(4, XMLSchema.GDAY));
    }

    @Test
    public void testNegativeYear() {
        final int days = DateFragments.toDays("-0044", XMLSchema.GYEAR);
        Assert.assertEquals(LocalDate.of(-44, 1, 1).toEpochDay(), days);
        Assert.assertEquals("-0044", DateFragments.toFragment(days, XMLSchema.GYEAR));
        Assert.assertEquals("-0044-03", DateFragments.toFragment(
                DateFragments.toDays("-0044-03", XMLSchema.GYEARMONTH), XMLSchema.GYEARMONTH));
        Assert.assertEquals("12345", DateFragments.toFragment(
                DateFragments.toDays("12345", XMLSchema.GYEAR), XMLSchema.GYEAR));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformed() {
        DateFragments.toDays("05-20", XMLSchema.GMONTHDAY);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidDay() {
        DateFragments.toDays("---32", XMLSchema.GDAY);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotFragmentDatatype() {
        DateFragments.toDays("2000", XMLSchema.INT);
    }

}
