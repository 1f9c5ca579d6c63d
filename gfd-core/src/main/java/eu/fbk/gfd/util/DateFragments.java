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
package eu.fbk.gfd.util;

import java.time.LocalDate;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.vocabulary.XMLSchema;

/**
 * Conversion of XML Schema date fragments ({@code xsd:gYear}, {@code xsd:gYearMonth},
 * {@code xsd:gMonth}, {@code xsd:gMonthDay}, {@code xsd:gDay}) to a number of days.
 * <p>
 * Year-based fragments map to the epoch day of their first day. Fragments without a year map to
 * the zero-based day of year in a leap reference year ({@code gMonth}, {@code gMonthDay}), or to
 * the zero-based day of month ({@code gDay}). A trailing timezone is ignored.
 * </p>
 */
public final class DateFragments {

    private static final int REFERENCE_YEAR = 2000; // leap, so that --02-29 is accepted

    private static final String TZ = "(?:Z|[+-]\\d{2}:\\d{2})?";

    private static final Pattern GYEAR = Pattern.compile("(-?\\d{4,})" + TZ);

    private static final Pattern GYEARMONTH = Pattern.compile("(-?\\d{4,})-(\\d{2})" + TZ);

    private static final Pattern GMONTH = Pattern.compile("--(\\d{2})" + TZ);

    private static final Pattern GMONTHDAY = Pattern.compile("--(\\d{2})-(\\d{2})" + TZ);

    private static final Pattern GDAY = Pattern.compile("---(\\d{2})" + TZ);

    private DateFragments() {
    }

    /**
     * Converts a date fragment to days.
     *
     * @param fragment
     *            the lexical form of the fragment
     * @param datatype
     *            the date fragment datatype
     * @return the number of days
     * @throws IllegalArgumentException
     *             if the datatype is not a date fragment datatype or the fragment is malformed
     * @throws java.time.DateTimeException
     *             if the fragment denotes a non-existent date
     */
    public static int toDays(final String fragment, final IRI datatype) {
        Objects.requireNonNull(datatype);
        final String s = fragment.trim();
        if (datatype.equals(XMLSchema.GYEAR)) {
            final Matcher m = match(GYEAR, s, datatype);
            return Math.toIntExact(LocalDate.of(Integer.parseInt(m.group(1)), 1, 1).toEpochDay());
        } else if (datatype.equals(XMLSchema.GYEARMONTH)) {
            final Matcher m = match(GYEARMONTH, s, datatype);
            return Math.toIntExact(LocalDate
                    .of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 1)
                    .toEpochDay());
        } else if (datatype.equals(XMLSchema.GMONTH)) {
            final Matcher m = match(GMONTH, s, datatype);
            return LocalDate.of(REFERENCE_YEAR, Integer.parseInt(m.group(1)), 1).getDayOfYear()
                    - 1;
        } else if (datatype.equals(XMLSchema.GMONTHDAY)) {
            final Matcher m = match(GMONTHDAY, s, datatype);
            return LocalDate.of(REFERENCE_YEAR, Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2))).getDayOfYear() - 1;
        } else if (datatype.equals(XMLSchema.GDAY)) {
            final Matcher m = match(GDAY, s, datatype);
            final int day = Integer.parseInt(m.group(1));
            if (day < 1 || day > 31) {
                throw new IllegalArgumentException("Invalid day in " + datatype + " '" + s + "'");
            }
            return day - 1;
        }
        throw new IllegalArgumentException("Not a date fragment datatype: " + datatype);
    }

    /**
     * Converts a number of days back to the canonical lexical form of a date fragment, without
     * timezone. This is the inverse of {@link #toDays(String, IRI)} on fragments without
     * timezone.
     *
     * @param days
     *            the number of days
     * @param datatype
     *            the date fragment datatype
     * @return the lexical form of the fragment
     * @throws IllegalArgumentException
     *             if the datatype is not a date fragment datatype
     * @throws java.time.DateTimeException
     *             if the number of days is out of the range of the datatype
     */
    public static String toFragment(final int days, final IRI datatype) {
        Objects.requireNonNull(datatype);
        if (datatype.equals(XMLSchema.GYEAR)) {
            return formatYear(LocalDate.ofEpochDay(days).getYear());
        } else if (datatype.equals(XMLSchema.GYEARMONTH)) {
            final LocalDate date = LocalDate.ofEpochDay(days);
            return formatYear(date.getYear()) + String.format("-%02d", date.getMonthValue());
        } else if (datatype.equals(XMLSchema.GMONTH)) {
            return String.format("--%02d",
                    LocalDate.ofYearDay(REFERENCE_YEAR, days + 1).getMonthValue());
        } else if (datatype.equals(XMLSchema.GMONTHDAY)) {
            final LocalDate date = LocalDate.ofYearDay(REFERENCE_YEAR, days + 1);
            return String.format("--%02d-%02d", date.getMonthValue(), date.getDayOfMonth());
        } else if (datatype.equals(XMLSchema.GDAY)) {
            if (days < 0 || days > 30) {
                throw new IllegalArgumentException("Invalid day offset " + days);
            }
            return String.format("---%02d", days + 1);
        }
        throw new IllegalArgumentException("Not a date fragment datatype: " + datatype);
    }

    private static String formatYear(final int year) {
        // sign precedes the zero-padded four digits, e.g. -0044
        return year < 0 ? "-" + String.format("%04d", -year) : String.format("%04d", year);
    }

    private static Matcher match(final Pattern pattern, final String fragment,
            final IRI datatype) {
        final Matcher matcher = pattern.matcher(fragment);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                    "Invalid " + datatype.getLocalName() + " lexical form '" + fragment + "'");
        }
        return matcher;
    }

}
