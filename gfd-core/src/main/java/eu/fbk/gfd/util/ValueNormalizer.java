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

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;

import javax.annotation.Nullable;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.datatypes.XMLDatatypeUtil;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.XMLSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonicalization of literal values by datatype family.
 * <p>
 * Numeric values become {@link Double}s, dates and datetimes become {@link LocalDateTime}s (or
 * {@link OffsetDateTime}s if a timezone is specified), date fragments become an {@link Integer}
 * number of days (see {@link DateFragments}) and strings are trimmed and lower-cased. Values
 * that cannot be converted are returned unchanged. All methods are pure and idempotent.
 * </p>
 */
public final class ValueNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValueNormalizer.class);

    private static final ValueFactory VALUE_FACTORY = SimpleValueFactory.getInstance();

    private ValueNormalizer() {
    }

    /**
     * Casts a value to the canonical Java representation associated to the family of the
     * datatype specified. The value can be a {@link Literal}, in which case its label is
     * converted, or any object (e.g., the result of a previous cast), in which case its string
     * representation is converted unless the object is already in canonical form. If the
     * conversion fails, or if the datatype belongs to no known family, the value is returned
     * unchanged.
     *
     * @param value
     *            the value to cast, possibly null
     * @param datatype
     *            the datatype driving the conversion, possibly null
     * @return the canonical value, or the input value if conversion is not possible
     */
    @Nullable
    public static Object cast(@Nullable final Object value, @Nullable final IRI datatype) {
        if (value == null) {
            return null;
        }
        final Datatypes.Family family = Datatypes.family(datatype);
        try {
            switch (family) {
            case NUMERIC:
                return castNumeric(value);
            case DATETIME:
                return castDateTime(value);
            case DATE_FRAGMENT:
                return castDateFragment(value, datatype);
            case STRING:
                return castString(value);
            default:
                return value;
            }
        } catch (final IllegalArgumentException | DateTimeException
                | ArithmeticException ex) {
            if (ValueNormalizer.LOGGER.isTraceEnabled()) {
                ValueNormalizer.LOGGER.trace("Cannot cast {} to {} value: {}", value, family,
                        ex.getMessage());
            }
            return value;
        }
    }

    /**
     * Casts a literal based on its own datatype (language-tagged literals are strings).
     *
     * @param literal
     *            the literal to cast
     * @return the canonical value, or the literal itself if conversion is not possible
     * @see #cast(Object, IRI)
     */
    public static Object cast(final Literal literal) {
        return cast(literal, datatypeOf(literal));
    }

    /**
     * Returns a literal in canonical form equivalent to the value supplied. The returned literal
     * keeps the datatype and language of the input literal and has a label that is a valid
     * lexical form of that datatype: strings are trimmed and lower-cased, numbers and datetimes
     * take the canonical lexical form of {@link XMLDatatypeUtil#normalize(String, IRI)}, date
     * fragments are rewritten without timezone. Non-literal values, literals of other datatypes
     * and literals with an invalid label are returned unchanged.
     *
     * @param value
     *            the value to canonicalize, possibly null
     * @return the canonical value
     */
    @Nullable
    public static Value canonicalize(@Nullable final Value value) {
        if (!(value instanceof Literal)) {
            return value;
        }
        final Literal literal = (Literal) value;
        final IRI datatype = datatypeOf(literal);
        final String label;
        try {
            switch (Datatypes.family(datatype)) {
            case STRING:
                label = castString(literal);
                break;
            case DATE_FRAGMENT:
                label = DateFragments.toFragment(
                        DateFragments.toDays(literal.getLabel(), datatype), datatype);
                break;
            case NUMERIC:
            case DATETIME:
                label = XMLDatatypeUtil.normalize(literal.getLabel().trim(), datatype);
                if (!XMLDatatypeUtil.isValidValue(label, datatype)) {
                    return literal;
                }
                break;
            default:
                return literal;
            }
        } catch (final IllegalArgumentException | DateTimeException
                | ArithmeticException ex) {
            if (ValueNormalizer.LOGGER.isTraceEnabled()) {
                ValueNormalizer.LOGGER.trace("Cannot canonicalize {}: {}", literal,
                        ex.getMessage());
            }
            return literal;
        }
        if (label.equals(literal.getLabel())) {
            return literal;
        }
        final Optional<String> language = literal.getLanguage();
        return language.isPresent() ? VALUE_FACTORY.createLiteral(label, language.get())
                : VALUE_FACTORY.createLiteral(label, literal.getDatatype());
    }

    private static IRI datatypeOf(final Literal literal) {
        return literal.getLanguage().isPresent() ? XMLSchema.STRING
                : literal.getDatatype();
    }

    private static Double castNumeric(final Object value) {
        if (value instanceof Double) {
            return (Double) value;
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return XMLDatatypeUtil.parseDouble(labelOf(value).trim());
    }

    private static Object castDateTime(final Object value) {
        if (value instanceof LocalDateTime || value instanceof OffsetDateTime) {
            return value;
        } else if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        final String s = labelOf(value).trim();
        if (s.indexOf('T') < 0) {
            // bare date: combine with midnight
            final TemporalAccessor t = DateTimeFormatter.ISO_DATE.parse(s);
            final LocalDate date = LocalDate.from(t);
            return t.isSupported(ChronoField.OFFSET_SECONDS)
                    ? OffsetDateTime.of(date, LocalTime.MIDNIGHT, ZoneOffset.from(t))
                    : date.atStartOfDay();
        }
        final TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parse(s);
        return t.isSupported(ChronoField.OFFSET_SECONDS) ? OffsetDateTime.from(t)
                : LocalDateTime.from(t);
    }

    private static Integer castDateFragment(final Object value, final IRI datatype) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        return DateFragments.toDays(labelOf(value), datatype);
    }

    private static String castString(final Object value) {
        return labelOf(value).trim().toLowerCase(Locale.ROOT);
    }

    private static String labelOf(final Object value) {
        return value instanceof Value ? ((Value) value).stringValue() : value.toString();
    }

}
