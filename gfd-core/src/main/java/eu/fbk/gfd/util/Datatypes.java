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

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XMLSchema;

/**
 * Classification of literal datatypes into the families handled by {@link ValueNormalizer}.
 */
public final class Datatypes {

    /** Datatype {@code xsd:anyType}, assigned to literals carrying neither datatype nor language. */
    public static final IRI ANY_TYPE;

    /** Datatype {@code xsd:dateTimeStamp}. */
    public static final IRI DATETIMESTAMP;

    private static final Map<IRI, Family> FAMILIES;

    static {
        final ValueFactory vf = SimpleValueFactory.getInstance();
        ANY_TYPE = vf.createIRI(XMLSchema.NAMESPACE, "anyType");
        DATETIMESTAMP = vf.createIRI(XMLSchema.NAMESPACE, "dateTimeStamp");

        final ImmutableMap.Builder<IRI, Family> builder = ImmutableMap.builder();
        for (final IRI dt : new IRI[] { XMLSchema.DECIMAL, XMLSchema.DOUBLE, XMLSchema.FLOAT,
                XMLSchema.INTEGER, XMLSchema.LONG, XMLSchema.INT, XMLSchema.SHORT,
                XMLSchema.BYTE, XMLSchema.NON_POSITIVE_INTEGER, XMLSchema.NEGATIVE_INTEGER,
                XMLSchema.NON_NEGATIVE_INTEGER, XMLSchema.POSITIVE_INTEGER,
                XMLSchema.UNSIGNED_LONG, XMLSchema.UNSIGNED_INT, XMLSchema.UNSIGNED_SHORT,
                XMLSchema.UNSIGNED_BYTE }) {
            builder.put(dt, Family.NUMERIC);
        }
        for (final IRI dt : new IRI[] { XMLSchema.DATETIME, XMLSchema.DATE, DATETIMESTAMP }) {
            builder.put(dt, Family.DATETIME);
        }
        for (final IRI dt : new IRI[] { XMLSchema.GYEAR, XMLSchema.GYEARMONTH, XMLSchema.GMONTH,
                XMLSchema.GMONTHDAY, XMLSchema.GDAY }) {
            builder.put(dt, Family.DATE_FRAGMENT);
        }
        for (final IRI dt : new IRI[] { XMLSchema.STRING, XMLSchema.NORMALIZEDSTRING,
                XMLSchema.TOKEN, XMLSchema.LANGUAGE, XMLSchema.NAME, XMLSchema.NCNAME,
                XMLSchema.NMTOKEN, RDF.LANGSTRING }) {
            builder.put(dt, Family.STRING);
        }
        FAMILIES = builder.build();
    }

    private Datatypes() {
    }

    public static Family family(@Nullable final IRI datatype) {
        final Family family = datatype == null ? null : FAMILIES.get(datatype);
        return family != null ? family : Family.OTHER;
    }

    /**
     * Returns whether literals of the datatype specified can be compared by value, i.e., whether
     * the datatype belongs to one of the numeric, datetime, date fragment or string families.
     *
     * @param datatype
     *            the datatype, possibly null
     * @return true if the datatype is one of the comparable datatypes
     */
    public static boolean isMultiModal(@Nullable final IRI datatype) {
        return family(datatype) != Family.OTHER;
    }

    public enum Family {

        NUMERIC,

        DATETIME,

        DATE_FRAGMENT,

        STRING,

        OTHER

    }

}
