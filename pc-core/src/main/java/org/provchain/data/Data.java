package org.provchain.data;

import java.util.GregorianCalendar;
import java.util.TimeZone;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.Nullable;
import javax.xml.datatype.DatatypeFactory;
import javax.xml.datatype.XMLGregorianCalendar;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

import org.provchain.internal.Util;

/**
 * Helper services for working with ledger data.
 * <p>
 * This class provides the following services:
 * </p>
 * <ul>
 * <li><b>Factories for value objects</b>. Method {@link #getValueFactory()} returns a singleton
 * {@code ValueFactory} for creating {@code Statement}s and {@code Value}s; method
 * {@link #getDatatypeFactory()} returns a singleton factory for XML Schema structured types, used
 * to produce block timestamps via {@link #newTimestamp()}.</li>
 * <li><b>Shared executor</b>. Method {@link #getExecutor()} returns the worker pool used for
 * CPU-bound canonicalization, distinct from the threads that mutate the chain. Its size and
 * thread naming come from system properties {@code org.provchain.threadCount} and
 * {@code org.provchain.threadName}; it can be replaced via
 * {@link #setExecutor(ExecutorService)}.</li>
 * <li><b>String rendering</b>. Method {@link #toString(Object)} produces a compact Turtle-like
 * rendering of values and statements, meant for log messages.</li>
 * </ul>
 */
public final class Data {

    /** System property with the number of threads of the shared executor. */
    public static final String PROPERTY_THREAD_COUNT = "org.provchain.threadCount";

    /** System property with the name format of the threads of the shared executor. */
    public static final String PROPERTY_THREAD_NAME = "org.provchain.threadName";

    private static final DatatypeFactory DATATYPE_FACTORY;

    private static final ValueFactory VALUE_FACTORY;

    private static ListeningExecutorService executor;

    private static AtomicBoolean executorPrivate = new AtomicBoolean();

    static {
        VALUE_FACTORY = ValueFactoryImpl.getInstance();
        try {
            DATATYPE_FACTORY = DatatypeFactory.newInstance();
        } catch (final Throwable ex) {
            throw new Error("Unexpected exception (!): " + ex.getMessage(), ex);
        }
    }

    /**
     * Returns the executor shared by ledger components. If no executor is setup using
     * {@link #setExecutor(ExecutorService)}, an executor is automatically created using the
     * thread number and naming given by system properties {@code org.provchain.threadCount} and
     * {@code org.provchain.threadName}.
     *
     * @return the shared executor
     */
    public static ListeningExecutorService getExecutor() {
        synchronized (executorPrivate) {
            if (executor == null) {
                final String threadName = MoreObjects.firstNonNull(
                        System.getProperty(PROPERTY_THREAD_NAME), "canon-%02d");
                int threadCount = Runtime.getRuntime().availableProcessors();
                final String threadCountSpec = System.getProperty(PROPERTY_THREAD_COUNT);
                if (threadCountSpec != null) {
                    try {
                        threadCount = Integer.parseInt(threadCountSpec.trim());
                    } catch (final NumberFormatException ex) {
                        throw new IllegalArgumentException("Invalid " + PROPERTY_THREAD_COUNT
                                + ": " + threadCountSpec, ex);
                    }
                }
                executor = Util.newExecutor(threadCount, threadName, true);
                executorPrivate.set(true);
            }
            return executor;
        }
    }

    /**
     * Setup the executor shared by ledger components. If another executor was previously in use,
     * it will not be used anymore; in case it was the executor automatically created by the
     * system, it will be shutdown.
     *
     * @param newExecutor
     *            the new executor
     */
    public static void setExecutor(final ExecutorService newExecutor) {
        Preconditions.checkNotNull(newExecutor);
        ExecutorService executorToShutdown = null;
        synchronized (executorPrivate) {
            if (executor != null && executorPrivate.get()) {
                executorToShutdown = executor;
            }
            executor = Util.decorate(newExecutor);
            executorPrivate.set(false);
        }
        if (executorToShutdown != null) {
            executorToShutdown.shutdown();
        }
    }

    /**
     * Returns the {@code ValueFactory} used for creating RDF {@code URI}s, {@code BNode}s,
     * {@code Literal}s and {@code Statement}s.
     *
     * @return a singleton {@code ValueFactory}
     */
    public static ValueFactory getValueFactory() {
        return VALUE_FACTORY;
    }

    /**
     * Returns a {@code DatatypeFactory} for creating {@code XMLGregorianCalendar} instances and
     * instances of other XML schema structured types.
     *
     * @return a singleton {@code DatatypeFactory}
     */
    public static DatatypeFactory getDatatypeFactory() {
        return DATATYPE_FACTORY;
    }

    /**
     * Returns the current time in UTC as an {@code xsd:dateTime} lexical form (ISO 8601), the
     * format of block timestamps.
     *
     * @return the timestamp string
     */
    public static String newTimestamp() {
        final GregorianCalendar calendar = new GregorianCalendar(TimeZone.getTimeZone("UTC"));
        final XMLGregorianCalendar xmlCalendar = DATATYPE_FACTORY
                .newXMLGregorianCalendar(calendar);
        return xmlCalendar.toXMLFormat();
    }

    /**
     * Returns a context-free copy of the statement specified, i.e., a statement with the same
     * subject, predicate and object but no named graph.
     *
     * @param statement
     *            the statement
     * @return a statement without context, possibly the input statement itself
     */
    public static Statement withoutContext(final Statement statement) {
        if (statement.getContext() == null) {
            return statement;
        }
        return VALUE_FACTORY.createStatement(statement.getSubject(), statement.getPredicate(),
                statement.getObject());
    }

    /**
     * Returns a string representation of the supplied value or statement, meant for logging.
     *
     * @param object
     *            the {@code Value} or {@code Statement}, possibly null
     * @return the produced string, or null if a null object was passed as input
     */
    @Nullable
    public static String toString(@Nullable final Object object) {
        if (object instanceof Statement) {
            final Statement statement = (Statement) object;
            final StringBuilder builder = new StringBuilder();
            builder.append('(');
            toString(statement.getSubject(), builder);
            builder.append(',').append(' ');
            toString(statement.getPredicate(), builder);
            builder.append(',').append(' ');
            toString(statement.getObject(), builder);
            builder.append(")");
            final Resource ctx = statement.getContext();
            if (ctx != null) {
                builder.append(' ').append('[');
                toString(ctx, builder);
                builder.append(']');
            }
            return builder.toString();

        } else if (object instanceof Value) {
            final StringBuilder builder = new StringBuilder();
            toString((Value) object, builder);
            return builder.toString();

        } else if (object != null) {
            return object.toString();
        }

        return null;
    }

    private static void toString(final Value value, final StringBuilder builder) {
        if (value instanceof URI) {
            builder.append('<').append(value.stringValue()).append('>');

        } else if (value instanceof BNode) {
            builder.append('_').append(':').append(((BNode) value).getID());

        } else {
            final Literal literal = (Literal) value;
            builder.append('\"').append(literal.getLabel()).append('\"');
            final URI datatype = literal.getDatatype();
            if (datatype != null) {
                builder.append('^').append('^');
                toString(datatype, builder);
            } else {
                final String language = literal.getLanguage();
                if (language != null) {
                    builder.append('@').append(language);
                }
            }
        }
    }

    private Data() {
    }

}
