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

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide configuration and thread pool.
 * <p>
 * Properties are read from classpath resources {@code gfd.properties} (also under
 * {@code META-INF/}, plus the resources listed in system property
 * {@code gfd.environment.sources}), from system properties and from environment variables, in
 * increasing order of priority. A property can be overridden with
 * {@link #configureProperty(String, String)} until it is read for the first time; afterwards its
 * value is frozen.
 * </p>
 */
public final class Environment {

    private static final Logger LOGGER = LoggerFactory.getLogger(Environment.class);

    private static Map<String, String> configuredProperties = new HashMap<>();

    private static Map<String, String> loadedProperties = new HashMap<>();

    private static Map<String, Optional<String>> frozenProperties = new ConcurrentHashMap<>();

    private static ExecutorService configuredPool = null;

    private static volatile ExecutorService frozenPool = null;

    private static int frozenCores = 0;

    static {
        final Properties properties = new Properties();
        properties.setProperty("gfd.cores", "" + Runtime.getRuntime().availableProcessors());
        try {
            final List<String> envSources = Lists.newArrayList("gfd.properties");
            envSources.addAll(Splitter.on(',').omitEmptyStrings().trimResults()
                    .splitToList(System.getProperty("gfd.environment.sources", "")));
            final List<URL> urls = new ArrayList<>();
            final ClassLoader cl = Environment.class.getClassLoader();
            for (final String envSource : envSources) {
                for (final String p : new String[] { "META-INF/" + envSource, envSource }) {
                    for (final Enumeration<URL> e = cl.getResources(p); e.hasMoreElements();) {
                        urls.add(e.nextElement());
                    }
                }
            }
            for (final URL url : urls) {
                try (Reader in = new InputStreamReader(url.openStream(),
                        StandardCharsets.UTF_8)) {
                    properties.load(in);
                    Environment.LOGGER.debug("Loaded configuration from '{}'", url);
                } catch (final IOException | IllegalArgumentException ex) {
                    Environment.LOGGER.warn(
                            "Could not load configuration from '" + url + "' - ignoring", ex);
                }
            }
        } catch (final IOException ex) {
            Environment.LOGGER.warn(
                    "Could not complete loading of configuration from classpath resources", ex);
        }
        for (final Map.Entry<?, ?> entry : properties.entrySet()) {
            Environment.loadedProperties.put((String) entry.getKey(), (String) entry.getValue());
        }
        for (final Map.Entry<?, ?> entry : System.getProperties().entrySet()) {
            if (entry.getKey() instanceof String && entry.getValue() instanceof String) {
                Environment.loadedProperties.put((String) entry.getKey(),
                        (String) entry.getValue());
            }
        }
        for (final Map.Entry<String, String> entry : System.getenv().entrySet()) {
            final String key = entry.getKey().toLowerCase().replace('_', '.');
            Environment.loadedProperties.put(key, entry.getValue());
        }
    }

    private Environment() {
    }

    /**
     * Sets the thread pool returned by {@link #getPool()}, replacing the default cached pool of
     * daemon threads. The pool can be configured only until it is used for the first time.
     *
     * @param pool
     *            the pool to use, null to restore the default pool
     * @throws IllegalStateException
     *             if the pool was already used
     */
    public static void configurePool(@Nullable final ExecutorService pool) {
        synchronized (Environment.class) {
            if (Environment.frozenPool != null) {
                throw new IllegalStateException("Thread pool already in use");
            }
            Environment.configuredPool = pool; // to be frozen later
        }
    }

    public static void configureProperty(final String name, @Nullable final String value) {
        Objects.requireNonNull(name);
        synchronized (Environment.class) {
            if (Environment.frozenProperties.containsKey(name)) {
                throw new IllegalStateException("Property " + name + " already in use (value "
                        + Environment.frozenProperties.get(name) + ")");
            }
            if (value == null) {
                Environment.configuredProperties.remove(name);
            } else {
                Environment.configuredProperties.put(name, value);
            }
        }
    }

    public static int getCores() {
        if (Environment.frozenCores <= 0) {
            Environment.frozenCores = Math.max(1,
                    Integer.parseInt(Environment.getProperty("gfd.cores").trim()));
        }
        return Environment.frozenCores;
    }

    public static ExecutorService getPool() {
        if (Environment.frozenPool == null) {
            synchronized (Environment.class) {
                if (Environment.frozenPool == null && Environment.configuredPool != null) {
                    Environment.frozenPool = Environment.configuredPool;
                } else if (Environment.frozenPool == null) {
                    final ThreadFactory factory = new ThreadFactory() {

                        private final AtomicInteger counter = new AtomicInteger(0);

                        @Override
                        public Thread newThread(final Runnable runnable) {
                            final int index = this.counter.getAndIncrement();
                            final Thread thread = new Thread(runnable);
                            thread.setName(String.format("gfd-%03d", index));
                            thread.setPriority(Thread.NORM_PRIORITY);
                            thread.setDaemon(true);
                            return thread;
                        }

                    };
                    Environment.frozenPool = Executors.newCachedThreadPool(factory);
                }
                Environment.LOGGER.debug("Using pool {}", Environment.frozenPool);
            }
        }
        return Environment.frozenPool;
    }

    /**
     * Runs the supplied runnables using up to {@link #getCores()} threads, the calling thread
     * included, and returns when all of them completed. Remaining runnables are skipped after a
     * failure, which is then rethrown.
     *
     * @param runnables
     *            the runnables to execute
     */
    public static void run(final Iterable<? extends Runnable> runnables) {

        final List<Runnable> runnableList = ImmutableList.copyOf(runnables);
        final int parallelism = Math.min(Environment.getCores(), runnableList.size());

        final CountDownLatch latch = new CountDownLatch(parallelism);
        final AtomicReference<Throwable> exception = new AtomicReference<Throwable>();
        final AtomicInteger index = new AtomicInteger(0);

        final List<Runnable> threadRunnables = new ArrayList<Runnable>();
        for (int i = 0; i < parallelism; ++i) {
            threadRunnables.add(new Runnable() {

                @Override
                public void run() {
                    try {
                        while (true) {
                            final int i = index.getAndIncrement();
                            if (i >= runnableList.size() || exception.get() != null) {
                                break;
                            }
                            runnableList.get(i).run();
                        }
                    } catch (final Throwable ex) {
                        exception.compareAndSet(null, ex);
                    } finally {
                        latch.countDown();
                    }
                }

            });
        }

        try {
            for (int i = 1; i < parallelism; ++i) {
                Environment.getPool().submit(threadRunnables.get(i));
            }
            if (!threadRunnables.isEmpty()) {
                threadRunnables.get(0).run();
            }
            latch.await();
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(ex);
        }
        final Throwable failure = exception.get();
        if (failure != null) {
            Throwables.throwIfUnchecked(failure);
            throw new RuntimeException(failure);
        }
    }

    @Nullable
    public static String getProperty(final String name) {
        Objects.requireNonNull(name);
        Optional<String> holder = Environment.frozenProperties.get(name);
        if (holder == null) {
            synchronized (Environment.class) {
                holder = Environment.frozenProperties.get(name);
                if (holder == null) {
                    String value;
                    if (Environment.configuredProperties.containsKey(name)) {
                        value = Environment.configuredProperties.get(name);
                    } else {
                        value = Environment.loadedProperties.get(name);
                    }
                    holder = Optional.ofNullable(value);
                    Environment.frozenProperties.put(name, holder);
                    if (value != null) {
                        Environment.LOGGER.debug("Using {} = {}", name, value);
                    }
                }
            }
        }
        return holder.orElse(null);
    }

    @Nullable
    public static String getProperty(final String name, @Nullable final String valueIfNull) {
        final String value = Environment.getProperty(name);
        return value != null ? value : valueIfNull;
    }

}
