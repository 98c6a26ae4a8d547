package org.stackmac.runtime.spi;

import com.typesafe.config.Config;
import org.stackmac.runtime.isa.OpcodeConflictException;
import org.stackmac.runtime.isa.OpcodeDefinition;
import org.stackmac.runtime.isa.OpcodeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers {@link OpcodeExtension} providers and registers them with an {@link OpcodeRegistry}.
 * <p>
 * Providers are found through {@link ServiceLoader} on the application class path and, if a
 * directory is configured, in every {@code *.jar} file of that directory. A provider that cannot
 * be instantiated, or whose name or number is already taken, is logged and skipped; loading never
 * aborts start-up.
 * <p>
 * Expected configuration (the {@code stackmac.extensions} block):
 * <pre>
 *   enabled = true
 *   directory = ""      # optional directory of extension jars
 *   exclude = []        # opcode names that are not registered
 * </pre>
 */
public class ExtensionLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ExtensionLoader.class);

    private static final String ENABLED_KEY = "enabled";
    private static final String DIRECTORY_KEY = "directory";
    private static final String EXCLUDE_KEY = "exclude";

    private final boolean enabled;
    private final Path directory;
    private final Set<String> excluded;
    private final ClassLoader parentClassLoader;

    /**
     * Creates a loader that discovers providers through the class loader of this class.
     * @param config The {@code stackmac.extensions} configuration block.
     */
    public ExtensionLoader(Config config) {
        this(config, ExtensionLoader.class.getClassLoader());
    }

    /**
     * Creates a loader.
     * @param config The {@code stackmac.extensions} configuration block.
     * @param parentClassLoader The class loader searched for providers; jars of the extension
     *                          directory are loaded in a child of it.
     */
    public ExtensionLoader(Config config, ClassLoader parentClassLoader) {
        this.enabled = !config.hasPath(ENABLED_KEY) || config.getBoolean(ENABLED_KEY);
        String dir = config.hasPath(DIRECTORY_KEY) ? config.getString(DIRECTORY_KEY) : "";
        this.directory = dir.isBlank() ? null : Path.of(dir);
        this.excluded = config.hasPath(EXCLUDE_KEY)
                ? config.getStringList(EXCLUDE_KEY).stream()
                    .map(name -> name.strip().toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet())
                : Set.of();
        this.parentClassLoader = parentClassLoader;
    }

    /**
     * Creates a registry with the base instruction set plus every extension this loader finds,
     * and seals it.
     *
     * @param config The {@code stackmac.extensions} configuration block.
     * @return A sealed registry.
     */
    public static OpcodeRegistry createRegistry(Config config) {
        OpcodeRegistry registry = new OpcodeRegistry();
        new ExtensionLoader(config).loadInto(registry);
        registry.seal();
        return registry;
    }

    /**
     * Registers all discovered extensions, in opcode name order.
     *
     * @param registry An unsealed registry.
     * @return The entries that were registered.
     */
    public List<OpcodeDefinition> loadInto(OpcodeRegistry registry) {
        if (!enabled) {
            LOG.debug("Extension loading is disabled.");
            return List.of();
        }
        List<OpcodeDefinition> registered = new ArrayList<>();
        for (Candidate candidate : discoverCandidates()) {
            String name = candidate.name();
            String source = candidate.extension().getClass().getName();
            if (name != null && excluded.contains(name.strip().toUpperCase(Locale.ROOT))) {
                LOG.info("Skipping excluded extension opcode {} ({})", name, source);
                continue;
            }
            try {
                OpcodeDefinition definition = registry.registerExtension(name, candidate.code(),
                        candidate.hasOperand(), candidate.cycleCost(), candidate.extension());
                registered.add(definition);
                LOG.info("Registered extension opcode {} from {}", definition, source);
            } catch (OpcodeConflictException e) {
                LOG.warn("Rejected extension {}: {}", source, e.getMessage());
            } catch (IllegalArgumentException e) {
                LOG.warn("Rejected invalid extension {}: {}", source, e.getMessage());
            }
        }
        LOG.debug("Loaded {} extension opcode(s).", registered.size());
        return registered;
    }

    /**
     * Finds all providers, deduplicated by class and sorted by opcode name, then class name.
     * Providers whose metadata cannot be read are logged and left out.
     * @return The providers.
     */
    public List<OpcodeExtension> discover() {
        return discoverCandidates().stream().map(Candidate::extension).collect(Collectors.toList());
    }

    private List<Candidate> discoverCandidates() {
        Map<Class<?>, OpcodeExtension> byClass = new LinkedHashMap<>();
        Iterator<OpcodeExtension> it = ServiceLoader.load(OpcodeExtension.class, extensionClassLoader()).iterator();
        while (true) {
            try {
                if (!it.hasNext()) {
                    break;
                }
                OpcodeExtension extension = it.next();
                byClass.putIfAbsent(extension.getClass(), extension);
            } catch (ServiceConfigurationError e) {
                LOG.warn("Could not load extension provider: {}", e.getMessage());
            }
        }
        List<Candidate> candidates = new ArrayList<>(byClass.size());
        for (OpcodeExtension extension : byClass.values()) {
            try {
                candidates.add(new Candidate(extension, extension.getName(), extension.getCode(),
                        extension.hasOperand(), extension.getCycleCost()));
            } catch (RuntimeException e) {
                LOG.warn("Rejected failing extension {}: {}", extension.getClass().getName(), e.toString());
            }
        }
        candidates.sort(Comparator
                .comparing((Candidate c) -> String.valueOf(c.name()).toUpperCase(Locale.ROOT))
                .thenComparing(c -> c.extension().getClass().getName()));
        return candidates;
    }

    /** Provider metadata, read once so that later steps never call back into the provider. */
    private record Candidate(OpcodeExtension extension, String name, int code, boolean hasOperand, int cycleCost) {}

    /**
     * The class loader that sees both the class path and the jars of the extension directory.
     * It is never closed: classes loaded from it stay in use for the lifetime of the registry.
     */
    private ClassLoader extensionClassLoader() {
        List<URL> jars = findJars();
        if (jars.isEmpty()) {
            return parentClassLoader;
        }
        LOG.debug("Loading extensions from {} jar(s) in {}", jars.size(), directory);
        return new URLClassLoader(jars.toArray(new URL[0]), parentClassLoader);
    }

    private List<URL> findJars() {
        if (directory == null) {
            return List.of();
        }
        if (!Files.isDirectory(directory)) {
            LOG.warn("Extension directory {} does not exist, skipping.", directory.toAbsolutePath());
            return List.of();
        }
        List<URL> urls = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> jars = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
            for (Path jar : jars) {
                urls.add(jar.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            LOG.warn("Invalid extension jar path in {}: {}", directory, e.getMessage());
        } catch (IOException e) {
            LOG.warn("Could not list extension directory {}: {}", directory, e.getMessage());
        }
        return urls;
    }
}
