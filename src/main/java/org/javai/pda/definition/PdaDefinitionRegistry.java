package org.javai.pda.definition;

import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;
import org.javai.pda.PushdownAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of named automaton definitions.
 * <p>
 * Applications register definitions once, from code, classpath resources or files, and
 * look them up by id. Registrations are idempotent per id: the first definition for an
 * id wins. The registry is not thread-safe; populate it before sharing it.
 */
public final class PdaDefinitionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(PdaDefinitionRegistry.class);

	private static final String META_INF_PREFIX = "pda-";

	private final Map<String, PdaDescriptor> descriptors = new LinkedHashMap<>();
	private final PdaDefinitionParser parser;

	private PdaDefinitionRegistry(PdaDefinitionParser parser) {
		this.parser = parser;
	}

	/**
	 * Create an empty registry backed by a fresh parser.
	 */
	public static PdaDefinitionRegistry create() {
		return new PdaDefinitionRegistry(new PdaDefinitionParser());
	}

	/**
	 * Create an empty registry that reads documents with the given parser.
	 */
	public static PdaDefinitionRegistry create(PdaDefinitionParser parser) {
		return new PdaDefinitionRegistry(Objects.requireNonNull(parser, "parser must not be null"));
	}

	/**
	 * Register a descriptor directly. If a descriptor with the same id is already present,
	 * the existing one is kept and returned.
	 */
	public PdaDescriptor register(PdaDescriptor descriptor) {
		Objects.requireNonNull(descriptor, "descriptor must not be null");
		String id = descriptor.id();
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Definition is missing an id");
		}
		PdaDescriptor existing = descriptors.get(id);
		if (existing != null) {
			logger.debug("Definition with id '{}' already registered; skipping", id);
			return existing;
		}
		descriptors.put(id, descriptor);
		return descriptor;
	}

	/**
	 * Load a definition from a classpath resource using this class' loader.
	 */
	public PdaDescriptor registerResource(String resourcePath) {
		return registerResource(resourcePath, PdaDefinitionRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a definition from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws IllegalStateException if parsing fails
	 */
	public PdaDescriptor registerResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return register(parser.parse(is));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load definition from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register a definition from a filesystem path.
	 *
	 * @throws IllegalStateException if parsing fails
	 */
	public PdaDescriptor registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try {
			return register(parser.parse(path));
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load definition from path: " + path, e);
		}
	}

	/**
	 * Discover and register definitions found under META-INF on the classpath.
	 * <p>
	 * Both exploded directories and JARs are scanned for files named {@code pda-*.yml}.
	 * Documents that fail to parse are logged and skipped.
	 */
	public PdaDefinitionRegistry registerMetaInfDefinitions(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try {
			Enumeration<URL> resources = loader.getResources("META-INF/");
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				if ("file".equalsIgnoreCase(url.getProtocol())) {
					loadFromDirectory(url);
				}
				else if ("jar".equalsIgnoreCase(url.getProtocol())) {
					loadFromJar(url);
				}
			}
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to scan META-INF for definitions", e);
		}
		return this;
	}

	/**
	 * Retrieve a descriptor by id.
	 */
	public Optional<PdaDescriptor> descriptorFor(String id) {
		return Optional.ofNullable(descriptors.get(id));
	}

	/**
	 * Build a validated automaton for the definition registered under the id.
	 *
	 * @throws IllegalStateException if nothing is registered under the id
	 * @throws org.javai.pda.AutomatonException if the registered definition is invalid
	 */
	public PushdownAutomaton requireAutomaton(String id) {
		return descriptorFor(id)
				.orElseThrow(() -> new IllegalStateException("No definition registered for id: " + id))
				.toAutomaton();
	}

	/**
	 * All registered descriptors in insertion order.
	 */
	public List<PdaDescriptor> descriptors() {
		return List.copyOf(descriptors.values());
	}

	private void loadFromDirectory(URL url) {
		try {
			Path path = Paths.get(url.toURI());
			if (!Files.isDirectory(path)) {
				return;
			}
			try (Stream<Path> files = Files.list(path)) {
				files.filter(Files::isRegularFile)
						.filter(p -> isDefinitionName(p.getFileName().toString()))
						.sorted()
						.forEach(p -> {
							try (InputStream is = Files.newInputStream(p)) {
								register(parser.parse(is));
							}
							catch (Exception ex) {
								logger.warn("Failed to load definition from {}", p, ex);
							}
						});
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan directory {}", url, e);
		}
	}

	private void loadFromJar(URL url) {
		try {
			JarURLConnection conn = (JarURLConnection) url.openConnection();
			conn.setUseCaches(false);
			try (JarFile jar = conn.getJarFile()) {
				Enumeration<JarEntry> entries = jar.entries();
				while (entries.hasMoreElements()) {
					JarEntry entry = entries.nextElement();
					String name = entry.getName();
					if (entry.isDirectory() || !name.startsWith("META-INF/")
							|| !isDefinitionName(name.substring("META-INF/".length()))) {
						continue;
					}
					try (InputStream is = jar.getInputStream(entry)) {
						register(parser.parse(is));
					}
					catch (Exception ex) {
						logger.warn("Failed to load definition from JAR entry {}", name, ex);
					}
				}
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan JAR {}", url, e);
		}
	}

	private static boolean isDefinitionName(String fileName) {
		return fileName.startsWith(META_INF_PREFIX) && fileName.endsWith(".yml") && !fileName.contains("/");
	}
}
