package com.costsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link CloudTaxonomy} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_TAXONOMY_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}, by default
 * {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link CloudTaxonomy#validate()} after
 * parsing so that a broken taxonomy <strong>fails fast</strong> at start-up
 * rather than silently producing no explanations, then freeze the result.
 * </p>
 *
 * @since 1.0.0
 */
public final class TaxonomyLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TaxonomyLoader.class);

    /** Environment variable that can override the default taxonomy location. */
    public static final String ENV_TAXONOMY_PATH = "CLOUD_TAXONOMY_PATH";

    /** Taxonomy bundled with the engine. */
    public static final String DEFAULT_RESOURCE = "cloud-taxonomy.yml";

    private TaxonomyLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * The bundled taxonomy, parsed once on first use.
     *
     * @return shared read-only taxonomy
     */
    public static CloudTaxonomy bundled() {
        return BundledHolder.INSTANCE;
    }

    /**
     * Load the taxonomy using automatic resolution.
     *
     * <ol>
     * <li>If {@code CLOUD_TAXONOMY_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, use the bundled {@code cloud-taxonomy.yml}.</li>
     * </ol>
     *
     * @return parsed and validated taxonomy
     * @throws IllegalStateException if validation fails
     */
    public static CloudTaxonomy load() {
        return load(System.getenv(ENV_TAXONOMY_PATH));
    }

    /**
     * Load the taxonomy named by a configuration.
     *
     * @param config engine configuration; must not be {@code null}
     * @return parsed and validated taxonomy
     */
    public static CloudTaxonomy load(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        return load(config.getTaxonomyPath());
    }

    /**
     * Load the taxonomy from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated taxonomy
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or validation fails
     */
    public static CloudTaxonomy fromFile(String path) {
        Objects.requireNonNull(path, "Taxonomy file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Taxonomy file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read taxonomy file: " + path, e);
        }
    }

    /**
     * Load the taxonomy from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated taxonomy
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or validation fails
     */
    public static CloudTaxonomy fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = TaxonomyLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static CloudTaxonomy load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading cloud taxonomy from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading cloud taxonomy from classpath: {}", DEFAULT_RESOURCE);
        return bundled();
    }

    private static CloudTaxonomy parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(CloudTaxonomy.class, options));
        CloudTaxonomy taxonomy = yaml.load(is);

        if (taxonomy == null) {
            LOG.warn("Cloud taxonomy is empty; no event patterns will be matched");
            taxonomy = new CloudTaxonomy();
        } else {
            taxonomy.validate();
        }
        taxonomy.freeze();

        LOG.info("Loaded cloud taxonomy: {} event(s), {} resource pattern(s), {} service categor(ies)",
                taxonomy.getEvents().size(), taxonomy.getResourcePatterns().size(),
                taxonomy.getServiceCategories().size());
        return taxonomy;
    }

    private static final class BundledHolder {
        private static final CloudTaxonomy INSTANCE = fromClasspath(DEFAULT_RESOURCE);
    }
}
