package com.tyron.textseek.core.config;

import com.tyron.textseek.api.text.SelectionBehavior;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads a {@link SeekConfiguration} from YAML (textseek.yaml).
 *
 * <pre>
 * selectionBehavior: caret | character
 * wordSeparators: "..."
 * languages:
 *   css:
 *     wordSeparators: "..."
 * </pre>
 */
public final class SeekConfigurationLoader {

    private static final Logger LOG = Logger.getLogger(SeekConfigurationLoader.class.getName());

    public static final String FILE_NAME = "textseek.yaml";
    public static final String DEFAULT_RESOURCE = "/textseek-default.yaml";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("selectionBehavior", "wordSeparators", "languages");

    private SeekConfigurationLoader() {
    }

    /**
     * Loads the configuration bundled with the library.
     */
    public static SeekConfiguration loadDefault() {
        InputStream in = SeekConfigurationLoader.class.getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.warning("config action=fallback reason=missingResource resource=" + DEFAULT_RESOURCE);
            }
            return SeekConfiguration.defaults();
        }

        try (InputStream stream = in) {
            return load(stream);
        } catch (IOException e) {
            throw new SeekConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads the configuration file at {@code path}, or the defaults if it does not exist.
     */
    public static SeekConfiguration load(@NotNull Path path) {
        if (!Files.isRegularFile(path)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("config action=fallback reason=missingFile path=" + path);
            }
            return SeekConfiguration.defaults();
        }

        try (InputStream in = Files.newInputStream(path)) {
            SeekConfiguration configuration = load(in);
            if (LOG.isLoggable(Level.INFO)) {
                LOG.info("config action=load path=" + path + " result=" + configuration);
            }
            return configuration;
        } catch (IOException e) {
            throw new SeekConfigurationException("Failed to read " + path, e);
        }
    }

    public static SeekConfiguration load(@NotNull InputStream in) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new SeekConfigurationException("Malformed seek configuration: " + e.getMessage(), e);
        }

        SeekConfiguration.Builder builder = SeekConfiguration.builder();

        // Empty document.
        if (doc == null) {
            return builder.build();
        }
        if (!(doc instanceof Map<?, ?> map)) {
            throw new SeekConfigurationException("Seek configuration must be a mapping, got "
                    + doc.getClass().getSimpleName());
        }

        for (Object key : map.keySet()) {
            if (!TOP_LEVEL_KEYS.contains(String.valueOf(key)) && LOG.isLoggable(Level.WARNING)) {
                LOG.warning("config action=ignore reason=unknownKey key=" + key);
            }
        }

        // selectionBehavior: caret | character
        Object behavior = map.get("selectionBehavior");
        if (behavior != null) {
            try {
                builder.selectionBehavior(SelectionBehavior.parse(String.valueOf(behavior)));
            } catch (IllegalArgumentException e) {
                throw new SeekConfigurationException("Invalid selectionBehavior: " + behavior, e);
            }
        }

        // wordSeparators: string
        Object separators = map.get("wordSeparators");
        if (separators != null) {
            builder.wordSeparators(requireString("wordSeparators", separators));
        }

        // languages: {id: {wordSeparators: string}}
        Object languages = map.get("languages");
        if (languages instanceof Map<?, ?> languagesMap) {
            for (Map.Entry<?, ?> e : languagesMap.entrySet()) {
                if (e.getKey() == null) continue;
                String languageId = String.valueOf(e.getKey());

                if (!(e.getValue() instanceof Map<?, ?> settings)) {
                    throw new SeekConfigurationException("languages." + languageId + " must be a mapping");
                }

                Object languageSeparators = settings.get("wordSeparators");
                if (languageSeparators != null) {
                    builder.languageWordSeparators(languageId,
                            requireString("languages." + languageId + ".wordSeparators", languageSeparators));
                }
            }
        } else if (languages != null) {
            throw new SeekConfigurationException("languages must be a mapping");
        }

        return builder.build();
    }

    private static String requireString(String key, Object value) {
        if (!(value instanceof String s)) {
            throw new SeekConfigurationException(key + " must be a string, got " + value.getClass().getSimpleName());
        }
        return s;
    }
}
