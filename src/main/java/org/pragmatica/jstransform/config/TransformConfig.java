package org.pragmatica.jstransform.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;
import org.pragmatica.jstransform.error.TransformError;
import org.pragmatica.jstransform.error.TransformException;
import org.pragmatica.jstransform.visit.TransformVisitor;

/**
 * Plugin configuration options.
 *
 * @param visitorClassName name of the registered visitor to apply
 */
public record TransformConfig(String visitorClassName) {
    public static final TransformConfig DEFAULT = new TransformConfig(TransformVisitor.NAME);

    static final String ROOT_PATH = "jstransform";
    static final String VISITOR_CLASS_NAME = "visitorClassName";

    /**
     * Defaults from {@code reference.conf} on the classpath.
     */
    public static TransformConfig defaults() throws TransformException {
        return from(ConfigFactory.empty());
    }

    /**
     * Read the plugin configuration object, e.g. {@code {"visitorClassName": "TransformVisitor"}}.
     * Missing keys fall back to {@code reference.conf}; unknown keys are ignored.
     *
     * @throws TransformException with {@link TransformError.InvalidConfig} if the text is not a JSON object
     *                            or a value has the wrong type
     */
    public static TransformConfig fromJson(String json) throws TransformException {
        Config overrides;
        try {
            overrides = ConfigFactory.parseString(json, ConfigParseOptions.defaults()
                                                                          .setSyntax(ConfigSyntax.JSON));
        } catch (ConfigException e) {
            throw new TransformException(new TransformError.InvalidConfig(e.getMessage()), e);
        }
        return from(overrides);
    }

    private static TransformConfig from(Config overrides) throws TransformException {
        try {
            var reference = ConfigFactory.parseResources("reference.conf")
                                         .getConfig(ROOT_PATH);
            var config = overrides.withFallback(reference)
                                  .resolve();
            return new TransformConfig(config.getString(VISITOR_CLASS_NAME));
        } catch (ConfigException e) {
            throw new TransformException(new TransformError.InvalidConfig(e.getMessage()), e);
        }
    }
}
