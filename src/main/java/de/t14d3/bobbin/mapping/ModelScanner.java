package de.t14d3.bobbin.mapping;

import de.t14d3.bobbin.model.Model;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.LinkedHashSet;
import java.util.Set;

public class ModelScanner {
    private static final Logger log = LoggerFactory.getLogger(ModelScanner.class);

    /**
     * Scans the classpath for all concrete {@link Model} subtypes under a base package and
     * preloads their metadata, so that misdeclared accessors or mutators fail at startup.
     * Requires 'org.reflections:reflections' on the classpath.
     *
     * @return the model types found
     */
    public static Set<Class<? extends Model>> scan(String basePackage) {
        Reflections reflections = new Reflections(
                new ConfigurationBuilder()
                        .setUrls(ClasspathHelper.forPackage(basePackage))
                        .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                        .setScanners(Scanners.SubTypes)
        );
        Set<Class<? extends Model>> models = new LinkedHashSet<>(reflections.getSubTypesOf(Model.class));
        models.removeIf(cls -> Modifier.isAbstract(cls.getModifiers()) || !cls.getPackageName().startsWith(basePackage));
        for (Class<? extends Model> cls : models) {
            ModelMetadata.of(cls);
        }
        log.info("Scanned {} model type(s) in {}", models.size(), basePackage);
        return models;
    }
}
