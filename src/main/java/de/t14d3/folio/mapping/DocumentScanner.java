package de.t14d3.folio.mapping;

import de.t14d3.folio.annotations.Document;
import de.t14d3.folio.annotations.EmbeddedDocument;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

public final class DocumentScanner {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentScanner.class);

    private DocumentScanner() {
    }

    /**
     * Scans the classpath for {@link Document} and {@link EmbeddedDocument} types
     * under the given base package and registers their descriptions.
     * Requires 'org.reflections:reflections' on the classpath.
     *
     * @return the types that were described
     */
    public static Set<Class<?>> scan(ClassDescriptionRegistry registry, String basePackage) {
        Reflections reflections = new Reflections(
                new ConfigurationBuilder()
                        .setUrls(ClasspathHelper.forPackage(basePackage))
                        .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                        .setScanners(Scanners.TypesAnnotated)
        );
        Set<Class<?>> types = new LinkedHashSet<>();
        types.addAll(reflections.getTypesAnnotatedWith(Document.class));
        types.addAll(reflections.getTypesAnnotatedWith(EmbeddedDocument.class));
        for (Class<?> type : types) {
            registry.describe(type);
        }
        LOG.info("Registered {} document types from package {}", types.size(), basePackage);
        return types;
    }
}
