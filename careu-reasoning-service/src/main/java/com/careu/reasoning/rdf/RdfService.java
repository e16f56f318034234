package com.careu.reasoning.rdf;

import com.careu.reasoning.exception.FactStoreLoadException;
import com.careu.reasoning.repository.FactStore;
import jakarta.annotation.PostConstruct;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RiotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current knowledge-graph snapshot.
 * <p>
 * Readers call {@link #snapshot()} once per request and work on that store only.
 * A reload builds a complete new store first and swaps it in with a single
 * reference write; if the build fails the previous snapshot stays in service.
 */
@Service
public class RdfService {

    private static final Logger log = LoggerFactory.getLogger(RdfService.class);

    private final Resource rdfFile;
    private final RdfFactLoader loader;

    private final AtomicReference<FactStore> current = new AtomicReference<>();

    public RdfService(@Value("${careu.rdf.data-file}") Resource rdfFile,
                      @Value("${careu.rdf.shapes-file}") Resource shapesFile) {
        this.rdfFile = rdfFile;
        this.loader = new RdfFactLoader(readShapes(shapesFile).getGraph());
    }

    @PostConstruct
    public void loadRdfOnStartup() {
        current.set(build(rdfFile, 1));
    }

    /**
     * The store in service. Never null once the application context has started.
     */
    public FactStore snapshot() {
        FactStore store = current.get();
        if (store == null) {
            throw new FactStoreLoadException("Knowledge base has not been loaded");
        }
        return store;
    }

    public synchronized FactStore reload() {
        return reload(rdfFile);
    }

    public synchronized FactStore reload(Resource source) {
        FactStore previous = current.get();
        try {
            FactStore next = build(source, previous == null ? 1 : previous.generation() + 1);
            current.set(next);
            log.info("Knowledge base swapped to generation {} ({} facts)", next.generation(), next.size());
            return next;
        } catch (FactStoreLoadException e) {
            log.error("Reload of {} failed, keeping generation {}: {}",
                    source, previous == null ? "none" : previous.generation(), e.getMessage());
            throw e;
        }
    }

    private FactStore build(Resource source, long generation) {
        try (InputStream in = source.getInputStream()) {
            return loader.load(in, source.getDescription(), generation);
        } catch (IOException e) {
            throw new FactStoreLoadException("Failed to read fact source: " + source, e);
        }
    }

    private static Model readShapes(Resource shapesFile) {
        Model shapes = ModelFactory.createDefaultModel();
        try (InputStream in = shapesFile.getInputStream()) {
            RDFDataMgr.read(shapes, in, Lang.TURTLE);
        } catch (IOException | RiotException e) {
            throw new IllegalStateException("Failed to load SHACL shapes: " + shapesFile, e);
        }
        return shapes;
    }
}
