package com.careu.reasoning.rdf;

import com.careu.reasoning.exception.FactStoreLoadException;
import com.careu.reasoning.model.Fact;
import com.careu.reasoning.model.Identifiers;
import com.careu.reasoning.model.Relation;
import com.careu.reasoning.repository.FactStore;
import org.apache.jena.graph.Graph;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.rdf.model.StmtIterator;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RiotException;
import org.apache.jena.shacl.ShaclValidator;
import org.apache.jena.shacl.Shapes;
import org.apache.jena.shacl.ValidationReport;
import org.apache.jena.shacl.validation.ReportEntry;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a Turtle fact source into a {@link FactStore}.
 * <p>
 * The source is parsed, validated against the SHACL shapes, mapped triple by
 * triple onto the closed relation vocabulary and checked for referential
 * integrity. Any failure aborts the whole load.
 */
public class RdfFactLoader {

    private static final Logger log = LoggerFactory.getLogger(RdfFactLoader.class);

    private static final int MAX_REPORTED_VIOLATIONS = 5;

    private final Shapes shapes;
    private final FactIntegrityChecker integrityChecker = new FactIntegrityChecker();

    public RdfFactLoader(Graph shapesGraph) {
        this.shapes = Shapes.parse(shapesGraph);
    }

    public FactStore load(InputStream in, String sourceName, long generation) {
        Model model = ModelFactory.createDefaultModel();
        try {
            RDFDataMgr.read(model, in, Lang.TURTLE);
        } catch (RiotException e) {
            throw new FactStoreLoadException("Malformed fact source " + sourceName + ": " + e.getMessage(), e);
        }

        validateShapes(model, sourceName);

        List<Fact> facts = toFacts(model);
        integrityChecker.check(facts);

        Dataset dataset = DatasetFactory.createTxnMem();
        Txn.executeWrite(dataset, () -> dataset.getDefaultModel().add(model));

        FactStore store = new FactStore(generation, sourceName, Instant.now(), facts, dataset);
        log.info("Loaded {} facts from {} (generation {}, {} conditions, {} treatments)",
                store.size(), sourceName, generation, store.conditions().size(), store.treatments().size());
        return store;
    }

    private void validateShapes(Model model, String sourceName) {
        ValidationReport report = ShaclValidator.get().validate(shapes, model.getGraph());
        if (report.conforms()) return;

        List<ReportEntry> entries = new ArrayList<>(report.getEntries());
        String summary = entries.stream()
                .limit(MAX_REPORTED_VIOLATIONS)
                .map(e -> e.focusNode() + " " + e.resultPath() + ": " + e.message())
                .collect(Collectors.joining("; "));
        ReportEntry first = entries.get(0);
        String identifier = first.focusNode().isURI() ? localId(first.focusNode().getURI()) : null;
        String relation = first.resultPath() == null ? null : first.resultPath().toString();
        throw new FactStoreLoadException(
                "Fact source " + sourceName + " violates " + entries.size() + " shape constraint(s): " + summary,
                identifier, relation);
    }

    private List<Fact> toFacts(Model model) {
        List<Fact> facts = new ArrayList<>();
        StmtIterator it = model.listStatements();
        try {
            while (it.hasNext()) {
                facts.add(toFact(it.next()));
            }
        } finally {
            it.close();
        }
        return facts;
    }

    private Fact toFact(Statement statement) {
        String subject = subjectId(statement.getSubject());
        Relation relation = Vocabulary.relationOf(statement.getPredicate())
                .orElseThrow(() -> new FactStoreLoadException(
                        "Unknown relation " + statement.getPredicate().getURI() + " on " + subject,
                        subject, statement.getPredicate().getURI()));
        RDFNode object = statement.getObject();

        if (object.isLiteral()) {
            return Fact.literal(subject, relation, object.asLiteral().getLexicalForm());
        }
        if (object.isAnon()) {
            throw new FactStoreLoadException(
                    "Blank node object in " + subject + " " + relation.token(), subject, relation.token());
        }
        Resource resource = object.asResource();
        if (relation == Relation.IS_A) {
            String className = Vocabulary.className(resource);
            if (className == null) {
                throw new FactStoreLoadException(
                        "Type of " + subject + " is outside the kb namespace: " + resource.getURI(),
                        subject, relation.token());
            }
            return Fact.entity(subject, relation, className);
        }
        String objectId = Vocabulary.entityId(resource);
        if (objectId == null) {
            throw new FactStoreLoadException(
                    "Object of " + subject + " " + relation.token() + " is outside the entity namespace: "
                            + resource.getURI(),
                    subject, relation.token());
        }
        requireCanonical(objectId, relation);
        return Fact.entity(subject, relation, objectId);
    }

    private String subjectId(Resource subject) {
        if (subject.isAnon()) {
            throw new FactStoreLoadException("Blank node subjects are not allowed in the fact source");
        }
        String id = Vocabulary.entityId(subject);
        if (id == null) {
            throw new FactStoreLoadException(
                    "Subject outside the entity namespace: " + subject.getURI(), subject.getURI(), null);
        }
        requireCanonical(id, null);
        return id;
    }

    private static void requireCanonical(String id, Relation relation) {
        if (!Identifiers.isCanonical(id)) {
            throw new FactStoreLoadException(
                    "Identifier is not a canonical lowercase hyphenated token: " + id,
                    id, relation == null ? null : relation.token());
        }
    }

    private static String localId(String uri) {
        if (uri.startsWith(Vocabulary.ENTITY_NS)) return uri.substring(Vocabulary.ENTITY_NS.length());
        return uri;
    }
}
