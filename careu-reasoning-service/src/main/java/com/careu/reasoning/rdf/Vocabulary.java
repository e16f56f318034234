package com.careu.reasoning.rdf;

import com.careu.reasoning.model.Relation;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.vocabulary.RDF;

import java.util.Optional;

/**
 * Namespaces of the fact source and their mapping to the closed relation vocabulary.
 */
public final class Vocabulary {

    public static final String ENTITY_NS = "https://careu.example/id/";
    public static final String KB_NS = "https://careu.example/kb/";
    public static final String SCHEMA_NAME = "https://schema.org/name";

    public static Optional<Relation> relationOf(Property predicate) {
        if (predicate.equals(RDF.type)) return Optional.of(Relation.IS_A);
        String uri = predicate.getURI();
        if (SCHEMA_NAME.equals(uri)) return Optional.of(Relation.NAME);
        if (uri != null && uri.startsWith(KB_NS)) {
            return Relation.fromToken(uri.substring(KB_NS.length()));
        }
        return Optional.empty();
    }

    /** Entity id of a resource in the entity namespace, or null for any other resource. */
    public static String entityId(Resource resource) {
        String uri = resource.getURI();
        if (uri == null || !uri.startsWith(ENTITY_NS)) return null;
        return uri.substring(ENTITY_NS.length());
    }

    /** Class name of a resource in the kb namespace, or null for any other resource. */
    public static String className(Resource resource) {
        String uri = resource.getURI();
        if (uri == null || !uri.startsWith(KB_NS)) return null;
        return uri.substring(KB_NS.length());
    }

    private Vocabulary() {}
}
