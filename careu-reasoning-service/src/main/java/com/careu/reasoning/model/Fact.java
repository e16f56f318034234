package com.careu.reasoning.model;

import java.util.Objects;

/**
 * Atomic unit of the knowledge graph: a typed (subject, relation, object) triple.
 * <p>
 * The object is an entity identifier, a class name for {@link Relation#IS_A}, or the
 * lexical form of a literal when {@code literal} is true.
 */
public record Fact(
        String id,
        String subject,
        Relation relation,
        String object,
        boolean literal
) {

    public static final String SEPARATOR = "|";

    public Fact {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(object, "object");
        id = idOf(subject, relation, object, literal);
    }

    public static Fact entity(String subject, Relation relation, String object) {
        return new Fact(null, subject, relation, object, false);
    }

    public static Fact literal(String subject, Relation relation, String value) {
        return new Fact(null, subject, relation, value, true);
    }

    public static String idOf(String subject, Relation relation, String object, boolean literal) {
        String renderedObject = literal ? "\"" + object + "\"" : object;
        return subject + SEPARATOR + relation.token() + SEPARATOR + renderedObject;
    }
}
