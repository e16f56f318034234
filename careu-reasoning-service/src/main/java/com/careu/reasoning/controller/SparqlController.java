package com.careu.reasoning.controller;

import com.careu.reasoning.exception.InvalidQueryException;
import com.careu.reasoning.rdf.RdfService;
import org.apache.jena.query.*;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Read-only SPARQL access to the facts of the current snapshot, for auditing
 * what the engine reasons over. Only SELECT (with LIMIT) and ASK are accepted.
 */
@RestController
@RequestMapping("/api/v1/sparql")
public class SparqlController {

    private static final Logger log = LoggerFactory.getLogger(SparqlController.class);

    private static final String APPLICATION_SPARQL_QUERY = "application/sparql-query";
    private static final String APPLICATION_SPARQL_RESULTS_JSON = "application/sparql-results+json";

    private final RdfService rdfService;
    private final int maxQueryLength;
    private final long timeoutMs;

    public SparqlController(RdfService rdfService,
                            @Value("${careu.sparql.max-query-length:2000}") int maxQueryLength,
                            @Value("${careu.sparql.timeout-ms:5000}") long timeoutMs) {
        this.rdfService = rdfService;
        this.maxQueryLength = maxQueryLength;
        this.timeoutMs = timeoutMs;
    }

    @PostMapping(
            consumes = {APPLICATION_SPARQL_QUERY, MediaType.TEXT_PLAIN_VALUE},
            produces = APPLICATION_SPARQL_RESULTS_JSON
    )
    public ResponseEntity<String> sparqlPost(@RequestBody String queryString) {
        if (queryString.length() > maxQueryLength) {
            throw new InvalidQueryException("Query too long. Max allowed: " + maxQueryLength, null);
        }
        Query query = parse(queryString);
        Dataset dataset = rdfService.snapshot().dataset();

        String json = Txn.calculateRead(dataset, () -> {
            try (QueryExecution queryExecution = QueryExecution.create()
                    .dataset(dataset)
                    .query(query)
                    .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                    .build()) {

                if (query.isSelectType()) {
                    ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
                    ResultSetFormatter.outputAsJSON(outputStream, queryExecution.execSelect());
                    return outputStream.toString(StandardCharsets.UTF_8);
                }
                return "{\"head\":{},\"boolean\":" + queryExecution.execAsk() + "}";
            } catch (QueryCancelledException e) {
                log.warn("SPARQL query cancelled after {} ms", timeoutMs);
                throw new InvalidQueryException("Query exceeded the " + timeoutMs + " ms timeout", null);
            }
        });

        return ResponseEntity.ok()
                .contentType(MediaType.valueOf(APPLICATION_SPARQL_RESULTS_JSON))
                .body(json);
    }

    private static Query parse(String queryString) {
        final Query query;
        try {
            query = QueryFactory.create(queryString);
        } catch (QueryParseException e) {
            throw new InvalidQueryException("SPARQL parse error: " + e.getMessage(), null);
        }
        if (!query.isSelectType() && !query.isAskType()) {
            throw new InvalidQueryException("Only SELECT and ASK queries are supported", null);
        }
        if (query.isSelectType() && !query.hasLimit()) {
            throw new InvalidQueryException("SELECT queries must have a LIMIT clause.", null);
        }
        return query;
    }
}
