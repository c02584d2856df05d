package com.talent.sourcing.provider.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.query.AnyOfClause;
import com.talent.sourcing.query.KeywordClause;
import com.talent.sourcing.query.QueryClause;
import com.talent.sourcing.query.RangeClause;
import com.talent.sourcing.query.StructuredQuery;
import com.talent.sourcing.query.TermClause;
import com.talent.sourcing.query.TermsClause;

import java.util.List;

/**
 * Renders a {@link StructuredQuery} to Elasticsearch query DSL.
 *
 * <p>Required clauses go to {@code bool.must}, boosts to {@code bool.should}. Keyword
 * clauses become {@code *keyword*} wildcards on every field; fields under
 * {@code experience.} are wrapped in a {@code nested} query on that path.</p>
 */
public class ElasticsearchQueryRenderer {

    private static final String NESTED_PATH = "experience";

    private final ObjectMapper objectMapper;

    public ElasticsearchQueryRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Returns {@code {"query": {"bool": {...}}}}.
     */
    public ObjectNode render(StructuredQuery query) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode bool = root.putObject("query").putObject("bool");
        if (!query.required().isEmpty()) {
            ArrayNode must = bool.putArray("must");
            query.required().forEach(clause -> must.add(renderClause(clause)));
        }
        if (!query.boosts().isEmpty()) {
            ArrayNode should = bool.putArray("should");
            query.boosts().forEach(clause -> should.add(renderClause(clause)));
        }
        if (query.required().isEmpty() && query.boosts().isEmpty()) {
            bool.putArray("must").addObject().putObject("match_all");
        }
        return root;
    }

    ObjectNode renderClause(QueryClause clause) {
        if (clause instanceof TermClause term) {
            ObjectNode node = objectMapper.createObjectNode();
            node.putObject("term").put(term.field(), term.value());
            return nestIfNeeded(term.field(), node);
        }
        if (clause instanceof TermsClause terms) {
            ObjectNode node = objectMapper.createObjectNode();
            ArrayNode values = node.putObject("terms").putArray(terms.field());
            terms.values().forEach(values::add);
            return nestIfNeeded(terms.field(), node);
        }
        if (clause instanceof KeywordClause keywords) {
            ObjectNode node = objectMapper.createObjectNode();
            ObjectNode bool = node.putObject("bool");
            ArrayNode should = bool.putArray("should");
            for (String field : keywords.fields()) {
                for (String keyword : keywords.keywords()) {
                    ObjectNode wildcard = objectMapper.createObjectNode();
                    wildcard.putObject("wildcard").put(field, "*" + keyword.toLowerCase() + "*");
                    should.add(nestIfNeeded(field, wildcard));
                }
            }
            bool.put("minimum_should_match", 1);
            return node;
        }
        if (clause instanceof RangeClause range) {
            ObjectNode node = objectMapper.createObjectNode();
            ObjectNode bounds = node.putObject("range").putObject(range.field());
            if (range.gte() != null) {
                bounds.put("gte", range.gte());
            }
            if (range.lte() != null) {
                bounds.put("lte", range.lte());
            }
            return nestIfNeeded(range.field(), node);
        }
        if (clause instanceof AnyOfClause anyOf) {
            return anyOf(anyOf.clauses());
        }
        throw new IllegalArgumentException("Unsupported clause type: " + clause.getClass().getName());
    }

    private ObjectNode anyOf(List<QueryClause> clauses) {
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode bool = node.putObject("bool");
        ArrayNode should = bool.putArray("should");
        clauses.forEach(nested -> should.add(renderClause(nested)));
        bool.put("minimum_should_match", 1);
        return node;
    }

    private ObjectNode nestIfNeeded(String field, ObjectNode inner) {
        if (!field.startsWith(NESTED_PATH + ".")) {
            return inner;
        }
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode nested = node.putObject("nested");
        nested.put("path", NESTED_PATH);
        nested.set("query", inner);
        return node;
    }
}
