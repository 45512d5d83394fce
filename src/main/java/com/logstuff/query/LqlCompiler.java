package com.logstuff.query;

import com.logstuff.query.parser.LQLLexer;
import com.logstuff.query.parser.LQLParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * LQL (log query language) compiler.
 * Parses query text into an {@link Expression} tree and translates it into a
 * parameterized SQL predicate.
 *
 * <p>Grammar, lowest to highest precedence:
 * <pre>
 *   expression  := expression "or" conjunction | conjunction
 *   conjunction := conjunction "and" negation  | negation
 *   negation    := "not" primary | primary
 *   primary     := "(" expression ")" | IDENTIFIER operator value | STRING
 * </pre>
 */
@Component
public class LqlCompiler {
    private static final Logger logger = LoggerFactory.getLogger(LqlCompiler.class);

    private final PostgresTranspiler transpiler;

    public LqlCompiler(PostgresTranspiler transpiler) {
        this.transpiler = transpiler;
    }

    /**
     * Parse an LQL query string.
     *
     * @param query The query text
     * @return The expression tree
     * @throws QueryParseException if the text is not a valid query
     */
    public Expression parse(String query) {
        LQLLexer lexer = new LQLLexer(CharStreams.fromString(query));
        LqlErrorListener errorListener = new LqlErrorListener(query);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        LQLParser parser = new LQLParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.query();
        return new LqlVisitor(query).visit(tree);
    }

    /**
     * Parse and translate a query. A missing or blank query matches every event.
     *
     * @param query The query text, may be null
     * @return The SQL predicate with its bound values
     * @throws InvalidQueryException if the query cannot be parsed or is badly typed
     */
    public SqlPredicate compile(String query) {
        if (query == null || query.isBlank()) {
            return SqlPredicate.matchAll();
        }
        SqlPredicate predicate = transpiler.transpile(parse(query));
        logger.debug("Compiled query [{}] to [{}]", query, predicate);
        return predicate;
    }
}
