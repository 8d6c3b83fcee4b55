package me.christianrobert.adqlpg.transformer.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.adqlpg.antlr.AdqlLexer;
import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.context.AdqlSyntaxException;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.ParserATNSimulator;
import org.antlr.v4.runtime.atn.PredictionContextCache;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin wrapper around the generated ADQL parser.
 * Handles parser instantiation and error collection.
 *
 * Uses a two-stage parsing strategy:
 * 1. Try SLL(*) mode first (fast, low memory)
 * 2. Fall back to LL(*) mode if SLL fails (slower, handles all cases, reports precise errors)
 *
 * The DFA and prediction context caches belong to this instance rather than to the
 * static fields of the generated parser, so instances never share mutable state and
 * the caches go away with the instance.
 *
 * Uses @Dependent scope: it's both @Injected and instantiated with new in tests.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /** Deepest parenthesis nesting accepted before parsing. */
    static final int MAX_NESTING_DEPTH = 200;

    private final DFA[] decisionToDFA;
    private final PredictionContextCache contextCache = new PredictionContextCache();

    public AntlrParser() {
        int decisions = AdqlParser._ATN.getNumberOfDecisions();
        decisionToDFA = new DFA[decisions];
        for (int i = 0; i < decisions; i++) {
            decisionToDFA[i] = new DFA(AdqlParser._ATN.getDecisionState(i), i);
        }
    }

    /**
     * Parses one ADQL statement.
     *
     * @param adql the statement
     * @return ParseResult containing the parse tree and any errors
     * @throws AdqlSyntaxException for empty input or excessive nesting
     */
    public ParseResult parseStatement(String adql) {
        if (adql == null || adql.trim().isEmpty()) {
            throw new AdqlSyntaxException("ADQL statement cannot be null or empty", adql, 0, 1, 0);
        }

        log.debug("Parsing ADQL statement: {}", adql.substring(0, Math.min(100, adql.length())));

        List<ParseResult.SyntaxError> errors = new ArrayList<>();
        CharStream input = CharStreams.fromString(adql);
        AdqlLexer lexer = new AdqlLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new CollectingErrorListener(adql, errors));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        checkNesting(adql, tokens);

        AdqlParser parser = new AdqlParser(tokens);
        parser.setInterpreter(new ParserATNSimulator(parser, AdqlParser._ATN, decisionToDFA, contextCache));
        AdqlParser.StatementContext tree;

        // Stage 1: Try SLL(*) mode (fast path)
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        try {
            log.trace("Attempting SLL(*) parse");
            tree = parser.statement();
            log.trace("SLL(*) parse succeeded");
        } catch (ParseCancellationException sllException) {
            log.trace("SLL(*) parse failed, falling back to LL(*)");

            // Stage 2: Retry with LL(*) mode; errors are collected, the first one counts
            tokens.seek(0);
            parser.reset();
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.addErrorListener(new CollectingErrorListener(adql, errors));
            tree = parser.statement();
            log.debug("LL(*) parse completed with {} error(s)", errors.size());
        }

        return new ParseResult(tree, errors, adql);
    }

    private static void checkNesting(String adql, CommonTokenStream tokens) {
        int depth = 0;
        for (Token token : tokens.getTokens()) {
            if (token.getType() == AdqlLexer.LPAREN) {
                depth++;
                if (depth > MAX_NESTING_DEPTH) {
                    throw new AdqlSyntaxException("Statement nested too deeply (more than "
                            + MAX_NESTING_DEPTH + " levels of parentheses)",
                            adql, token.getStartIndex(), token.getLine(), token.getCharPositionInLine());
                }
            } else if (token.getType() == AdqlLexer.RPAREN) {
                depth--;
            }
        }
    }

    /**
     * Character offset of a line/column position.
     */
    static int offsetOf(String source, int line, int column) {
        int offset = 0;
        for (int currentLine = 1; currentLine < line && offset < source.length(); offset++) {
            if (source.charAt(offset) == '\n') {
                currentLine++;
            }
        }
        return Math.min(offset + column, source.length());
    }

    private static class CollectingErrorListener extends BaseErrorListener {

        private final String source;
        private final List<ParseResult.SyntaxError> errors;

        CollectingErrorListener(String source, List<ParseResult.SyntaxError> errors) {
            this.source = source;
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            int offset = offendingSymbol instanceof Token && ((Token) offendingSymbol).getStartIndex() >= 0
                    ? ((Token) offendingSymbol).getStartIndex()
                    : offsetOf(source, line, charPositionInLine);
            ParseResult.SyntaxError error = new ParseResult.SyntaxError(offset, line, charPositionInLine, msg);
            errors.add(error);
            log.warn("Parse error: {}", error);
        }
    }
}
