package io.github.cyfko.zapformat.core.api;

import io.github.cyfko.zapformat.core.ast.ZapConfiguration;
import io.github.cyfko.zapformat.core.exception.ZapParseException;
import io.github.cyfko.zapformat.core.model.Token;

import java.util.List;

/**
 * Parser contract turning a Zap token sequence into a {@link ZapConfiguration}.
 * <p>
 * Implementations work off any token list that follows the lexer contract: tokens in source
 * order, {@code NEWLINE} tokens kept, a single {@code EOF} token last. {@code WHITESPACE}
 * tokens, if a token source produces them, are ignored.
 * </p>
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * config     := (option | comment | event | funct | namespace | typedef)*
 * option     := 'opt' IDENT '=' (STRING | NUMBER | BOOLEAN | IDENT)
 * event      := 'event' IDENT '=' '{' (('from'|'type'|'call') ':' IDENT | 'data' ':' type)* '}'
 * funct      := 'funct' IDENT '=' '{' ('call' ':' IDENT | ('args'|'rets') ':' type)* '}'
 * namespace  := 'namespace' IDENT '=' '{' (comment | event | funct)* '}'
 * typedef    := 'type' IDENT '=' type
 * type       := optional ('|' optional)*
 * optional   := base ('[' range? ']')* '?'?
 * base       := tuple | map | set | instance | enum | struct | vector | primitive
 * range      := NUMBER | NUMBER '..' | '..' NUMBER | NUMBER '..' NUMBER | '..'
 * </pre>
 *
 * <h2>Error Detection</h2>
 * <p>
 * Parsing is fail-fast: the first token that does not fit raises a {@link ZapParseException}
 * naming the token kind and its line. There is no recovery and no partial result.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ZapParser {

    /**
     * Parses a token sequence into a configuration AST.
     *
     * @param tokens tokens produced by the lexer, terminated by {@code EOF}
     * @return the configuration root
     * @throws ZapParseException on the first syntax error
     * @throws IllegalArgumentException if {@code tokens} is null, empty or not terminated by {@code EOF}
     */
    ZapConfiguration parse(List<Token> tokens) throws ZapParseException;
}
