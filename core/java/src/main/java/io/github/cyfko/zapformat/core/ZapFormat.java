package io.github.cyfko.zapformat.core;

import io.github.cyfko.zapformat.core.api.ZapParser;
import io.github.cyfko.zapformat.core.ast.ZapConfiguration;
import io.github.cyfko.zapformat.core.config.FormatPolicy;
import io.github.cyfko.zapformat.core.config.ParserPolicy;
import io.github.cyfko.zapformat.core.exception.ZapFormatException;
import io.github.cyfko.zapformat.core.exception.ZapSyntaxException;
import io.github.cyfko.zapformat.core.formatting.ZapFormatter;
import io.github.cyfko.zapformat.core.impl.BasicZapParser;
import io.github.cyfko.zapformat.core.lexing.ZapLexer;
import io.github.cyfko.zapformat.core.model.Token;
import io.github.cyfko.zapformat.core.utils.ValidationResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Logger;

/**
 * High-level facade of the Zap toolchain.
 * <p>
 * Chains {@link ZapLexer}, a {@link ZapParser} and a {@link ZapFormatter} behind the three
 * operations a host (typically a CLI {@code format} command) needs:
 * </p>
 * <ol>
 *   <li><strong>format</strong>: source text to canonical text</li>
 *   <li><strong>formatFile</strong>: read a {@code .zap} file, then format its content</li>
 *   <li><strong>validate</strong>: lex and parse only, report success or the first error</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * ZapFormat zap = ZapFormat.defaults();
 *
 * ValidationResult result = zap.validate(source);
 * if (result.isValid()) {
 *     String canonical = zap.format(source);
 * }
 *
 * String fromDisk = zap.formatFile(Path.of("net.zap"));
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link ZapFormatException} - {@code format} failed, message prefixed with
 *       {@code "Zap formatting error: "}, cause is the original {@link ZapSyntaxException}</li>
 *   <li>{@link IOException} - the file could not be read</li>
 *   <li>{@code validate} never throws</li>
 * </ul>
 *
 * <p>Writing the result back to disk is left to the caller, which keeps the original file
 * untouched when formatting fails. Instances are immutable and thread-safe.</p>
 *
 * @see ZapParser
 * @see ZapFormatter
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ZapFormat {

    private static final Logger log = Logger.getLogger(ZapFormat.class.getName());

    static final String FORMATTING_ERROR_PREFIX = "Zap formatting error: ";

    private final ZapParser parser;
    private final ZapFormatter formatter;

    private ZapFormat(ZapParser parser, ZapFormatter formatter) {
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.formatter = Objects.requireNonNull(formatter, "Formatter cannot be null");
    }

    /**
     * Creates a facade with the {@link BasicZapParser} and the canonical layout.
     *
     * @return a new facade
     */
    public static ZapFormat defaults() {
        return new ZapFormat(new BasicZapParser(), new ZapFormatter());
    }

    /**
     * Creates a facade with the {@link BasicZapParser} and a custom layout.
     *
     * @param policy layout settings
     * @return a new facade
     * @throws IllegalArgumentException if policy is null
     */
    public static ZapFormat of(FormatPolicy policy) {
        return new ZapFormat(new BasicZapParser(), new ZapFormatter(policy));
    }

    /**
     * Creates a facade with a {@link BasicZapParser} bound to the given limits and a custom layout.
     *
     * @param parserPolicy parser complexity limits
     * @param formatPolicy layout settings
     * @return a new facade
     * @throws IllegalArgumentException if a policy is null
     */
    public static ZapFormat of(ParserPolicy parserPolicy, FormatPolicy formatPolicy) {
        return new ZapFormat(new BasicZapParser(parserPolicy), new ZapFormatter(formatPolicy));
    }

    /**
     * Creates a facade with the given parser and formatter.
     *
     * @param parser    the parser to use
     * @param formatter the formatter to use
     * @return a new facade
     * @throws NullPointerException if an argument is null
     */
    public static ZapFormat of(ZapParser parser, ZapFormatter formatter) {
        return new ZapFormat(parser, formatter);
    }

    /**
     * @param source the source text
     * @return the token sequence, terminated by {@code EOF}
     * @throws ZapSyntaxException on a lexing error
     */
    public List<Token> tokenize(String source) {
        return ZapLexer.tokenize(source);
    }

    /**
     * @param source the source text
     * @return the parsed configuration
     * @throws ZapSyntaxException on the first lexing or parsing error
     */
    public ZapConfiguration parse(String source) {
        return parser.parse(ZapLexer.tokenize(source));
    }

    /**
     * Formats a Zap source text into its canonical form.
     *
     * @param source the source text
     * @return the formatted text
     * @throws ZapFormatException if the text cannot be lexed, parsed or formatted
     * @throws IllegalArgumentException if source is null
     */
    public String format(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Zap source cannot be null");
        }

        long start = System.nanoTime();
        try {
            String formatted = formatter.format(parse(source));
            log.fine(() -> String.format(
                    "Formatted %d characters in %d ms",
                    source.length(),
                    (System.nanoTime() - start) / 1_000_000
            ));
            return formatted;
        } catch (ZapSyntaxException | ZapFormatException e) {
            throw new ZapFormatException(FORMATTING_ERROR_PREFIX + e.getMessage(), e);
        }
    }

    /**
     * Reads a UTF-8 {@code .zap} file and formats its content.
     *
     * @param path the file to read
     * @return the formatted text
     * @throws IOException if the file cannot be read
     * @throws ZapFormatException if the content cannot be formatted
     */
    public String formatFile(Path path) throws IOException {
        return formatFile(path, StandardCharsets.UTF_8);
    }

    /**
     * Reads a {@code .zap} file with the given charset and formats its content.
     *
     * @param path    the file to read
     * @param charset the file encoding
     * @return the formatted text
     * @throws IOException if the file cannot be read
     * @throws ZapFormatException if the content cannot be formatted
     */
    public String formatFile(Path path, Charset charset) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(charset, "Charset cannot be null");

        log.fine(() -> "Reading Zap configuration from " + path);
        return format(Files.readString(path, charset));
    }

    /**
     * Asynchronous {@link #formatFile(Path)} on the common fork-join pool.
     *
     * @param path the file to read
     * @return a future completed with the formatted text, or exceptionally with an
     *         {@link UncheckedIOException} or a {@link ZapFormatException}
     */
    public CompletableFuture<String> formatFileAsync(Path path) {
        return formatFileAsync(path, ForkJoinPool.commonPool());
    }

    /**
     * Asynchronous {@link #formatFile(Path)} on the given executor.
     *
     * @param path     the file to read
     * @param executor executor running the read and the formatting
     * @return a future completed with the formatted text
     */
    public CompletableFuture<String> formatFileAsync(Path path, Executor executor) {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(executor, "Executor cannot be null");

        return CompletableFuture.supplyAsync(() -> {
            try {
                return formatFile(path);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor);
    }

    /**
     * Checks that a source text lexes and parses. Never throws.
     *
     * @param source the source text
     * @return success, or a failure carrying the first error message
     */
    public ValidationResult validate(String source) {
        try {
            parse(source);
            return ValidationResult.success();
        } catch (RuntimeException e) {
            log.fine(() -> "Zap validation failed: " + e.getMessage());
            return ValidationResult.failure(e);
        }
    }
}
