package com.e2eq.aiql.parser;

import com.e2eq.aiql.ast.Program;
import com.e2eq.aiql.lexer.AiqlLexer;
import com.e2eq.aiql.lexer.LexerOptions;
import com.e2eq.aiql.lexer.Token;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for turning AIQL source into a {@link Program}, from a string, a file or a
 * classpath resource. Lexing and parsing errors propagate unchanged to the caller.
 */
@ApplicationScoped
public class AiqlProgramLoader {

    private static final Logger LOG = Logger.getLogger(AiqlProgramLoader.class);

    private final LexerOptions lexerOptions;

    public AiqlProgramLoader() {
        this(LexerOptions.DEFAULT_MAX_INPUT_SIZE);
    }

    @Inject
    public AiqlProgramLoader(@ConfigProperty(name = "quantum.aiql.lexer.max-input-size", defaultValue = "10485760")
                             int maxInputSize) {
        this.lexerOptions = LexerOptions.defaults().withMaxInputSize(maxInputSize);
    }

    public Program parse(String source) {
        List<Token> tokens = new AiqlLexer(source, lexerOptions).tokenize();
        Program program = new AiqlParser(tokens).parse();
        LOG.debugf("Parsed %d tokens into %d top-level nodes", tokens.size(), program.body().size());
        return program;
    }

    public Program loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public Program loadFromPath(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public Program load(InputStream in) throws IOException {
        return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    public LexerOptions lexerOptions() {
        return lexerOptions;
    }
}
