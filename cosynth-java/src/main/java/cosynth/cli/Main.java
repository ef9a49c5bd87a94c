package cosynth.cli;

import cosynth.ast.DesignUnit;
import cosynth.backend.TextBackend;
import cosynth.compiler.CompiledDesign;
import cosynth.compiler.DesignCompiler;
import cosynth.diag.Diagnostic;
import cosynth.diag.SyntaxException;
import cosynth.lexer.Lexer;
import cosynth.lexer.Token;
import cosynth.parser.Parser;
import cosynth.settings.Configuration;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Main {
    private static final String USAGE =
            "Usage: cosynth [--set key=value]... [--settings file.properties] <input.cosy> [output.txt]";

    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    static int run(String[] args) throws Exception {
        Configuration config = new Configuration();
        List<String> files = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--set" -> config.parseAssignment(argument(args, ++i, "--set"));
                    case "--settings" -> config.load(Path.of(argument(args, ++i, "--settings")));
                    default -> files.add(args[i]);
                }
            }
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 2;
        }
        if (files.isEmpty() || files.size() > 2) {
            System.err.println(USAGE);
            return 2;
        }

        Path input = Path.of(files.get(0));
        Path output = files.size() == 2
                ? Path.of(files.get(1))
                : Path.of(input.toString().replaceFirst("\\.cosy$", "") + ".txt");
        String entity = input.getFileName().toString().replaceFirst("\\.cosy$", "");

        // 1. Read
        String source = Files.readString(input);
        System.out.println("[1/4] Reading: " + input);

        DesignUnit design;
        try {
            // 2. Lexer
            List<Token> tokens = new Lexer(source).tokenize();
            System.out.println("[2/4] Lexer: " + tokens.size() + " tokens");

            // 3. Parser
            design = new Parser(tokens).parseDesign(entity);
            System.out.println("[3/4] Parser: " + design.contexts().size() + " contexts, "
                    + design.functions().size() + " functions");
        } catch (SyntaxException e) {
            System.err.println(input + ":" + e.getMessage());
            return 1;
        }

        // 4. Compile and lower
        TextBackend backend = new TextBackend();
        CompiledDesign compiled = new DesignCompiler(config).compile(design, backend);
        System.out.println("[4/4] Compiler: " + compiled.contexts().size() + " of "
                + design.contexts().size() + " contexts compiled");

        for (Diagnostic d : compiled.diagnostics().sorted()) {
            System.err.println(input + ":" + d);
        }
        if (compiled.hasErrors()) {
            System.err.println("\n✗ Failed: " + compiled.diagnostics().errors().size() + " error(s)");
            return 1;
        }

        Files.writeString(output, backend.text());
        System.out.println("\n✓ Success: " + output);
        System.out.println("  Contexts: " + compiled.contexts().size());
        System.out.println("  States:   " + compiled.contexts().values().stream()
                .filter(c -> c.graph() != null)
                .mapToInt(c -> c.graph().size())
                .sum());
        System.out.println("  Warnings: " + compiled.diagnostics().warnings().size());
        return 0;
    }

    private static String argument(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }
}
