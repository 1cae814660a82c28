package io.topolang.slc.cli;

import io.topolang.slc.Encoding;
import io.topolang.slc.SlcException;
import io.topolang.slc.Slc;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end.
 *
 * <pre>
 * slc [--mode=debruijn|named|symbolic|all] TERM...   convert each term ("-" reads stdin)
 * slc --structure TEXT...                            print the brace skeleton of set text
 * slc                                                show the standard combinators
 * </pre>
 */
public final class Main {
    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String[][] DEMO = {
        {"Identity", "\\x.x"},
        {"K-Combinator", "\\x.\\y.x"},
        {"S-Combinator", "\\x.\\y.\\z.((x z)(y z))"},
        {"Fixed-Point Combinator", "(\\f.(\\x.f (x x)) (\\x.f (x x)))"},
    };

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        String mode = "all";
        boolean structure = false;
        List<String> inputs = new ArrayList<>();
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                usage(out);
                return OK;
            } else if (arg.equals("--structure")) {
                structure = true;
            } else if (arg.startsWith("--mode=")) {
                mode = arg.substring("--mode=".length());
            } else if (arg.startsWith("--")) {
                err.println("unknown option: " + arg);
                usage(err);
                return USAGE;
            } else {
                inputs.add(arg);
            }
        }
        if (!List.of("all", "debruijn", "named", "symbolic").contains(mode)) {
            err.println("unknown mode: " + mode);
            usage(err);
            return USAGE;
        }

        try {
            if (inputs.isEmpty()) {
                if (structure) {
                    usage(err);
                    return USAGE;
                }
                for (String[] demo : DEMO) {
                    out.println(demo[0] + ":");
                    display(demo[1], out);
                }
                return OK;
            }
            for (String input : inputs) {
                String text = input.equals("-") ? IOUtils.toString(in, StandardCharsets.UTF_8).trim() : input;
                if (structure) {
                    out.println(Slc.parseStructure(text));
                } else if (mode.equals("all")) {
                    display(text, out);
                } else {
                    out.println(Slc.convert(text, encoding(mode)));
                }
            }
            return OK;
        } catch (SlcException e) {
            err.println("error: " + e.getMessage());
            return FAILED;
        } catch (IOException e) {
            err.println("error: cannot read standard input: " + e.getMessage());
            return FAILED;
        }
    }

    private static void display(String ulc, PrintStream out) {
        String deBruijn = Slc.toDeBruijn(ulc);
        String named = Slc.toNamed(ulc);
        out.println("λ: " + ulc);
        out.println("De Bruijn: " + deBruijn);
        out.println("SLC: " + named);
        out.println();
    }

    private static Encoding encoding(String mode) {
        return switch (mode) {
            case "debruijn" -> Encoding.DE_BRUIJN;
            case "named" -> Encoding.NAMED;
            default -> Encoding.SYMBOLIC;
        };
    }

    private static void usage(PrintStream out) {
        out.println("usage: slc [--mode=debruijn|named|symbolic|all] TERM...");
        out.println("       slc --structure TEXT...");
        out.println("With no TERM, prints the standard combinators. Use - to read a term from stdin.");
    }
}
