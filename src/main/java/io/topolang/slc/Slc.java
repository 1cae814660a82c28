package io.topolang.slc;

/**
 * Top-level entry points: lambda calculus text in, canonical set text out.
 */
public final class Slc {
    private Slc() {}

    /**
     * Parses and converts a term.
     * @throws SlcException on any lexing, parsing or conversion failure
     */
    public static SetTerm convert(String ulc, Encoding encoding, Settings settings) {
        Node ast = Parser.parse(ulc, settings);
        return new Converter(encoding, settings).convert(ast);
    }

    public static SetTerm convert(String ulc, Encoding encoding) {
        return convert(ulc, encoding, Settings.defaults());
    }

    /** {@code \x.\y.x} renders {@code {λ, {λ, 2}}}. */
    public static String toDeBruijn(String ulc) {
        return convert(ulc, Encoding.DE_BRUIJN).toString();
    }

    public static String toNamed(String ulc) {
        return convert(ulc, Encoding.NAMED).toString();
    }

    public static String toSymbolic(String ulc) {
        return convert(ulc, Encoding.SYMBOLIC).toString();
    }

    /**
     * Brace skeleton of rendered set text; see {@link StructureParser}.
     */
    public static SetTerm parseStructure(String text) {
        return StructureParser.parse(text);
    }
}
