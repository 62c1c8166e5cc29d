package io.github.eutro.qdebug.assertion;

import io.github.eutro.qdebug.util.Strings;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the built-in assertions:
 * <pre>
 * assert-ent q[0], q[1];
 * assert-sup q;
 * assert-eq 0.9, q[0], q[1] { 0.707, 0, 0, 0.707 }
 * assert-eq q[0], q[1] { h q[0]; cx q[0], q[1]; }
 * </pre>
 * An equality assertion compares against a statevector if its block is a comma-separated
 * list of amplitudes, and against a circuit if the block contains any {@code ;}.
 */
public class DefaultAssertionParser implements AssertionParser {
    public static final DefaultAssertionParser INSTANCE = new DefaultAssertionParser();

    private static final String PREFIX = "assert-";
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    @Override
    public boolean isAssertion(String code) {
        return Strings.trim(code).startsWith(PREFIX);
    }

    @Override
    public @NotNull Assertion parse(String code, String blockCode) {
        String trimmed = Strings.trim(code);
        if (trimmed.endsWith(";")) trimmed = Strings.trim(trimmed.substring(0, trimmed.length() - 1));
        int keywordEnd = 0;
        while (keywordEnd < trimmed.length() && !Character.isWhitespace(trimmed.charAt(keywordEnd))) keywordEnd++;
        String keyword = trimmed.substring(0, keywordEnd);
        List<String> args = arguments(trimmed.substring(keywordEnd));

        switch (keyword) {
            case "assert-ent":
                return new EntanglementAssertion(args);
            case "assert-sup":
                return new SuperpositionAssertion(args);
            case "assert-eq":
                return parseEquality(args, blockCode);
            default:
                throw new AssertionSyntaxException("Unknown assertion " + keyword + ".");
        }
    }

    private static Assertion parseEquality(List<String> args, String blockCode) {
        double similarity = EqualityAssertion.DEFAULT_SIMILARITY;
        if (!args.isEmpty() && NUMBER.matcher(args.get(0)).matches()) {
            similarity = Double.parseDouble(args.get(0));
            args = args.subList(1, args.size());
        }
        if (Strings.trim(blockCode).isEmpty()) {
            throw new AssertionSyntaxException("Equality assertion requires a block.");
        }
        if (blockCode.indexOf(';') != -1) {
            return new CircuitEqualityAssertion(args, similarity, blockCode);
        }
        List<Complex> amplitudes = new ArrayList<>();
        for (String amplitude : Strings.split(blockCode, ',')) {
            amplitudes.add(Complex.parse(amplitude));
        }
        return new StatevectorEqualityAssertion(args, similarity, amplitudes);
    }

    private static List<String> arguments(String text) {
        String joined = Strings.removeWhitespace(text);
        List<String> args = new ArrayList<>();
        if (joined.isEmpty()) return args;
        args.addAll(Strings.split(joined, ','));
        return args;
    }
}
